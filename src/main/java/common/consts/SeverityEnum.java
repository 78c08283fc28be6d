package common.consts;

/**
 * 审计事件级别
 */
public enum SeverityEnum {
    INFO,
    WARNING,
    ERROR
}
