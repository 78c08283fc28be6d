package common.consts;

/**
 * 系统整体健康度：所有电梯都不空闲时为 BUSY
 */
public enum SystemHealthEnum {
    HEALTHY,
    BUSY
}
