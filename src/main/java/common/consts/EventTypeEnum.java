package common.consts;

/**
 * 审计日志中的事件类型
 */
public enum EventTypeEnum {
    ELEVATOR_ASSIGNED,     // 已为呼梯请求分配电梯
    ASSIGNMENT_REJECTED,   // 呼梯请求被拒绝 (无可用电梯/幂等冲突)
    CALL_COMPLETED,        // 接客并送达完成
    CALL_FAILED,           // 运行过程中故障
    MAINTENANCE_CHANGED    // 检修标记变更
}
