package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";
    public static final String BAD_REQUEST_BODY = "请求参数格式错误，楼层必须为整数";

    // 调度错误
    public static final String NO_AVAILABLE_ELEVATOR = "当前没有可用的电梯";
    public static final String DISPATCHER_SHUTDOWN = "调度器已停止，不再接受呼梯请求";
    public static final String ELEVATOR_NOT_FOUND = "指定的电梯不存在";

    // 参数错误
    public static final String FLOOR_REQUIRED = "%s不能为空";
    public static final String FLOOR_OUT_OF_RANGE = "%s必须在 1-%d 之间，实际为 %d";
    public static final String IDEMPOTENCY_CONFLICT = "幂等键 [%s] 已被不同的请求内容使用";
}
