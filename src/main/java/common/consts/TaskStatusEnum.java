package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 呼梯任务状态
 */
@Getter
@AllArgsConstructor
public enum TaskStatusEnum {
    RUNNING("执行中"),
    COMPLETED("已完成"),
    FAILED("失败");

    private final String desc;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
