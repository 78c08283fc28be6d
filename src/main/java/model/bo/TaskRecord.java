package model.bo;

import common.consts.TaskStatusEnum;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 呼梯任务记录（不可变快照，状态变化时整体替换）
 */
@Value
@Builder(toBuilder = true)
public class TaskRecord {
    String taskId;
    Integer elevatorId;
    Integer fromFloor;
    Integer toFloor;
    String callerId;

    TaskStatusEnum status;
    String reason;          // 仅 FAILED 时有值

    Instant createdAt;
    Instant finishedAt;

    /**
     * 是否仍被登记。未登记或已被清理的任务按约定视为已完成
     */
    @Builder.Default
    boolean tracked = true;

    public static TaskRecord untracked(String taskId) {
        return TaskRecord.builder()
                .taskId(taskId)
                .status(TaskStatusEnum.COMPLETED)
                .tracked(false)
                .build();
    }

    public TaskRecord completed(Instant at) {
        return toBuilder().status(TaskStatusEnum.COMPLETED).finishedAt(at).build();
    }

    public TaskRecord failed(String reason, Instant at) {
        return toBuilder().status(TaskStatusEnum.FAILED).reason(reason).finishedAt(at).build();
    }
}
