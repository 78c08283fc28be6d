package engine;

import common.consts.EventTypeEnum;
import common.consts.SeverityEnum;
import lombok.extern.slf4j.Slf4j;
import model.bo.TaskRecord;
import model.entity.ElevatorUnit;
import service.persistence.BestEffortPersistence;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * 派梯第二阶段：在工作线程上驱动电梯先去接人再去送达
 * 不持有调度器全局锁；结束时把终态写入任务登记表并返回。
 */
@Slf4j
public class CallExecution implements Supplier<TaskRecord> {

    private final ElevatorUnit unit;
    private final TaskRecord task;
    private final TaskRegistry registry;
    private final BestEffortPersistence persistence;
    private final Clock clock;

    public CallExecution(ElevatorUnit unit, TaskRecord task, TaskRegistry registry,
                         BestEffortPersistence persistence, Clock clock) {
        this.unit = unit;
        this.task = task;
        this.registry = registry;
        this.persistence = persistence;
        this.clock = clock;
    }

    @Override
    public TaskRecord get() {
        int fromFloor = task.getFromFloor();
        int toFloor = task.getToFloor();
        try {
            // 接人
            if (unit.getCurrentFloor() != fromFloor) {
                unit.moveTo(fromFloor);
            }
            // 送达
            unit.moveTo(toFloor);

            persistence.upsertUnitState(unit.completeCall());
            TaskRecord completed = task.completed(clock.instant());
            if (!registry.finish(completed)) {
                // 电梯已在其他任务中故障，本任务已被判定失败
                log.warn("呼梯任务 [{}] 已被提前结束，忽略完成结果", task.getTaskId());
                return registry.find(task.getTaskId());
            }
            persistence.appendEvent(EventTypeEnum.CALL_COMPLETED,
                    String.format("完成呼梯 %d→%d", fromFloor, toFloor),
                    task.getCallerId(), unit.getId(), SeverityEnum.INFO);
            log.info("呼梯任务 [{}] 完成: 电梯 {} 已将乘客从 {} 层送达 {} 层",
                    task.getTaskId(), unit.getId(), fromFloor, toFloor);
            return completed;
        } catch (RuntimeException e) {
            log.error("呼梯任务 [{}] 失败，电梯 {} 置为故障", task.getTaskId(), unit.getId(), e);
            persistence.upsertUnitState(unit.markError());
            TaskRecord failed = task.failed(e.getMessage(), clock.instant());
            if (fail(failed)) {
                failCoScheduled(e.getMessage());
                return failed;
            }
            return registry.find(task.getTaskId());
        }
    }

    /**
     * 故障为终态，同一台电梯上还在排队的任务不可能再完成
     */
    private void failCoScheduled(String cause) {
        String reason = String.format("电梯 [%d] 在其他任务中发生故障: %s", unit.getId(), cause);
        for (TaskRecord other : registry.activeOn(unit.getId())) {
            if (!other.getTaskId().equals(task.getTaskId()) && fail(other.failed(reason, clock.instant()))) {
                log.warn("呼梯任务 [{}] 随电梯 {} 故障一并失败", other.getTaskId(), unit.getId());
            }
        }
    }

    private boolean fail(TaskRecord failed) {
        if (!registry.finish(failed)) {
            return false;
        }
        persistence.appendEvent(EventTypeEnum.CALL_FAILED,
                String.format("呼梯 %d→%d 失败: %s", failed.getFromFloor(), failed.getToFloor(), failed.getReason()),
                failed.getCallerId(), unit.getId(), SeverityEnum.ERROR);
        return true;
    }
}
