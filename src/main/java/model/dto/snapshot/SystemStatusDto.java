package model.dto.snapshot;

import common.consts.SystemHealthEnum;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 电梯群整体状态快照 DTO
 */
@Data
public class SystemStatusDto {
    private List<ElevatorSnapshotDto> elevators;

    /**
     * 正在执行的呼梯任务数
     */
    private int activeTasks;

    private SystemHealthEnum systemHealth;
    private DispatchMetricsDto metrics;
    private Instant timestamp;
}
