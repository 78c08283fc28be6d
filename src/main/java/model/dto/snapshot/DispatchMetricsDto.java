package model.dto.snapshot;

import lombok.Data;

/**
 * 调度计数
 */
@Data
public class DispatchMetricsDto {
    private long totalCalls;
    private long successfulAssignments;
    private long failedAssignments;
    private long idempotentReplays;
    private long completedCalls;
    private long failedCalls;
}
