package model.dto.snapshot;

import common.consts.DirectionEnum;
import common.consts.ElevatorStateEnum;
import lombok.Data;

import java.time.Instant;

/**
 * 对外暴露的电梯状态快照 DTO
 * 同时作为持久化网关的写入行，避免外部直接持有电梯实体。
 */
@Data
public class ElevatorSnapshotDto {
    private int id;
    private int currentFloor;
    private ElevatorStateEnum state;
    private DirectionEnum direction;
    private Integer destinationFloor;

    private int tripsCompleted;
    private boolean maintenanceMode;

    private Instant lastUpdated;
}
