package service.dispatch.impl;

import common.consts.DirectionEnum;
import common.consts.ElevatorStateEnum;
import lombok.extern.slf4j.Slf4j;
import model.dto.snapshot.ElevatorSnapshotDto;
import org.springframework.stereotype.Component;
import service.dispatch.DispatchAlgorithm;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 贪心派梯
 * 1. 优先选空闲电梯中离乘客最近的
 * 2. 没有空闲电梯时，选同向运行且乘客楼层在剩余行程内的电梯中最近的
 * 距离相同取编号最小者；检修中的电梯不参与。
 */
@Slf4j
@Component
public class GreedyDispatchAlgorithm implements DispatchAlgorithm {

    @Override
    public Optional<ElevatorSnapshotDto> select(List<ElevatorSnapshotDto> fleet, int fromFloor, int toFloor) {
        Comparator<ElevatorSnapshotDto> nearest = Comparator
                .comparingInt((ElevatorSnapshotDto e) -> Math.abs(e.getCurrentFloor() - fromFloor))
                .thenComparingInt(ElevatorSnapshotDto::getId);

        List<ElevatorSnapshotDto> idle = fleet.stream()
                .filter(e -> !e.isMaintenanceMode())
                .filter(e -> e.getState() == ElevatorStateEnum.IDLE)
                .collect(Collectors.toList());
        if (!idle.isEmpty()) {
            return idle.stream().min(nearest);
        }

        // 注意：相同楼层视为下行
        DirectionEnum required = toFloor > fromFloor ? DirectionEnum.UP : DirectionEnum.DOWN;
        List<ElevatorSnapshotDto> enRoute = fleet.stream()
                .filter(e -> !e.isMaintenanceMode())
                .filter(e -> e.getState() == ElevatorStateEnum.MOVING)
                .filter(e -> e.getDirection() == required)
                .filter(e -> canPickup(e, fromFloor))
                .collect(Collectors.toList());
        if (!enRoute.isEmpty()) {
            log.debug("无空闲电梯，候选顺路电梯: {}", enRoute.stream().map(ElevatorSnapshotDto::getId).collect(Collectors.toList()));
            return enRoute.stream().min(nearest);
        }

        return Optional.empty();
    }

    /**
     * 乘客楼层是否落在电梯剩余行程上（含两端）
     */
    public static boolean canPickup(ElevatorSnapshotDto elevator, int floor) {
        Integer destination = elevator.getDestinationFloor();
        if (destination == null) {
            return false;
        }
        if (elevator.getDirection() == DirectionEnum.UP) {
            return elevator.getCurrentFloor() <= floor && floor <= destination;
        }
        if (elevator.getDirection() == DirectionEnum.DOWN) {
            return destination <= floor && floor <= elevator.getCurrentFloor();
        }
        return false;
    }
}
