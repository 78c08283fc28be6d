package service.dispatch.impl;

import common.consts.DirectionEnum;
import common.consts.ElevatorStateEnum;
import model.dto.snapshot.ElevatorSnapshotDto;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("贪心派梯算法测试")
class GreedyDispatchAlgorithmTest {

    private final GreedyDispatchAlgorithm algorithm = new GreedyDispatchAlgorithm();

    private static ElevatorSnapshotDto idle(int id, int floor) {
        ElevatorSnapshotDto dto = new ElevatorSnapshotDto();
        dto.setId(id);
        dto.setCurrentFloor(floor);
        dto.setState(ElevatorStateEnum.IDLE);
        dto.setDirection(DirectionEnum.NONE);
        return dto;
    }

    private static ElevatorSnapshotDto moving(int id, int floor, DirectionEnum direction, int destination) {
        ElevatorSnapshotDto dto = new ElevatorSnapshotDto();
        dto.setId(id);
        dto.setCurrentFloor(floor);
        dto.setState(ElevatorStateEnum.MOVING);
        dto.setDirection(direction);
        dto.setDestinationFloor(destination);
        return dto;
    }

    private static ElevatorSnapshotDto withState(int id, int floor, ElevatorStateEnum state) {
        ElevatorSnapshotDto dto = moving(id, floor, DirectionEnum.UP, floor + 1);
        dto.setState(state);
        return dto;
    }

    @Test
    @DisplayName("空闲电梯中选离乘客最近的")
    void testNearestIdleWins() {
        List<ElevatorSnapshotDto> fleet = List.of(idle(1, 1), idle(2, 5), idle(3, 2));

        Optional<ElevatorSnapshotDto> chosen = algorithm.select(fleet, 3, 7);

        assertTrue(chosen.isPresent());
        assertEquals(3, chosen.get().getId(), "3 号梯距离为 1，应被选中");
    }

    @Test
    @DisplayName("距离相同时编号小的优先")
    void testTieBreakByLowestId() {
        List<ElevatorSnapshotDto> fleet = List.of(idle(2, 2), idle(1, 4), idle(3, 9));

        assertEquals(1, algorithm.select(fleet, 3, 1).orElseThrow().getId());
    }

    @Test
    @DisplayName("有空闲电梯时不考虑运行中的电梯")
    void testIdlePreferredOverEnRoute() {
        List<ElevatorSnapshotDto> fleet = List.of(moving(1, 4, DirectionEnum.UP, 9), idle(2, 10));

        assertEquals(2, algorithm.select(fleet, 5, 8).orElseThrow().getId());
    }

    @Test
    @DisplayName("顺路捎带：上行 2→8 的电梯可接 5 层，不能接 1 层")
    void testEnRoutePickup() {
        ElevatorSnapshotDto upward = moving(1, 2, DirectionEnum.UP, 8);
        List<ElevatorSnapshotDto> fleet = List.of(upward, withState(2, 6, ElevatorStateEnum.DOOR_OPENING));

        assertEquals(1, algorithm.select(fleet, 5, 9).orElseThrow().getId(), "5 层在剩余行程内");
        assertTrue(algorithm.select(fleet, 1, 3).isEmpty(), "1 层已经过，不能捎带");

        assertTrue(GreedyDispatchAlgorithm.canPickup(upward, 5));
        assertTrue(GreedyDispatchAlgorithm.canPickup(upward, 2), "当前楼层包含在内");
        assertTrue(GreedyDispatchAlgorithm.canPickup(upward, 8), "目的楼层包含在内");
        assertFalse(GreedyDispatchAlgorithm.canPickup(upward, 1));
        assertFalse(GreedyDispatchAlgorithm.canPickup(upward, 10));
    }

    @Test
    @DisplayName("方向不一致不能捎带")
    void testEnRouteRequiresSameDirection() {
        List<ElevatorSnapshotDto> fleet = List.of(moving(1, 2, DirectionEnum.UP, 8));

        assertTrue(algorithm.select(fleet, 5, 3).isEmpty(), "下行请求不能搭上行电梯");
    }

    @Test
    @DisplayName("下行电梯的行程区间按方向取")
    void testDownwardRoute() {
        ElevatorSnapshotDto downward = moving(1, 9, DirectionEnum.DOWN, 3);

        assertTrue(GreedyDispatchAlgorithm.canPickup(downward, 6));
        assertFalse(GreedyDispatchAlgorithm.canPickup(downward, 2));
        assertFalse(GreedyDispatchAlgorithm.canPickup(downward, 10));
        assertEquals(1, algorithm.select(List.of(downward), 6, 1).orElseThrow().getId());
    }

    @Test
    @DisplayName("顺路电梯中同样选最近的")
    void testNearestEnRoute() {
        List<ElevatorSnapshotDto> fleet = List.of(
                moving(1, 1, DirectionEnum.UP, 9),
                moving(2, 4, DirectionEnum.UP, 10),
                moving(3, 3, DirectionEnum.UP, 6));

        assertEquals(2, algorithm.select(fleet, 5, 6).orElseThrow().getId());
    }

    @Test
    @DisplayName("检修中和故障的电梯不参与派梯")
    void testMaintenanceAndErrorExcluded() {
        ElevatorSnapshotDto nearest = idle(1, 3);
        nearest.setMaintenanceMode(true);
        ElevatorSnapshotDto enRoute = moving(2, 2, DirectionEnum.UP, 8);
        enRoute.setMaintenanceMode(true);
        List<ElevatorSnapshotDto> fleet = List.of(nearest, enRoute, withState(3, 3, ElevatorStateEnum.ERROR), idle(4, 9));

        assertEquals(4, algorithm.select(fleet, 3, 5).orElseThrow().getId());

        List<ElevatorSnapshotDto> unavailable = List.of(nearest, enRoute, withState(3, 3, ElevatorStateEnum.ERROR));
        assertTrue(algorithm.select(unavailable, 3, 5).isEmpty());
    }

    @Test
    @DisplayName("起止楼层相同按下行处理")
    void testSameFloorTreatedAsDown() {
        List<ElevatorSnapshotDto> fleet = List.of(moving(1, 7, DirectionEnum.DOWN, 2), moving(2, 2, DirectionEnum.UP, 8));

        assertEquals(1, algorithm.select(fleet, 5, 5).orElseThrow().getId());
    }
}
