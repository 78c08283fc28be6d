package service.dispatch;

import common.config.ElevatorConfig;
import common.consts.ElevatorStateEnum;
import common.consts.EventTypeEnum;
import common.consts.SeverityEnum;
import common.consts.SystemHealthEnum;
import common.consts.TaskStatusEnum;
import common.exception.DispatcherShutdownException;
import common.exception.ElevatorNotFoundException;
import common.exception.IdempotencyConflictException;
import common.exception.InvalidFloorException;
import common.exception.NoAvailableElevatorException;
import engine.MotionClock;
import model.bo.TaskRecord;
import model.dto.response.AssignmentResult;
import model.dto.snapshot.ElevatorSnapshotDto;
import model.dto.snapshot.SystemStatusDto;
import model.entity.ElevatorUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import service.dispatch.impl.GreedyDispatchAlgorithm;
import service.persistence.PersistenceGateway;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 调度器测试
 * 覆盖选梯、预计到达时间、幂等、并发预占与故障隔离
 */
@DisplayName("调度器测试")
@Timeout(30)
class DispatchServiceTest {

    private static final MotionClock INSTANT = seconds -> { };

    private ElevatorConfig config;
    private PersistenceGateway gateway;
    private CountDownLatch release;
    private MotionClock blocking;
    private Clock wallClock;
    private final List<DispatchService> dispatchers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        config = new ElevatorConfig();
        config.setNumFloors(10);
        config.setFloorMoveTime(2.0);
        config.setDoorTime(1.0);
        config.setIdempotencyTtlSeconds(600);
        config.setTaskHistoryCapacity(100);
        gateway = mock(PersistenceGateway.class);
        release = new CountDownLatch(1);
        blocking = seconds -> release.await();
        wallClock = Clock.systemUTC();
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        dispatchers.forEach(DispatchService::shutdown);
    }

    private List<ElevatorUnit> fleet(MotionClock... clocks) {
        List<ElevatorUnit> units = new ArrayList<>();
        for (int i = 0; i < clocks.length; i++) {
            units.add(new ElevatorUnit(i + 1, config, gateway, clocks[i], wallClock));
        }
        return units;
    }

    private DispatchService dispatcher(List<ElevatorUnit> units, Clock clock) {
        DispatchService service = new DispatchService(units, config, new GreedyDispatchAlgorithm(), gateway,
                Executors.newFixedThreadPool(units.size() * 2), clock);
        dispatchers.add(service);
        return service;
    }

    private DispatchService dispatcher(MotionClock... clocks) {
        return dispatcher(fleet(clocks), wallClock);
    }

    private TaskRecord await(DispatchService service, String taskId) throws Exception {
        return service.getTaskCompletion(taskId).get(10, TimeUnit.SECONDS);
    }

    private ElevatorSnapshotDto unit(DispatchService service, int id) {
        return service.getStatus().getElevators().stream()
                .filter(e -> e.getId() == id)
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("选最近的空闲电梯：1、5、2 层的三台梯，3 层呼梯选 3 号")
    void testIdleSelectionDeterminism() {
        List<ElevatorUnit> units = fleet(INSTANT, INSTANT, INSTANT);
        units.get(1).moveTo(5);
        units.get(2).moveTo(2);
        DispatchService service = dispatcher(units, wallClock);

        AssignmentResult result = service.assign(3, 7, "tester", null);

        assertEquals(3, result.getElevatorId(), "3 号梯距离为 1");
        assertNotNull(result.getTaskId());
    }

    @Test
    @DisplayName("两台空闲电梯距离相同时选编号小的")
    void testTieBreak() {
        DispatchService service = dispatcher(blocking, blocking);

        assertEquals(1, service.assign(4, 8, "tester", null).getElevatorId());
    }

    @Test
    @DisplayName("预计到达时间：空闲梯在 1 层，去 5 层接人 = 4×2.0 + 2×1.0 + 2×1.0 = 12 秒")
    void testEtaForIdleUnit() {
        DispatchService service = dispatcher(blocking);

        AssignmentResult result = service.assign(5, 8, "tester", null);

        assertEquals(12.0, result.getEstimatedArrivalTime(), 1e-9);
    }

    @Test
    @DisplayName("预计到达时间：电梯已在接人楼层时只计目的楼层的开关门")
    void testEtaWhenAlreadyAtPickupFloor() {
        DispatchService service = dispatcher(blocking);

        AssignmentResult result = service.assign(1, 5, "tester", null);

        assertEquals(2.0, result.getEstimatedArrivalTime(), 1e-9);
    }

    @Test
    @DisplayName("预计到达时间：运行中的电梯先到原目的楼层再折返")
    void testEtaForEnRouteUnit() {
        DispatchService service = dispatcher(blocking);
        service.assign(1, 8, "first", null);

        AssignmentResult second = service.assign(3, 6, "second", null);

        assertEquals(1, second.getElevatorId(), "上行途中可以顺路接 3 层");
        // (|1-8| + |8-3|) × 2.0 + 2×1.0 + 2×1.0
        assertEquals(28.0, second.getEstimatedArrivalTime(), 1e-9);
    }

    @Test
    @DisplayName("不顺路时没有可用电梯")
    void testNoAvailableWhenNotOnRoute() {
        DispatchService service = dispatcher(blocking);
        service.assign(1, 8, "first", null);

        assertThrows(NoAvailableElevatorException.class, () -> service.assign(9, 2, "second", null));
        verify(gateway).appendEvent(eq(EventTypeEnum.ASSIGNMENT_REJECTED), anyString(), eq("second"),
                isNull(), eq(SeverityEnum.WARNING));
    }

    @Test
    @DisplayName("相同幂等键相同请求返回首次结果且不新建任务")
    void testIdempotentReplay() {
        DispatchService service = dispatcher(blocking, blocking);

        AssignmentResult first = service.assign(3, 7, "tester", "key-1");
        AssignmentResult replay = service.assign(3, 7, "other-caller", "key-1");

        assertEquals(first, replay, "应原样返回首次派梯结果");
        SystemStatusDto status = service.getStatus();
        assertEquals(1, status.getActiveTasks(), "不应创建第二个任务");
        assertEquals(1, status.getMetrics().getSuccessfulAssignments());
        assertEquals(1, status.getMetrics().getIdempotentReplays());
        assertEquals(ElevatorStateEnum.IDLE, unit(service, 2).getState(), "2 号梯不应被预占");
        verify(gateway, times(1)).appendEvent(eq(EventTypeEnum.ELEVATOR_ASSIGNED), anyString(), anyString(),
                any(), any());
    }

    @Test
    @DisplayName("相同幂等键不同请求内容报冲突")
    void testIdempotencyConflict() {
        DispatchService service = dispatcher(blocking, blocking);
        service.assign(3, 7, "tester", "key-1");

        IdempotencyConflictException e = assertThrows(IdempotencyConflictException.class,
                () -> service.assign(3, 8, "tester", "key-1"));

        assertEquals("key-1", e.getIdempotencyKey());
        assertEquals(1, service.getStatus().getActiveTasks());
    }

    @Test
    @DisplayName("幂等键过期后重新派梯")
    void testIdempotencyKeyExpires() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T08:00:00Z"));
        wallClock = clock;
        DispatchService service = dispatcher(INSTANT);

        AssignmentResult first = service.assign(2, 4, "tester", "key-ttl");
        await(service, first.getTaskId());
        clock.advance(Duration.ofSeconds(601));
        AssignmentResult second = service.assign(2, 4, "tester", "key-ttl");

        assertNotEquals(first.getTaskId(), second.getTaskId(), "过期后应创建新任务");
    }

    @Test
    @DisplayName("并发派梯：3 台空闲电梯，10 个并发请求，恰好 3 个成功")
    void testConcurrentAssignmentsReserveEachUnitOnce() throws Exception {
        DispatchService service = dispatcher(blocking, blocking, blocking);
        int callers = 10;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<AssignmentResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                String caller = "caller-" + i;
                Callable<AssignmentResult> call = () -> {
                    start.await();
                    // 下行请求，与已预占电梯的上行接人行程不顺路
                    return service.assign(5, 2, caller, null);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            List<AssignmentResult> successes = new ArrayList<>();
            int rejected = 0;
            for (Future<AssignmentResult> future : futures) {
                try {
                    successes.add(future.get(10, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    assertInstanceOf(NoAvailableElevatorException.class, e.getCause());
                    rejected++;
                }
            }

            assertEquals(3, successes.size());
            assertEquals(7, rejected);
            Set<Integer> elevators = successes.stream().map(AssignmentResult::getElevatorId).collect(Collectors.toSet());
            assertEquals(Set.of(1, 2, 3), elevators, "每台电梯只被预占一次");
            assertEquals(3, service.getStatus().getActiveTasks());
            assertEquals(SystemHealthEnum.BUSY, service.getStatus().getSystemHealth());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("完整呼梯：先接人再送达，结束后电梯空闲并累计行程")
    void testCallCompletes() throws Exception {
        DispatchService service = dispatcher(INSTANT);
        assertEquals(SystemHealthEnum.HEALTHY, service.getStatus().getSystemHealth());

        AssignmentResult result = service.assign(3, 6, "tester", null);
        TaskRecord done = await(service, result.getTaskId());

        assertEquals(TaskStatusEnum.COMPLETED, done.getStatus());
        TaskRecord polled = service.getTaskStatus(result.getTaskId());
        assertEquals(TaskStatusEnum.COMPLETED, polled.getStatus());
        assertTrue(polled.isTracked());

        ElevatorSnapshotDto snapshot = unit(service, 1);
        assertEquals(6, snapshot.getCurrentFloor());
        assertEquals(ElevatorStateEnum.IDLE, snapshot.getState());
        assertNull(snapshot.getDestinationFloor());
        assertEquals(1, snapshot.getTripsCompleted());
        assertEquals(0, service.getStatus().getActiveTasks());
        verify(gateway).appendEvent(eq(EventTypeEnum.CALL_COMPLETED), anyString(), eq("tester"),
                eq(1), eq(SeverityEnum.INFO));
    }

    @Test
    @DisplayName("运行中的任务状态为 RUNNING")
    void testRunningTaskStatus() {
        DispatchService service = dispatcher(blocking);

        AssignmentResult result = service.assign(2, 5, "tester", null);

        TaskRecord record = service.getTaskStatus(result.getTaskId());
        assertEquals(TaskStatusEnum.RUNNING, record.getStatus());
        assertEquals(1, record.getElevatorId());
        assertEquals(2, record.getFromFloor());
        assertEquals(5, record.getToFloor());
    }

    @Test
    @DisplayName("故障隔离：一台电梯故障只影响它自己的任务")
    void testFaultIsolation() throws Exception {
        MotionClock broken = seconds -> {
            throw new IllegalStateException("制动器故障");
        };
        DispatchService service = dispatcher(broken, INSTANT);

        AssignmentResult faulty = service.assign(3, 5, "tester", null);
        assertEquals(1, faulty.getElevatorId());
        TaskRecord failed = await(service, faulty.getTaskId());

        AssignmentResult healthy = service.assign(2, 4, "tester", null);
        assertEquals(2, healthy.getElevatorId(), "故障电梯不再参与派梯");
        TaskRecord completed = await(service, healthy.getTaskId());

        assertEquals(TaskStatusEnum.FAILED, failed.getStatus());
        assertTrue(failed.getReason().contains("制动器故障"), "失败原因应包含故障信息");
        assertEquals(TaskStatusEnum.COMPLETED, completed.getStatus());
        assertEquals(TaskStatusEnum.FAILED, service.getTaskStatus(faulty.getTaskId()).getStatus());

        assertEquals(ElevatorStateEnum.ERROR, unit(service, 1).getState());
        assertEquals(ElevatorStateEnum.IDLE, unit(service, 2).getState());
        assertEquals(4, unit(service, 2).getCurrentFloor());
        verify(gateway).appendEvent(eq(EventTypeEnum.CALL_FAILED), anyString(), eq("tester"),
                eq(1), eq(SeverityEnum.ERROR));
    }

    @Test
    @DisplayName("故障为终态：同一台电梯上顺路捎带的任务一并失败，电梯不会恢复空闲")
    void testFaultFailsCoScheduledTask() throws Exception {
        CountDownLatch bothAssigned = new CountDownLatch(1);
        MotionClock brokenAfterAssign = seconds -> {
            bothAssigned.await();
            throw new IllegalStateException("制动器故障");
        };
        DispatchService service = dispatcher(brokenAfterAssign);

        AssignmentResult first = service.assign(1, 8, "first", null);
        AssignmentResult second = service.assign(1, 5, "second", null);
        assertEquals(1, second.getElevatorId(), "上行途中顺路捎带");
        bothAssigned.countDown();

        TaskRecord firstDone = await(service, first.getTaskId());
        TaskRecord secondDone = await(service, second.getTaskId());

        assertEquals(TaskStatusEnum.FAILED, firstDone.getStatus());
        assertEquals(TaskStatusEnum.FAILED, secondDone.getStatus());
        assertNotNull(secondDone.getReason());

        // 等另一个工作线程也退出，再确认电梯没有被它拉回空闲
        for (int i = 0; i < 100 && service.getMetrics().getFailedCalls() < 2; i++) {
            Thread.sleep(10);
        }
        assertEquals(2, service.getMetrics().getFailedCalls());
        assertEquals(0, service.getMetrics().getCompletedCalls());
        ElevatorSnapshotDto snapshot = unit(service, 1);
        assertEquals(ElevatorStateEnum.ERROR, snapshot.getState());
        assertEquals(1, snapshot.getCurrentFloor());
        assertEquals(0, snapshot.getTripsCompleted());
        assertEquals(0, service.getStatus().getActiveTasks());
        assertThrows(NoAvailableElevatorException.class, () -> service.assign(2, 3, "third", null));
    }

    @Test
    @DisplayName("越界或缺失楼层直接拒绝")
    void testInvalidFloors() {
        DispatchService service = dispatcher(blocking);

        InvalidFloorException from = assertThrows(InvalidFloorException.class, () -> service.assign(0, 5, "t", null));
        assertTrue(from.getMessage().contains("1-10") && from.getMessage().contains("0"));
        InvalidFloorException to = assertThrows(InvalidFloorException.class, () -> service.assign(1, 15, "t", null));
        assertTrue(to.getMessage().contains("15"));
        assertThrows(InvalidFloorException.class, () -> service.assign(-1, 5, "t", null));
        assertThrows(InvalidFloorException.class, () -> service.assign(1, 0, "t", null));
        assertThrows(InvalidFloorException.class, () -> service.assign(null, 5, "t", null));

        SystemStatusDto status = service.getStatus();
        assertEquals(0, status.getActiveTasks());
        assertEquals(5, status.getMetrics().getFailedAssignments());
        assertEquals(ElevatorStateEnum.IDLE, unit(service, 1).getState());
    }

    @Test
    @DisplayName("检修中的电梯不参与派梯")
    void testMaintenanceMode() {
        DispatchService service = dispatcher(blocking, blocking);
        service.setMaintenanceMode(1, true, "admin");

        assertEquals(2, service.assign(1, 3, "tester", null).getElevatorId());
        // 2 号梯上行中，下行请求无梯可派
        assertThrows(NoAvailableElevatorException.class, () -> service.assign(5, 2, "tester", null));
        assertThrows(ElevatorNotFoundException.class, () -> service.setMaintenanceMode(9, true, "admin"));
    }

    @Test
    @DisplayName("未登记的任务按约定视为已完成")
    void testUnknownTask() {
        DispatchService service = dispatcher(INSTANT);

        TaskRecord record = service.getTaskStatus("elevator_9_missing");

        assertEquals(TaskStatusEnum.COMPLETED, record.getStatus());
        assertFalse(record.isTracked());
    }

    @Test
    @DisplayName("持久化失败不影响派梯和运行")
    void testPersistenceFailureIsIsolated() throws Exception {
        doThrow(new IllegalStateException("数据库不可用")).when(gateway).upsertUnitState(any());
        doThrow(new IllegalStateException("数据库不可用")).when(gateway)
                .appendEvent(any(), anyString(), any(), any(), any());
        DispatchService service = dispatcher(INSTANT);

        AssignmentResult result = service.assign(2, 9, "tester", null);

        assertEquals(TaskStatusEnum.COMPLETED, await(service, result.getTaskId()).getStatus());
        assertEquals(9, unit(service, 1).getCurrentFloor());
    }

    @Test
    @DisplayName("调度器停止后拒绝新的呼梯")
    void testShutdown() {
        DispatchService service = dispatcher(INSTANT);

        service.shutdown();

        assertThrows(DispatcherShutdownException.class, () -> service.assign(1, 2, "tester", null));
    }
}
