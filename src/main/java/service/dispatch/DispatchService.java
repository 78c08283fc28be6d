package service.dispatch;

import common.config.ElevatorConfig;
import common.consts.DirectionEnum;
import common.consts.ElevatorStateEnum;
import common.consts.EventTypeEnum;
import common.consts.SeverityEnum;
import common.consts.SystemHealthEnum;
import common.consts.TaskStatusEnum;
import common.exception.DispatcherShutdownException;
import common.exception.ElevatorException;
import common.exception.ElevatorNotFoundException;
import common.exception.IdempotencyConflictException;
import common.exception.InvalidFloorException;
import common.exception.NoAvailableElevatorException;
import engine.CallExecution;
import engine.TaskRegistry;
import lombok.extern.slf4j.Slf4j;
import model.bo.AssignmentRequest;
import model.bo.IdempotencyEntry;
import model.bo.TaskRecord;
import model.dto.response.AssignmentResult;
import model.dto.snapshot.DispatchMetricsDto;
import model.dto.snapshot.ElevatorSnapshotDto;
import model.dto.snapshot.SystemStatusDto;
import model.entity.ElevatorUnit;
import service.persistence.BestEffortPersistence;
import service.persistence.PersistenceGateway;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 电梯调度服务
 * 派梯分两个阶段：
 * 1. 全局锁内完成幂等检查、选梯、预占和任务登记，耗时很短；
 * 2. 锁外把运行过程交给工作线程池，结果通过任务登记表和 future 返回。
 * 长时间的运行不会阻塞新的派梯决策。
 */
@Slf4j
public class DispatchService {

    private final Map<Integer, ElevatorUnit> fleet;
    private final ElevatorConfig config;
    private final DispatchAlgorithm algorithm;
    private final BestEffortPersistence persistence;
    private final ExecutorService executor;
    private final Clock clock;

    // 保护幂等缓存、选梯与预占
    private final ReentrantLock fleetLock = new ReentrantLock();
    private final IdempotencyCache idempotencyCache;
    private final TaskRegistry taskRegistry;
    private boolean shutdown;

    //  计数
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong successfulAssignments = new AtomicLong();
    private final AtomicLong failedAssignments = new AtomicLong();
    private final AtomicLong idempotentReplays = new AtomicLong();
    private final AtomicLong completedCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();

    public DispatchService(List<ElevatorUnit> units, ElevatorConfig config, DispatchAlgorithm algorithm,
                           PersistenceGateway gateway, ExecutorService executor, Clock clock) {
        Map<Integer, ElevatorUnit> byId = new LinkedHashMap<>();
        units.stream()
                .sorted((a, b) -> Integer.compare(a.getId(), b.getId()))
                .forEach(unit -> byId.put(unit.getId(), unit));
        this.fleet = Collections.unmodifiableMap(byId);
        this.config = config;
        this.algorithm = algorithm;
        this.persistence = new BestEffortPersistence(gateway);
        this.executor = executor;
        this.clock = clock;
        this.idempotencyCache = new IdempotencyCache(Duration.ofSeconds(config.getIdempotencyTtlSeconds()), clock);
        this.taskRegistry = new TaskRegistry(config.getTaskHistoryCapacity());
        log.info("调度器初始化完成: 电梯数={}, 楼层数={}", fleet.size(), config.getNumFloors());
    }

    /**
     * 派梯
     *
     * @param idempotencyKey 可为空；同一个键在有效期内重复调用返回首次结果
     * @throws InvalidFloorException         楼层越界
     * @throws NoAvailableElevatorException  没有可用电梯
     * @throws IdempotencyConflictException  同一个幂等键对应了不同的请求内容
     */
    public AssignmentResult assign(Integer fromFloor, Integer toFloor, String callerId, String idempotencyKey) {
        totalCalls.incrementAndGet();

        AssignmentRequest request;
        Reservation reservation;
        try {
            int from = InvalidFloorException.requireValid("起始楼层", fromFloor, config.getNumFloors());
            int to = InvalidFloorException.requireValid("目标楼层", toFloor, config.getNumFloors());
            request = new AssignmentRequest(from, to, callerId, idempotencyKey);
            reservation = reserve(request);
        } catch (ElevatorException e) {
            failedAssignments.incrementAndGet();
            log.warn("派梯失败: {}", e.getMessage());
            persistence.appendEvent(EventTypeEnum.ASSIGNMENT_REJECTED,
                    String.format("呼梯 %s→%s 被拒绝: %s", fromFloor, toFloor, e.getMessage()),
                    callerId, null, SeverityEnum.WARNING);
            throw e;
        }

        if (reservation.replay) {
            idempotentReplays.incrementAndGet();
            return reservation.result;
        }

        ElevatorUnit unit = reservation.unit;
        persistence.upsertUnitState(unit.snapshot());
        persistence.appendEvent(EventTypeEnum.ELEVATOR_ASSIGNED,
                String.format("为呼梯 %d→%d 分配电梯 %d", request.getFromFloor(), request.getToFloor(), unit.getId()),
                callerId, unit.getId(), SeverityEnum.INFO);
        launch(reservation, request);

        successfulAssignments.incrementAndGet();
        log.info("派梯成功: 任务={}, 电梯={}, {}→{}, 预计 {} 秒",
                reservation.result.getTaskId(), unit.getId(), request.getFromFloor(), request.getToFloor(),
                reservation.result.getEstimatedArrivalTime());
        return reservation.result;
    }

    /**
     * 第一阶段：全局锁内的幂等检查、选梯、预占与登记
     */
    private Reservation reserve(AssignmentRequest request) {
        fleetLock.lock();
        try {
            if (shutdown) {
                throw new DispatcherShutdownException();
            }
            idempotencyCache.evictExpired();

            if (request.hasIdempotencyKey()) {
                Optional<IdempotencyEntry> cached = idempotencyCache.find(request.getIdempotencyKey());
                if (cached.isPresent()) {
                    if (!cached.get().getFingerprint().equals(request.fingerprint())) {
                        throw new IdempotencyConflictException(request.getIdempotencyKey());
                    }
                    log.info("幂等键 [{}] 命中，返回首次派梯结果", request.getIdempotencyKey());
                    return Reservation.replay(cached.get().getResult());
                }
            }

            List<ElevatorSnapshotDto> snapshots = new ArrayList<>(fleet.size());
            for (ElevatorUnit unit : fleet.values()) {
                snapshots.add(unit.snapshot());
            }
            ElevatorSnapshotDto chosen = algorithm
                    .select(snapshots, request.getFromFloor(), request.getToFloor())
                    .orElseThrow(NoAvailableElevatorException::new);
            ElevatorUnit unit = fleet.get(chosen.getId());

            // ETA 基于预占前的状态计算
            double eta = estimateArrival(chosen, request.getFromFloor());
            DirectionEnum required = request.getToFloor() > request.getFromFloor() ? DirectionEnum.UP : DirectionEnum.DOWN;
            ElevatorSnapshotDto previous = unit.reserve(required, request.getToFloor());

            String taskId = newTaskId(unit.getId());
            try {
                TaskRecord task = TaskRecord.builder()
                        .taskId(taskId)
                        .elevatorId(unit.getId())
                        .fromFloor(request.getFromFloor())
                        .toFloor(request.getToFloor())
                        .callerId(request.getCallerId())
                        .status(TaskStatusEnum.RUNNING)
                        .createdAt(clock.instant())
                        .build();
                taskRegistry.register(task);

                AssignmentResult result = new AssignmentResult(unit.getId(), taskId, eta);
                if (request.hasIdempotencyKey()) {
                    idempotencyCache.store(request.getIdempotencyKey(), request.fingerprint(), result);
                }
                return new Reservation(unit, task, result, previous, false);
            } catch (RuntimeException e) {
                // 不允许留下被预占的电梯
                unit.restore(previous);
                taskRegistry.unregister(taskId);
                throw e;
            }
        } finally {
            fleetLock.unlock();
        }
    }

    /**
     * 第二阶段：锁外提交运行任务
     */
    private void launch(Reservation reservation, AssignmentRequest request) {
        String taskId = reservation.task.getTaskId();
        CallExecution execution = new CallExecution(reservation.unit, reservation.task, taskRegistry, persistence, clock);
        try {
            CompletableFuture.supplyAsync(execution, executor).whenComplete((record, error) -> {
                if (error != null) {
                    log.error("呼梯任务 [{}] 异常终止", taskId, error);
                    return;
                }
                if (record.getStatus() == TaskStatusEnum.COMPLETED) {
                    completedCalls.incrementAndGet();
                } else {
                    failedCalls.incrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            fleetLock.lock();
            try {
                reservation.unit.restore(reservation.previous);
                taskRegistry.unregister(taskId);
                if (request.hasIdempotencyKey()) {
                    idempotencyCache.remove(request.getIdempotencyKey());
                }
            } finally {
                fleetLock.unlock();
            }
            failedAssignments.incrementAndGet();
            persistence.upsertUnitState(reservation.unit.snapshot());
            log.error("工作线程池拒绝任务 [{}]，已回滚预占", taskId);
            throw new DispatcherShutdownException(e);
        }
    }

    /**
     * 预计到达时间 (秒)
     * 空闲电梯：直接到接人楼层；运行中电梯：先到当前目的楼层再折返到接人楼层。
     * 开关门：目的楼层一次，需要移动去接人时再加一次。
     */
    double estimateArrival(ElevatorSnapshotDto unit, int fromFloor) {
        int current = unit.getCurrentFloor();
        int floors;
        if (unit.getState() == ElevatorStateEnum.IDLE || unit.getDestinationFloor() == null) {
            floors = Math.abs(current - fromFloor);
        } else {
            int destination = unit.getDestinationFloor();
            floors = Math.abs(current - destination) + Math.abs(destination - fromFloor);
        }
        double moveTime = floors * config.getFloorMoveTime();
        double doorTime = 2 * config.getDoorTime();
        if (current != fromFloor) {
            doorTime += 2 * config.getDoorTime();
        }
        return moveTime + doorTime;
    }

    private String newTaskId(int elevatorId) {
        return "elevator_" + elevatorId + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * 电梯群状态快照
     */
    public SystemStatusDto getStatus() {
        List<ElevatorSnapshotDto> elevators = new ArrayList<>(fleet.size());
        for (ElevatorUnit unit : fleet.values()) {
            elevators.add(unit.snapshot());
        }
        boolean allBusy = elevators.stream().noneMatch(e -> e.getState() == ElevatorStateEnum.IDLE);

        SystemStatusDto status = new SystemStatusDto();
        status.setElevators(elevators);
        status.setActiveTasks(taskRegistry.activeCount());
        status.setSystemHealth(allBusy ? SystemHealthEnum.BUSY : SystemHealthEnum.HEALTHY);
        status.setMetrics(getMetrics());
        status.setTimestamp(clock.instant());
        return status;
    }

    public DispatchMetricsDto getMetrics() {
        DispatchMetricsDto metrics = new DispatchMetricsDto();
        metrics.setTotalCalls(totalCalls.get());
        metrics.setSuccessfulAssignments(successfulAssignments.get());
        metrics.setFailedAssignments(failedAssignments.get());
        metrics.setIdempotentReplays(idempotentReplays.get());
        metrics.setCompletedCalls(completedCalls.get());
        metrics.setFailedCalls(failedCalls.get());
        return metrics;
    }

    /**
     * 任务状态查询，不加全局锁
     */
    public TaskRecord getTaskStatus(String taskId) {
        return taskRegistry.find(taskId);
    }

    /**
     * 任务结束信号，供需要等待结果的调用方使用
     */
    public CompletableFuture<TaskRecord> getTaskCompletion(String taskId) {
        return taskRegistry.completion(taskId);
    }

    /**
     * 切换检修标记，检修中的电梯不参与派梯
     */
    public ElevatorSnapshotDto setMaintenanceMode(int elevatorId, boolean enabled, String operator) {
        ElevatorUnit unit = fleet.get(elevatorId);
        if (unit == null) {
            throw new ElevatorNotFoundException(elevatorId);
        }
        ElevatorSnapshotDto snapshot;
        fleetLock.lock();
        try {
            snapshot = unit.setMaintenanceMode(enabled);
        } finally {
            fleetLock.unlock();
        }
        persistence.upsertUnitState(snapshot);
        persistence.appendEvent(EventTypeEnum.MAINTENANCE_CHANGED,
                String.format("电梯 %d %s检修", elevatorId, enabled ? "进入" : "退出"),
                operator, elevatorId, SeverityEnum.INFO);
        log.info("电梯 [{}] 检修标记: {}", elevatorId, enabled);
        return snapshot;
    }

    /**
     * 停止接受派梯并等待运行中的任务结束
     */
    public void shutdown() {
        fleetLock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
        } finally {
            fleetLock.unlock();
        }
        log.info("调度器停止中，等待 {} 个运行中的任务", taskRegistry.activeCount());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("等待超时，强制中断剩余任务");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 第一阶段的产出
     */
    private static final class Reservation {
        private final ElevatorUnit unit;
        private final TaskRecord task;
        private final AssignmentResult result;
        private final ElevatorSnapshotDto previous;
        private final boolean replay;

        private Reservation(ElevatorUnit unit, TaskRecord task, AssignmentResult result,
                            ElevatorSnapshotDto previous, boolean replay) {
            this.unit = unit;
            this.task = task;
            this.result = result;
            this.previous = previous;
            this.replay = replay;
        }

        static Reservation replay(AssignmentResult result) {
            return new Reservation(null, null, result, null, true);
        }
    }
}
