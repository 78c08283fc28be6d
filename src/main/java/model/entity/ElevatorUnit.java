package model.entity;

import common.config.ElevatorConfig;
import common.consts.DirectionEnum;
import common.consts.ElevatorStateEnum;
import common.exception.ElevatorException;
import common.exception.ElevatorFaultException;
import common.exception.InvalidFloorException;
import engine.MotionClock;
import lombok.extern.slf4j.Slf4j;
import model.dto.snapshot.ElevatorSnapshotDto;
import service.persistence.PersistenceGateway;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单台电梯
 * 状态字段由对象自身监视器保护，每次修改都很短；moveTo 另持一把运行锁，整个行程内不释放。
 * 因此查询快照和调度器预占不会被正在运行的行程阻塞。
 */
@Slf4j
public class ElevatorUnit {

    private final int id;
    private final ElevatorConfig config;
    private final PersistenceGateway gateway;
    private final MotionClock motionClock;
    private final Clock clock;

    // 串行化同一台电梯上的 moveTo
    private final ReentrantLock moveLock = new ReentrantLock();

    //  以下字段均由 this 监视器保护
    private int currentFloor = 1;
    private ElevatorStateEnum state = ElevatorStateEnum.IDLE;
    private DirectionEnum direction = DirectionEnum.NONE;
    private Integer destinationFloor;
    private int tripsCompleted;
    private boolean maintenanceMode;
    private Instant lastUpdated;

    public ElevatorUnit(int id, ElevatorConfig config, PersistenceGateway gateway,
                        MotionClock motionClock, Clock clock) {
        this.id = id;
        this.config = config;
        this.gateway = gateway;
        this.motionClock = motionClock;
        this.clock = clock;
        this.lastUpdated = clock.instant();
    }

    public int getId() {
        return id;
    }

    /**
     * 核心逻辑：运行到指定楼层，阻塞直到开关门完成
     */
    public void moveTo(int floor) {
        InvalidFloorException.requireValid("目标楼层", floor, config.getNumFloors());

        moveLock.lock();
        try {
            // 故障为终态，后续行程一律拒绝
            if (getState() == ElevatorStateEnum.ERROR) {
                throw new ElevatorFaultException(id, String.format("电梯 [%d] 处于故障状态，拒绝运行", id));
            }
            if (floor == getCurrentFloor()) {
                return;
            }
            runTrip(floor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ElevatorFaultException(id, String.format("电梯 [%d] 运行被中断", id), e);
        } catch (ElevatorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ElevatorFaultException(id,
                    String.format("电梯 [%d] 运行故障: %s", id, e.getMessage()), e);
        } finally {
            moveLock.unlock();
        }
    }

    private void runTrip(int floor) throws InterruptedException {
        ElevatorSnapshotDto snapshot;
        DirectionEnum tripDirection;

        // 1. 出发
        synchronized (this) {
            tripDirection = DirectionEnum.between(currentFloor, floor);
            destinationFloor = floor;
            direction = tripDirection;
            state = ElevatorStateEnum.MOVING;
            touch();
            snapshot = snapshotLocked();
        }
        publish(snapshot);
        log.info("电梯 [{}] 从 {} 层出发前往 {} 层 ({})", id, snapshot.getCurrentFloor(), floor, tripDirection.getDesc());

        // 2. 逐层移动
        int step = tripDirection == DirectionEnum.UP ? 1 : -1;
        int position = snapshot.getCurrentFloor();
        while (position != floor) {
            motionClock.pause(config.getFloorMoveTime());
            synchronized (this) {
                currentFloor += step;
                position = currentFloor;
                touch();
                snapshot = snapshotLocked();
            }
            publish(snapshot);
            log.info("电梯 [{}] 当前位于 {} 层", id, position);
        }

        // 3. 到站开关门
        changeState(ElevatorStateEnum.DOOR_OPENING);
        motionClock.pause(config.getDoorTime());
        changeState(ElevatorStateEnum.DOOR_CLOSING);
        motionClock.pause(config.getDoorTime());

        synchronized (this) {
            state = ElevatorStateEnum.IDLE;
            direction = DirectionEnum.NONE;
            destinationFloor = null;
            touch();
            snapshot = snapshotLocked();
        }
        publish(snapshot);
    }

    private void changeState(ElevatorStateEnum newState) {
        ElevatorSnapshotDto snapshot;
        synchronized (this) {
            state = newState;
            touch();
            snapshot = snapshotLocked();
        }
        publish(snapshot);
    }

    /**
     * 调度器预占：先行写入方向与目的楼层，真正运行时状态机会重新推导
     *
     * @return 预占前的快照，用于回滚
     */
    public synchronized ElevatorSnapshotDto reserve(DirectionEnum requiredDirection, int targetFloor) {
        ElevatorSnapshotDto previous = snapshotLocked();
        direction = requiredDirection;
        destinationFloor = targetFloor;
        state = ElevatorStateEnum.MOVING;
        touch();
        return previous;
    }

    /**
     * 回滚预占
     */
    public synchronized void restore(ElevatorSnapshotDto previous) {
        state = previous.getState();
        direction = previous.getDirection();
        destinationFloor = previous.getDestinationFloor();
        touch();
    }

    /**
     * 一次呼梯完成：回到空闲并累计行程
     * 已处于故障状态时保持不变
     */
    public synchronized ElevatorSnapshotDto completeCall() {
        if (state == ElevatorStateEnum.ERROR) {
            return snapshotLocked();
        }
        state = ElevatorStateEnum.IDLE;
        direction = DirectionEnum.NONE;
        destinationFloor = null;
        tripsCompleted++;
        touch();
        return snapshotLocked();
    }

    /**
     * 故障为终态，方向和目的楼层保留用于排查
     */
    public synchronized ElevatorSnapshotDto markError() {
        state = ElevatorStateEnum.ERROR;
        touch();
        return snapshotLocked();
    }

    public synchronized ElevatorSnapshotDto setMaintenanceMode(boolean enabled) {
        maintenanceMode = enabled;
        touch();
        return snapshotLocked();
    }

    public synchronized ElevatorSnapshotDto snapshot() {
        return snapshotLocked();
    }

    public synchronized int getCurrentFloor() {
        return currentFloor;
    }

    public synchronized ElevatorStateEnum getState() {
        return state;
    }

    public synchronized DirectionEnum getDirection() {
        return direction;
    }

    public synchronized Integer getDestinationFloor() {
        return destinationFloor;
    }

    public synchronized int getTripsCompleted() {
        return tripsCompleted;
    }

    public synchronized boolean isMaintenanceMode() {
        return maintenanceMode;
    }

    /**
     * 把当前状态推送给持久化网关
     */
    public void publishState() {
        publish(snapshot());
    }

    // 持久化失败只记日志，绝不影响状态机
    private void publish(ElevatorSnapshotDto snapshot) {
        try {
            gateway.upsertUnitState(snapshot);
        } catch (RuntimeException e) {
            log.warn("电梯 [{}] 状态同步失败: {}", id, e.getMessage());
        }
    }

    private void touch() {
        lastUpdated = clock.instant();
    }

    private ElevatorSnapshotDto snapshotLocked() {
        ElevatorSnapshotDto dto = new ElevatorSnapshotDto();
        dto.setId(id);
        dto.setCurrentFloor(currentFloor);
        dto.setState(state);
        dto.setDirection(direction);
        dto.setDestinationFloor(destinationFloor);
        dto.setTripsCompleted(tripsCompleted);
        dto.setMaintenanceMode(maintenanceMode);
        dto.setLastUpdated(lastUpdated);
        return dto;
    }
}
