package service.persistence;

import common.consts.EventTypeEnum;
import common.consts.SeverityEnum;
import lombok.extern.slf4j.Slf4j;
import model.dto.snapshot.ElevatorSnapshotDto;

/**
 * 对持久化网关的尽力而为包装：失败只记录日志，不向调度流程抛出
 */
@Slf4j
public class BestEffortPersistence {

    private final PersistenceGateway gateway;

    public BestEffortPersistence(PersistenceGateway gateway) {
        this.gateway = gateway;
    }

    public void upsertUnitState(ElevatorSnapshotDto state) {
        try {
            gateway.upsertUnitState(state);
        } catch (RuntimeException e) {
            log.warn("电梯 [{}] 状态同步失败: {}", state.getId(), e.getMessage());
        }
    }

    public void appendEvent(EventTypeEnum eventType, String details, String source,
                            Integer elevatorId, SeverityEnum severity) {
        try {
            gateway.appendEvent(eventType, details, source, elevatorId, severity);
        } catch (RuntimeException e) {
            log.warn("审计事件写入失败: type={}, details={}, cause={}", eventType, details, e.getMessage());
        }
    }
}
