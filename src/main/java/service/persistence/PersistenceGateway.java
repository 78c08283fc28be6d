package service.persistence;

import common.consts.EventTypeEnum;
import common.consts.SeverityEnum;
import model.dto.snapshot.ElevatorSnapshotDto;
import model.dto.snapshot.EventLogEntryDto;

import java.util.List;

/**
 * 持久化网关
 * 镜像电梯状态并追加审计事件，尽力而为，调度核心不以其为准。
 * 实现方可以抛出任何运行时异常，调用方负责捕获并记录日志。
 */
public interface PersistenceGateway {

    /**
     * 写入或覆盖一台电梯的最新状态
     */
    void upsertUnitState(ElevatorSnapshotDto state);

    /**
     * 追加一条审计事件
     *
     * @param elevatorId 关联电梯，可为空
     */
    void appendEvent(EventTypeEnum eventType, String details, String source, Integer elevatorId, SeverityEnum severity);

    /**
     * 按时间倒序分页查询审计事件
     *
     * @param eventType 为空时不过滤
     */
    List<EventLogEntryDto> listEvents(int limit, int offset, EventTypeEnum eventType);

    /**
     * 按编号查询所有电梯的最新镜像
     */
    List<ElevatorSnapshotDto> listUnitStates();
}
