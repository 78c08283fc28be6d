package model.dto.snapshot;

import common.consts.EventTypeEnum;
import common.consts.SeverityEnum;
import lombok.Data;

import java.time.Instant;

/**
 * 审计日志条目 DTO
 */
@Data
public class EventLogEntryDto {
    /**
     * 自增序号
     */
    private long id;

    /**
     * 关联电梯（可选）
     */
    private Integer elevatorId;

    private EventTypeEnum eventType;
    private String details;
    private Instant timestamp;

    /**
     * 事件来源，通常是呼梯方标识
     */
    private String source;

    private SeverityEnum severity;
}
