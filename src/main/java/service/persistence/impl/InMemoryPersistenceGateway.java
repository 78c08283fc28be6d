package service.persistence.impl;

import common.config.ElevatorConfig;
import common.consts.EventTypeEnum;
import common.consts.SeverityEnum;
import lombok.extern.slf4j.Slf4j;
import model.dto.snapshot.ElevatorSnapshotDto;
import model.dto.snapshot.EventLogEntryDto;
import org.springframework.stereotype.Component;
import service.persistence.PersistenceGateway;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存版持久化网关
 * 每台电梯只保留最新一行状态，审计事件保留最近 N 条。
 */
@Component
@Slf4j
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private final int capacity;

    private final Map<Integer, ElevatorSnapshotDto> unitStates = new ConcurrentHashMap<>();

    private final Deque<EventLogEntryDto> buffer;

    private long sequence = 0L;

    public InMemoryPersistenceGateway(ElevatorConfig config) {
        this.capacity = Math.max(1, config.getEventLogCapacity());
        this.buffer = new ArrayDeque<>(capacity);
    }

    @Override
    public void upsertUnitState(ElevatorSnapshotDto state) {
        // 多线程写入时保留更新时间较新的一行
        unitStates.merge(state.getId(), state, (old, incoming) -> isStale(incoming, old) ? old : incoming);
    }

    private boolean isStale(ElevatorSnapshotDto incoming, ElevatorSnapshotDto old) {
        return incoming.getLastUpdated() != null && old.getLastUpdated() != null
                && incoming.getLastUpdated().isBefore(old.getLastUpdated());
    }

    @Override
    public synchronized void appendEvent(EventTypeEnum eventType, String details, String source,
                                         Integer elevatorId, SeverityEnum severity) {
        EventLogEntryDto entry = new EventLogEntryDto();
        entry.setId(++sequence);
        entry.setElevatorId(elevatorId);
        entry.setEventType(eventType);
        entry.setDetails(details);
        entry.setSource(source);
        entry.setSeverity(severity != null ? severity : SeverityEnum.INFO);
        entry.setTimestamp(Instant.now());

        if (buffer.size() >= capacity) {
            buffer.removeFirst();
        }
        buffer.addLast(entry);
        log.debug("审计事件: {} {}", eventType, details);
    }

    /**
     * 最新的事件排在最前
     */
    @Override
    public synchronized List<EventLogEntryDto> listEvents(int limit, int offset, EventTypeEnum eventType) {
        List<EventLogEntryDto> result = new ArrayList<>();
        int skipped = 0;
        Iterator<EventLogEntryDto> it = buffer.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            EventLogEntryDto entry = it.next();
            if (eventType != null && entry.getEventType() != eventType) {
                continue;
            }
            if (skipped < offset) {
                skipped++;
                continue;
            }
            result.add(entry);
        }
        return result;
    }

    @Override
    public List<ElevatorSnapshotDto> listUnitStates() {
        List<ElevatorSnapshotDto> result = new ArrayList<>(unitStates.values());
        result.sort(Comparator.comparingInt(ElevatorSnapshotDto::getId));
        return result;
    }
}
