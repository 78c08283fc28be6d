package service.dispatch;

import lombok.extern.slf4j.Slf4j;
import model.bo.IdempotencyEntry;
import model.dto.response.AssignmentResult;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * 内存幂等缓存
 * 非线程安全，所有读写都在调度器的全局锁内进行。
 */
@Slf4j
public class IdempotencyCache {

    private final Map<String, IdempotencyEntry> entries = new HashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public IdempotencyCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * 清理过期条目
     *
     * @return 本次清理的条数
     */
    public int evictExpired() {
        int evicted = 0;
        Iterator<IdempotencyEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(clock.instant(), ttl)) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("清理过期幂等键 {} 个", evicted);
        }
        return evicted;
    }

    public Optional<IdempotencyEntry> find(String key) {
        IdempotencyEntry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void store(String key, String fingerprint, AssignmentResult result) {
        entries.put(key, new IdempotencyEntry(result, clock.instant(), fingerprint));
    }

    public void remove(String key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
