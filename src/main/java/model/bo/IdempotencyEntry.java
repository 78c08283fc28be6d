package model.bo;

import lombok.Value;
import model.dto.response.AssignmentResult;

import java.time.Duration;
import java.time.Instant;

/**
 * 幂等缓存条目
 */
@Value
public class IdempotencyEntry {
    AssignmentResult result;
    Instant createdAt;
    String fingerprint;

    public boolean isExpired(Instant now, Duration ttl) {
        return !createdAt.plus(ttl).isAfter(now);
    }
}
