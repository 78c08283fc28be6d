package common.exception;

import common.consts.ErrorCodes;
import lombok.Getter;

/**
 * 同一个幂等键被用于不同的请求内容
 */
@Getter
public class IdempotencyConflictException extends ElevatorException {
    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey) {
        super(String.format(ErrorCodes.IDEMPOTENCY_CONFLICT, idempotencyKey), 409);
        this.idempotencyKey = idempotencyKey;
    }
}
