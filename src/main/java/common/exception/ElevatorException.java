package common.exception;

import lombok.Getter;

/**
 * 电梯调度业务异常基类
 * code 与对外返回的 HTTP 状态码一致
 */
@Getter
public abstract class ElevatorException extends RuntimeException {
    private final int code;

    protected ElevatorException(String message, int code) {
        super(message);
        this.code = code;
    }

    protected ElevatorException(String message, int code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
