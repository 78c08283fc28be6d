package common.exception;

import common.consts.ErrorCodes;

/**
 * 既没有空闲电梯，也没有顺路可捎带的电梯，调用方可稍后重试
 */
public class NoAvailableElevatorException extends ElevatorException {

    public NoAvailableElevatorException() {
        super(ErrorCodes.NO_AVAILABLE_ELEVATOR, 503);
    }

    public NoAvailableElevatorException(String message) {
        super(message, 503);
    }
}
