package common.exception;

import common.consts.ErrorCodes;

public class ElevatorNotFoundException extends ElevatorException {

    public ElevatorNotFoundException(int elevatorId) {
        super(ErrorCodes.ELEVATOR_NOT_FOUND + ": " + elevatorId, 404);
    }
}
