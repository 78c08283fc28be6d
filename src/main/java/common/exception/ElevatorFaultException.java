package common.exception;

import lombok.Getter;

/**
 * 电梯运行过程中的故障
 * 只会通过任务状态查询暴露，不会同步返回给呼梯方
 */
@Getter
public class ElevatorFaultException extends ElevatorException {
    private final int elevatorId;

    public ElevatorFaultException(int elevatorId, String message) {
        super(message, 500);
        this.elevatorId = elevatorId;
    }

    public ElevatorFaultException(int elevatorId, String message, Throwable cause) {
        super(message, 500, cause);
        this.elevatorId = elevatorId;
    }
}
