package common.exception;

import common.consts.ErrorCodes;

/**
 * 调度器已停止或工作线程池拒绝了新任务
 */
public class DispatcherShutdownException extends ElevatorException {

    public DispatcherShutdownException() {
        super(ErrorCodes.DISPATCHER_SHUTDOWN, 503);
    }

    public DispatcherShutdownException(Throwable cause) {
        super(ErrorCodes.DISPATCHER_SHUTDOWN, 503, cause);
    }
}
