package model.dto.response;

import lombok.Data;

/**
 * 呼梯接口响应 DTO
 */
@Data
public class CallElevatorResp {
    private String message;
    private int elevatorId;
    private String taskId;
    private double estimatedArrivalTime;

    public static CallElevatorResp of(AssignmentResult result) {
        CallElevatorResp resp = new CallElevatorResp();
        resp.setMessage("电梯 " + result.getElevatorId() + " 已派出");
        resp.setElevatorId(result.getElevatorId());
        resp.setTaskId(result.getTaskId());
        resp.setEstimatedArrivalTime(result.getEstimatedArrivalTime());
        return resp;
    }
}
