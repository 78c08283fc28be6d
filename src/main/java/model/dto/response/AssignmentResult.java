package model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 派梯结果
 * 命中幂等缓存时原样返回首次派梯的结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentResult {
    private int elevatorId;              // 被选中的电梯
    private String taskId;               // 本次呼梯任务ID，用于轮询进度
    private double estimatedArrivalTime; // 预计到达目的楼层的秒数
}
