package model.dto.request;

import lombok.Data;

/**
 * 呼梯请求
 */
@Data
public class CallElevatorReq {
    private Integer fromFloor;   // 乘客所在楼层
    private Integer toFloor;     // 目标楼层
}
