package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 电梯运行状态枚举
 */
@Getter
@AllArgsConstructor
public enum ElevatorStateEnum {
    IDLE("空闲"),
    MOVING("运行中"),
    DOOR_OPENING("开门中"),
    DOOR_CLOSING("关门中"),
    // 故障为终态，需人工复位
    ERROR("故障");

    private final String desc;
}
