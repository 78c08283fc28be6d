package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 电梯运行方向
 */
@Getter
@AllArgsConstructor
public enum DirectionEnum {
    UP("上行"),
    DOWN("下行"),
    NONE("无方向");

    private final String desc;

    /**
     * 根据起止楼层判断方向，相同楼层返回 NONE
     */
    public static DirectionEnum between(int fromFloor, int toFloor) {
        if (toFloor > fromFloor) {
            return UP;
        }
        if (toFloor < fromFloor) {
            return DOWN;
        }
        return NONE;
    }
}
