package common.exception;

import common.consts.ErrorCodes;

/**
 * 楼层越界或缺失，属于调用方错误
 */
public class InvalidFloorException extends ElevatorException {

    public InvalidFloorException(String message) {
        super(message, 400);
    }

    /**
     * 校验楼层是否在 [1, maxFloor] 内
     *
     * @param label    楼层含义，出现在错误信息中 (如 "起始楼层")
     * @param floor    待校验的楼层，可能为空
     * @param maxFloor 最高楼层
     * @return 校验通过的楼层
     */
    public static int requireValid(String label, Integer floor, int maxFloor) {
        if (floor == null) {
            throw new InvalidFloorException(String.format(ErrorCodes.FLOOR_REQUIRED, label));
        }
        if (floor < 1 || floor > maxFloor) {
            throw new InvalidFloorException(String.format(ErrorCodes.FLOOR_OUT_OF_RANGE, label, maxFloor, floor));
        }
        return floor;
    }
}
