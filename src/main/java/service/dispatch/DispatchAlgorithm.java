package service.dispatch;

import model.dto.snapshot.ElevatorSnapshotDto;

import java.util.List;
import java.util.Optional;

/**
 * 派梯算法接口
 * 调度器在全局锁内调用，实现必须是无副作用的纯计算。
 */
public interface DispatchAlgorithm {
    /**
     * 为一次呼梯挑选电梯
     *
     * @param fleet     各电梯在锁内取得的快照
     * @param fromFloor 乘客所在楼层
     * @param toFloor   目标楼层
     * @return 被选中的电梯快照，没有合适电梯时为空
     */
    Optional<ElevatorSnapshotDto> select(List<ElevatorSnapshotDto> fleet, int fromFloor, int toFloor);
}
