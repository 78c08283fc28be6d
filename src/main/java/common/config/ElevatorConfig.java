package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 楼宇与电梯运行参数配置
 * 与楼层数、运行耗时、幂等窗口相关的常量统一在这里管理，避免在代码各处硬编码。
 *
 * 可通过 Spring 配置文件覆盖：
 *
 * elevator.num-floors
 * elevator.num-elevators
 * elevator.floor-move-time
 * elevator.door-time
 * elevator.idempotency-ttl-seconds
 */
@Configuration
@ConfigurationProperties(prefix = "elevator")
@Data
public class ElevatorConfig {

    /**
     * 楼层总数，合法楼层为 1..numFloors
     */
    private int numFloors = 10;

    /**
     * 电梯数量，编号为 1..numElevators
     */
    private int numElevators = 5;

    /**
     * 每经过一层的耗时 (秒)
     */
    private double floorMoveTime = 5.0;

    /**
     * 单次开门或关门的耗时 (秒)
     */
    private double doorTime = 2.0;

    /**
     * 幂等键的有效期 (秒)
     */
    private long idempotencyTtlSeconds = 600;

    /**
     * 工作线程数 = 电梯数量 * 该倍数
     */
    private int workerPoolMultiplier = 2;

    /**
     * 已结束任务的保留条数（供状态轮询）
     */
    private int taskHistoryCapacity = 1000;

    /**
     * 内存审计事件的保留条数
     */
    private int eventLogCapacity = 1000;
}
