package common.config;

import engine.MotionClock;
import model.entity.ElevatorUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import service.dispatch.DispatchAlgorithm;
import service.dispatch.DispatchService;
import service.persistence.PersistenceGateway;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 显式装配调度器：电梯群、持久化网关、派梯算法、时钟和工作线程池都通过构造参数传入，
 * 测试时可以直接 new 出替身组合。
 */
@Configuration
public class DispatcherConfig {

    @Bean
    public MotionClock motionClock() {
        return MotionClock.realTime();
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public DispatchService dispatchService(ElevatorConfig config,
                                           DispatchAlgorithm dispatchAlgorithm,
                                           PersistenceGateway persistenceGateway,
                                           MotionClock motionClock,
                                           Clock systemClock) {
        List<ElevatorUnit> fleet = new ArrayList<>(config.getNumElevators());
        for (int id = 1; id <= config.getNumElevators(); id++) {
            ElevatorUnit unit = new ElevatorUnit(id, config, persistenceGateway, motionClock, systemClock);
            unit.publishState();
            fleet.add(unit);
        }

        int poolSize = Math.max(1, config.getNumElevators() * config.getWorkerPoolMultiplier());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("elevator-worker-"));

        return new DispatchService(fleet, config, dispatchAlgorithm, persistenceGateway, executor, systemClock);
    }
}
