package engine;

import common.util.TimeUtil;

/**
 * 电梯运行计时
 * 每经过一层、每次开关门都会调用一次 pause，测试中可替换为不等待或注入故障的实现。
 */
@FunctionalInterface
public interface MotionClock {

    /**
     * 阻塞当前线程指定秒数
     */
    void pause(double seconds) throws InterruptedException;

    /**
     * 真实时间实现
     */
    static MotionClock realTime() {
        return seconds -> Thread.sleep(TimeUtil.secondsToMillis(seconds));
    }
}
