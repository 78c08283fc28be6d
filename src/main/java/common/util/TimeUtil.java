package common.util;

/**
 * 秒与毫秒换算工具
 */
public final class TimeUtil {

    private TimeUtil() {}

    /**
     * 秒转毫秒，负数按 0 处理
     */
    public static long secondsToMillis(double seconds) {
        if (seconds <= 0) {
            return 0L;
        }
        return Math.round(seconds * 1000);
    }
}
