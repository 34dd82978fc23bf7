package com.iimsoft.dispatch.estimate;

/**
 * 工时（ETC，分钟）与电耗（kWh）估算。纯函数。
 */
public final class TimeEstimator {

    /** 速度无效时返回的“无穷大”工时，表示永远排不进去 */
    public static final double INFINITE_MINUTES = Double.POSITIVE_INFINITY;

    private TimeEstimator() {
    }

    /**
     * 成型：ETC(分钟) = 总长度(米) / 速度(米/分钟)
     */
    public static double estimateForming(double totalLengthM, double speedMPerMin) {
        if (speedMPerMin <= 0) {
            return INFINITE_MINUTES;
        }
        return totalLengthM / speedMPerMin;
    }

    /**
     * 折弯：ETC(分钟) = 总折弯次数 × 每次秒数 / 60
     */
    public static double estimateBending(long totalBends, double secondsPerBend) {
        if (secondsPerBend <= 0) {
            return INFINITE_MINUTES;
        }
        return (totalBends * secondsPerBend) / 60.0;
    }

    /**
     * 电耗(kWh) = 功率(kW) × 分钟 / 60；负工时按 0 处理。
     */
    public static double estimateEnergy(double powerKw, double minutes) {
        if (minutes < 0) {
            return 0.0;
        }
        return powerKw * (minutes / 60.0);
    }
}
