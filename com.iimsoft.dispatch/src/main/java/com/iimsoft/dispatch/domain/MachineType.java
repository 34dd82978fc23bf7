package com.iimsoft.dispatch.domain;

import java.util.Objects;

/**
 * 机型（资源目录条目）。
 * <p>
 * 速度二选一：成型机用 米/分钟，折弯机用 秒/次。units=0 的条目是“工序角色”（剪板、叉车），
 * 不能单独排程，只消耗操作工名额。
 */
public final class MachineType {

    private final String id;
    private final Double speedMPerMin;
    private final Double secondsPerBend;
    private final double powerKw;
    private final int units;
    private final int operatorsNeeded;

    public MachineType(String id, Double speedMPerMin, Double secondsPerBend, double powerKw, int units, int operatorsNeeded) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("machine type id 不能为空");
        }
        if (units < 0) {
            throw new IllegalArgumentException("Machine type " + id + ": units must be >= 0, was " + units);
        }
        if (operatorsNeeded < 0) {
            throw new IllegalArgumentException("Machine type " + id + ": operatorsNeeded must be >= 0, was " + operatorsNeeded);
        }
        if (units > 0 && (speedMPerMin == null) == (secondsPerBend == null)) {
            throw new IllegalArgumentException("Machine type " + id
                    + ": exactly one of speedMPerMin / secondsPerBend must be set for a schedulable machine");
        }
        this.id = id;
        this.speedMPerMin = speedMPerMin;
        this.secondsPerBend = secondsPerBend;
        this.powerKw = powerKw;
        this.units = units;
        this.operatorsNeeded = operatorsNeeded;
    }

    public String getId() { return id; }
    public Double getSpeedMPerMin() { return speedMPerMin; }
    public Double getSecondsPerBend() { return secondsPerBend; }
    public double getPowerKw() { return powerKw; }
    public int getUnits() { return units; }
    public int getOperatorsNeeded() { return operatorsNeeded; }

    public boolean isProcessRole() {
        return units == 0;
    }

    public boolean isLengthRated() {
        return speedMPerMin != null;
    }

    public boolean isCycleRated() {
        return secondsPerBend != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MachineType)) return false;
        MachineType that = (MachineType) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
