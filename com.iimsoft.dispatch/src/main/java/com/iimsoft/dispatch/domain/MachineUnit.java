package com.iimsoft.dispatch.domain;

import java.util.Objects;

/**
 * 具体的一台机器：(机型, 序号)，序号从 1 开始。
 * 直接作为 Map 的 key 使用；displayId 只用于输出，不要再解析回来。
 */
public final class MachineUnit {

    private final String machineTypeId;
    private final int instanceIndex;

    public MachineUnit(String machineTypeId, int instanceIndex) {
        this.machineTypeId = Objects.requireNonNull(machineTypeId, "machineTypeId");
        if (instanceIndex < 1) {
            throw new IllegalArgumentException("instanceIndex must be >= 1, was " + instanceIndex);
        }
        this.instanceIndex = instanceIndex;
    }

    public String getMachineTypeId() { return machineTypeId; }
    public int getInstanceIndex() { return instanceIndex; }

    public String getDisplayId() {
        return machineTypeId + "_" + instanceIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MachineUnit)) return false;
        MachineUnit that = (MachineUnit) o;
        return instanceIndex == that.instanceIndex && machineTypeId.equals(that.machineTypeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(machineTypeId, instanceIndex);
    }

    @Override
    public String toString() {
        return getDisplayId();
    }
}
