package com.iimsoft.dispatch.domain;

import com.iimsoft.dispatch.config.PlantConfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 不可变的资源目录：机型 + 全厂常量（操作工总数、每日工作分钟、每周工作天数）。
 * 每次调度运行由调度器持有，不是全局单例。
 */
public final class ResourceCatalog {

    private final Map<String, MachineType> machineTypes;
    private final int totalOperatorsPool;
    private final int dailyWorkMinutes;
    private final int workDaysPerWeek;

    public ResourceCatalog(Collection<MachineType> machineTypes, int totalOperatorsPool, int dailyWorkMinutes, int workDaysPerWeek) {
        if (totalOperatorsPool < 0) {
            throw new IllegalArgumentException("totalOperatorsPool must be >= 0, was " + totalOperatorsPool);
        }
        if (dailyWorkMinutes <= 0 || dailyWorkMinutes > 24 * 60) {
            throw new IllegalArgumentException("dailyWorkMinutes must be in 1..1440, was " + dailyWorkMinutes);
        }
        if (workDaysPerWeek < 1 || workDaysPerWeek > 7) {
            throw new IllegalArgumentException("workDaysPerWeek must be in 1..7, was " + workDaysPerWeek);
        }
        Map<String, MachineType> byId = new LinkedHashMap<>();
        for (MachineType mt : machineTypes) {
            if (byId.put(mt.getId(), mt) != null) {
                throw new IllegalArgumentException("Duplicate machine type: " + mt.getId());
            }
        }
        this.machineTypes = Collections.unmodifiableMap(byId);
        this.totalOperatorsPool = totalOperatorsPool;
        this.dailyWorkMinutes = dailyWorkMinutes;
        this.workDaysPerWeek = workDaysPerWeek;
    }

    public static ResourceCatalog from(PlantConfig cfg) {
        if (cfg.getMachines() == null || cfg.getMachines().isEmpty()) {
            throw new IllegalArgumentException("plant.machines 不能为空");
        }
        List<MachineType> types = new ArrayList<>();
        for (PlantConfig.MachineSpec m : cfg.getMachines()) {
            types.add(new MachineType(m.getId(), m.getSpeedMPerMin(), m.getSecondsPerBend(),
                    m.getPowerKw(), m.getUnits(), m.getOperatorsNeeded()));
        }
        return new ResourceCatalog(types, cfg.getTotalOperatorsPool(), cfg.getDailyWorkMinutes(), cfg.getWorkDaysPerWeek());
    }

    public Optional<MachineType> find(String machineTypeId) {
        return Optional.ofNullable(machineTypes.get(machineTypeId));
    }

    public Collection<MachineType> getMachineTypes() {
        return machineTypes.values();
    }

    /**
     * 为每个 units > 0 的机型生成机器实例，按目录顺序、序号升序。
     */
    public List<MachineUnit> createUnits() {
        List<MachineUnit> units = new ArrayList<>();
        for (MachineType mt : machineTypes.values()) {
            for (int i = 1; i <= mt.getUnits(); i++) {
                units.add(new MachineUnit(mt.getId(), i));
            }
        }
        return units;
    }

    public int getTotalOperatorsPool() {
        return totalOperatorsPool;
    }

    public int getDailyWorkMinutes() {
        return dailyWorkMinutes;
    }

    public int getWorkDaysPerWeek() {
        return workDaysPerWeek;
    }
}
