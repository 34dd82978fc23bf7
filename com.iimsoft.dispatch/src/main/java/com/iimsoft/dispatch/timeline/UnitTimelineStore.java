package com.iimsoft.dispatch.timeline;

import com.iimsoft.dispatch.domain.MachineUnit;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 每台机器、每个工作日的占用表。
 * <p>
 * 查找（findSlot / selectBestUnit）和提交（commit）之间不允许有其他写入者；
 * 本类只由单线程的调度循环使用，非线程安全。
 */
public class UnitTimelineStore {

    private final int dailyWorkMinutes;
    private final List<MachineUnit> units;
    private final Map<MachineUnit, Map<Integer, UnitTimeline>> timelines = new LinkedHashMap<>();

    public UnitTimelineStore(List<MachineUnit> units, int dailyWorkMinutes) {
        this.units = List.copyOf(units);
        this.dailyWorkMinutes = dailyWorkMinutes;
        for (MachineUnit unit : this.units) {
            timelines.put(unit, new HashMap<>());
        }
    }

    /**
     * 当天开工前为所有机器建好空的占用表。
     */
    public void openDay(int day) {
        for (Map<Integer, UnitTimeline> byDay : timelines.values()) {
            byDay.computeIfAbsent(day, d -> new UnitTimeline(dailyWorkMinutes));
        }
    }

    public Optional<SlotCandidate> findSlot(MachineUnit unit, int day, double requiredMinutes) {
        UnitTimeline timeline = timelineOf(unit, day);
        OptionalDouble start = timeline == null
                ? new UnitTimeline(dailyWorkMinutes).firstFit(requiredMinutes)
                : timeline.firstFit(requiredMinutes);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        double s = start.getAsDouble();
        return Optional.of(new SlotCandidate(unit, s, s + requiredMinutes));
    }

    /**
     * 在指定机型的所有机器里选开始时间最早的那台。
     * 开始时间相同时取序号最小的（先遇到的），后面的机器只有更早才会替换。
     */
    public Optional<SlotCandidate> selectBestUnit(String machineTypeId, int day, double requiredMinutes) {
        SlotCandidate best = null;
        for (MachineUnit unit : units) {
            if (!unit.getMachineTypeId().equals(machineTypeId)) {
                continue;
            }
            Optional<SlotCandidate> slot = findSlot(unit, day, requiredMinutes);
            if (slot.isPresent() && (best == null || slot.get().getStart() < best.getStart())) {
                best = slot.get();
            }
        }
        return Optional.ofNullable(best);
    }

    public void commit(MachineUnit unit, int day, double start, double end, String orderId) {
        Map<Integer, UnitTimeline> byDay = timelines.get(unit);
        if (byDay == null) {
            throw new IllegalStateException("Unknown machine unit: " + unit);
        }
        byDay.computeIfAbsent(day, d -> new UnitTimeline(dailyWorkMinutes))
                .add(new TimeInterval(start, end, orderId));
    }

    public List<TimeInterval> intervalsOf(MachineUnit unit, int day) {
        UnitTimeline timeline = timelineOf(unit, day);
        return timeline == null ? Collections.emptyList() : timeline.getIntervals();
    }

    public double occupiedMinutes(MachineUnit unit, int day) {
        UnitTimeline timeline = timelineOf(unit, day);
        return timeline == null ? 0.0 : timeline.occupiedMinutes();
    }

    public List<MachineUnit> getUnits() {
        return units;
    }

    public int getDailyWorkMinutes() {
        return dailyWorkMinutes;
    }

    private UnitTimeline timelineOf(MachineUnit unit, int day) {
        Map<Integer, UnitTimeline> byDay = timelines.get(unit);
        if (byDay == null) {
            throw new IllegalArgumentException("Unknown machine unit: " + unit);
        }
        return byDay.get(day);
    }
}
