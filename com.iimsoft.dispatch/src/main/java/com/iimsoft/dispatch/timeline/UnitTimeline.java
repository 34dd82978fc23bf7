package com.iimsoft.dispatch.timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * 单台机器、单个工作日的占用表。区间按开始时间升序、互不重叠。
 * 非线程安全。
 */
public class UnitTimeline {

    private final int dailyWorkMinutes;
    private final List<TimeInterval> intervals = new ArrayList<>();

    public UnitTimeline(int dailyWorkMinutes) {
        this.dailyWorkMinutes = dailyWorkMinutes;
    }

    /**
     * 首次适配（first-fit）：按时间顺序扫描，返回第一个放得下的空档的开始时间。
     * 不修改占用表。结束时间按 start + requiredMinutes 比较，和 commit 时的算法一致。
     */
    public OptionalDouble firstFit(double requiredMinutes) {
        if (!Double.isFinite(requiredMinutes) || requiredMinutes < 0) {
            return OptionalDouble.empty();
        }
        double cursor = 0;
        for (TimeInterval interval : intervals) {
            // 区间之间的空档
            if (cursor + requiredMinutes <= interval.getStart()) {
                return OptionalDouble.of(cursor);
            }
            cursor = Math.max(cursor, interval.getEnd());
        }
        // 最后一个区间之后到下班
        if (cursor + requiredMinutes <= dailyWorkMinutes) {
            return OptionalDouble.of(cursor);
        }
        return OptionalDouble.empty();
    }

    public void add(TimeInterval interval) {
        if (interval.getEnd() > dailyWorkMinutes) {
            throw new IllegalStateException("Interval " + interval + " ends after the working day (" + dailyWorkMinutes + " min)");
        }
        for (TimeInterval existing : intervals) {
            if (existing.overlaps(interval)) {
                throw new IllegalStateException("Interval " + interval + " overlaps " + existing);
            }
        }
        intervals.add(interval);
        intervals.sort(Comparator.comparingDouble(TimeInterval::getStart));
    }

    public List<TimeInterval> getIntervals() {
        return Collections.unmodifiableList(intervals);
    }

    public double occupiedMinutes() {
        double sum = 0;
        for (TimeInterval i : intervals) {
            sum += i.length();
        }
        return sum;
    }
}
