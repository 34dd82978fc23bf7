package com.iimsoft.dispatch.calendar;

import java.time.LocalDate;

/**
 * 工作日历（按天判断某个日序号是否工作日）。
 *
 * 说明：
 * - 日序号从 1 开始，Day 1 是一周的第一个工作日；按 7 天一周，前 workDaysPerWeek 天上班。
 * - 例如每周 5 天：Day 1..5 上班，Day 6、7 休息，Day 5 之后的下一个工作日是 Day 8。
 * - startDate 可选，只影响标签（"Day 8 (2024-01-08)"），不影响计算。
 */
public final class WorkCalendar {

    public static final int DAYS_PER_WEEK = 7;
    public static final int FIRST_DAY = 1;

    private final int workDaysPerWeek;
    private final LocalDate startDate;

    public WorkCalendar(int workDaysPerWeek) {
        this(workDaysPerWeek, null);
    }

    public WorkCalendar(int workDaysPerWeek, LocalDate startDate) {
        if (workDaysPerWeek < 1 || workDaysPerWeek > DAYS_PER_WEEK) {
            throw new IllegalArgumentException("workDaysPerWeek must be in 1..7, was " + workDaysPerWeek);
        }
        this.workDaysPerWeek = workDaysPerWeek;
        this.startDate = startDate;
    }

    public boolean isWorkingDay(int day) {
        if (day < FIRST_DAY) {
            return false;
        }
        return Math.floorMod(day - FIRST_DAY, DAYS_PER_WEEK) < workDaysPerWeek;
    }

    /** 下一个工作日（跳过周末） */
    public int nextWorkingDay(int day) {
        int next = Math.max(day, FIRST_DAY - 1) + 1;
        while (!isWorkingDay(next)) {
            next++;
        }
        return next;
    }

    public LocalDate dateOf(int day) {
        return startDate == null ? null : startDate.plusDays(day - FIRST_DAY);
    }

    public String labelOf(int day) {
        LocalDate date = dateOf(day);
        return date == null ? "Day " + day : "Day " + day + " (" + date + ")";
    }

    public int getWorkDaysPerWeek() {
        return workDaysPerWeek;
    }

    public LocalDate getStartDate() {
        return startDate;
    }
}
