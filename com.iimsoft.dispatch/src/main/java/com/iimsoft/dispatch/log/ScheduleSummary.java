package com.iimsoft.dispatch.log;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 调度汇总：已排 / 永久失败 / 仍待排（只在运行上限截断时非 0）。
 */
@Data
@AllArgsConstructor
public class ScheduleSummary {
    private int submitted;
    private int scheduled;
    private int unschedulable;
    private int rejected;
    private int stillPending;
    private double totalEnergyKwh;
    private int workingDaysSimulated;
    private String lastDayLabel;

    public int getPermanentlyFailed() {
        return unschedulable + rejected;
    }
}
