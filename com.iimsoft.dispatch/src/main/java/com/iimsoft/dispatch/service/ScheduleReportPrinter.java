package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.domain.MachineUnit;
import com.iimsoft.dispatch.domain.Order;
import com.iimsoft.dispatch.log.ProductionLogEntry;
import com.iimsoft.dispatch.log.ScheduleSummary;
import com.iimsoft.dispatch.timeline.TimeInterval;
import com.iimsoft.dispatch.timeline.UnitTimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * 把调度结果渲染成文本报告，输出到日志。
 */
public class ScheduleReportPrinter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleReportPrinter.class);

    public void print(DispatchResult result) {
        for (String line : render(result)) {
            LOGGER.info(line);
        }
    }

    public List<String> render(DispatchResult result) {
        List<String> out = new ArrayList<>();
        out.add("==== Production log ====");
        if (result.getProductionLog().isEmpty()) {
            out.add("No orders were scheduled.");
        }
        for (ProductionLogEntry e : result.getProductionLog().getEntries()) {
            out.add(String.format(Locale.ROOT, "Order %s | Product %s | Unit %s | %s",
                    e.getOrderId(), e.getProductType(), e.getUnitId(), e.getDayLabel()));
            out.add(String.format(Locale.ROOT, "  Start minute %.2f | End minute %.2f | Duration %.2f min (%.2f h)",
                    e.getStartMinute(), e.getEndMinute(), e.getDurationMinutes(), e.getDurationMinutes() / 60.0));
            out.add(String.format(Locale.ROOT, "  Operators %d | Energy %.2f kWh", e.getOperatorsUsed(), e.getEnergyKwh()));
        }

        out.add("==== Machine utilization ====");
        UnitTimelineStore store = result.getTimelineStore();
        TreeSet<Integer> days = new TreeSet<>();
        for (ProductionLogEntry e : result.getProductionLog().getEntries()) {
            days.add(e.getDay());
        }
        for (int day : days) {
            for (MachineUnit unit : store.getUnits()) {
                List<TimeInterval> intervals = store.intervalsOf(unit, day);
                if (intervals.isEmpty()) {
                    continue;
                }
                double used = store.occupiedMinutes(unit, day);
                out.add(String.format(Locale.ROOT, "Day %d %s: %d job(s), %.2f/%d min (%.1f%%), operators %d/%d",
                        day, unit.getDisplayId(), intervals.size(), used, store.getDailyWorkMinutes(),
                        100.0 * used / store.getDailyWorkMinutes(),
                        result.getOperatorLedger().committed(day), result.getOperatorLedger().getPoolSize()));
            }
        }

        List<Order> unplaced = new ArrayList<>();
        for (Order o : result.getOrders()) {
            if (!o.isScheduled()) {
                unplaced.add(o);
            }
        }
        if (!unplaced.isEmpty()) {
            out.add("==== Not scheduled ====");
            for (Order o : unplaced) {
                out.add(String.format(Locale.ROOT, "Order %s (%s): %s%s", o.getId(), o.getProductType(), o.getStatus(),
                        o.getFailureReason() == null ? "" : " - " + o.getFailureReason()));
            }
        }

        ScheduleSummary s = result.getSummary();
        out.add("==== Summary ====");
        out.add(String.format(Locale.ROOT, "Scheduled orders: %d/%d", s.getScheduled(), s.getSubmitted()));
        out.add(String.format(Locale.ROOT, "Permanently failed: %d (unschedulable %d, rejected %d)",
                s.getPermanentlyFailed(), s.getUnschedulable(), s.getRejected()));
        if (s.getStillPending() > 0) {
            out.add(String.format(Locale.ROOT, "Still pending: %d", s.getStillPending()));
        }
        out.add(String.format(Locale.ROOT, "Total energy: %.2f kWh", s.getTotalEnergyKwh()));
        out.add(String.format(Locale.ROOT, "Working days simulated: %d (last: %s)",
                s.getWorkingDaysSimulated(), s.getLastDayLabel() == null ? "-" : s.getLastDayLabel()));
        return out;
    }
}
