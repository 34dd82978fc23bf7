package com.iimsoft.dispatch.api.dto;

import java.util.List;

public class DispatchResponse {

    /** 生产日志，按落位顺序 */
    public List<EntryResult> entries;

    public SummaryResult summary;

    /** 没排上的订单（永久失败或仍待排）及原因 */
    public List<UnplacedOrder> unplaced;

    public static class EntryResult {
        public String orderId;
        public String productType;
        public String workflow;
        public String unitId;
        public int day;
        public String dayLabel;
        public String date;          // ISO-8601，配置了 startDate 才有

        public double startMinute;   // 相对当天工作开始
        public double endMinute;
        public double durationMinutes;
        public double durationHours;

        public int operatorsUsed;
        public double energyKwh;
    }

    public static class SummaryResult {
        public int submitted;
        public int scheduled;
        public int unschedulable;
        public int rejected;
        public int stillPending;
        public double totalEnergyKwh;
        public int workingDaysSimulated;
        public String lastDayLabel;
    }

    public static class UnplacedOrder {
        public String orderId;
        public String productType;
        public String status;        // UNSCHEDULABLE/REJECTED/PENDING
        public String reason;
        public int attempts;
    }
}
