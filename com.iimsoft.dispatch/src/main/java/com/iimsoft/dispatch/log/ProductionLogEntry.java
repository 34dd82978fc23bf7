package com.iimsoft.dispatch.log;

import com.iimsoft.dispatch.domain.Workflow;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 生产日志条目：一次成功落位的快照，写入后不再修改。
 */
@Getter
@ToString
@AllArgsConstructor
public final class ProductionLogEntry {
    private final String orderId;
    private final String productType;
    private final Workflow workflow;
    private final String unitId;
    private final int day;
    private final String dayLabel;
    private final double startMinute;
    private final double endMinute;
    private final double durationMinutes;
    private final int operatorsUsed;
    private final double energyKwh;
}
