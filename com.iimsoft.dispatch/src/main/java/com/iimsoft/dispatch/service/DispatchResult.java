package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.domain.Order;
import com.iimsoft.dispatch.log.ProductionLog;
import com.iimsoft.dispatch.log.ScheduleSummary;
import com.iimsoft.dispatch.operator.OperatorLedger;
import com.iimsoft.dispatch.timeline.UnitTimelineStore;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 一次调度运行的全部结果：订单最终状态、生产日志、机器占用表、操作工台账、汇总。
 */
@Getter
@AllArgsConstructor
public class DispatchResult {
    private final List<Order> orders;
    private final ProductionLog productionLog;
    private final UnitTimelineStore timelineStore;
    private final OperatorLedger operatorLedger;
    private final ScheduleSummary summary;
}
