package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.api.dto.DispatchRequest;
import com.iimsoft.dispatch.api.dto.DispatchResponse;
import com.iimsoft.dispatch.calendar.WorkCalendar;
import com.iimsoft.dispatch.config.PlantConfig;
import com.iimsoft.dispatch.config.PlantConfigLoader;
import com.iimsoft.dispatch.domain.Order;
import com.iimsoft.dispatch.domain.Priority;
import com.iimsoft.dispatch.log.ProductionLogEntry;
import com.iimsoft.dispatch.log.ScheduleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 请求 DTO -> 领域对象，以及调度结果 -> 响应 DTO。
 */
public class DispatchRequestMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchRequestMapper.class);

    private final PlantConfigLoader configLoader;

    public DispatchRequestMapper() {
        this(new PlantConfigLoader());
    }

    public DispatchRequestMapper(PlantConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public DispatchResponse dispatch(DispatchRequest request) {
        DispatchService service = DispatchService.fromConfig(resolvePlant(request));
        DispatchResult result = service.dispatch(toOrders(request));
        return toResponse(result, service.getCalendar());
    }

    /**
     * 请求自带的 plant 优先，否则走 PlantConfigLoader。
     */
    public PlantConfig resolvePlant(DispatchRequest request) {
        Objects.requireNonNull(request, "request");
        return request.plant != null ? request.plant : configLoader.load();
    }

    /**
     * orders 缺省或为空表示没有订单，调度直接结束；只拒绝 null 条目。
     */
    public void validateRequest(DispatchRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.orders == null) {
            return;
        }
        for (DispatchRequest.OrderDto o : request.orders) {
            if (o == null) {
                throw new IllegalArgumentException("request.orders 不能包含 null");
            }
        }
    }

    /**
     * 优先级解析失败时保留 null，交给 OrderValidator 拒绝并给出原因。
     */
    public List<Order> toOrders(DispatchRequest request) {
        validateRequest(request);
        List<Order> orders = new ArrayList<>();
        if (request.orders == null || request.orders.isEmpty()) {
            LOGGER.info("Request contains no orders, nothing to dispatch");
            return orders;
        }
        for (DispatchRequest.OrderDto dto : request.orders) {
            Order order = new Order(
                    dto.orderId == null ? null : dto.orderId.trim(),
                    dto.productType == null ? null : dto.productType.trim(),
                    Priority.parse(dto.priority));
            order.setThicknessBmt(dto.thicknessBmt);
            order.setTotalLengthM(dto.totalLengthM);
            order.setBendsPerItem(dto.bendsPerItem);
            order.setItemCount(dto.itemCount);
            orders.add(order);
        }
        return orders;
    }

    public DispatchResponse toResponse(DispatchResult result, WorkCalendar calendar) {
        DispatchResponse resp = new DispatchResponse();

        List<DispatchResponse.EntryResult> entries = new ArrayList<>();
        for (ProductionLogEntry e : result.getProductionLog().getEntries()) {
            DispatchResponse.EntryResult r = new DispatchResponse.EntryResult();
            r.orderId = e.getOrderId();
            r.productType = e.getProductType();
            r.workflow = e.getWorkflow().name();
            r.unitId = e.getUnitId();
            r.day = e.getDay();
            r.dayLabel = e.getDayLabel();
            LocalDate date = calendar.dateOf(e.getDay());
            r.date = date == null ? null : date.toString();
            r.startMinute = e.getStartMinute();
            r.endMinute = e.getEndMinute();
            r.durationMinutes = e.getDurationMinutes();
            r.durationHours = e.getDurationMinutes() / 60.0;
            r.operatorsUsed = e.getOperatorsUsed();
            r.energyKwh = e.getEnergyKwh();
            entries.add(r);
        }
        resp.entries = entries;

        ScheduleSummary s = result.getSummary();
        DispatchResponse.SummaryResult sr = new DispatchResponse.SummaryResult();
        sr.submitted = s.getSubmitted();
        sr.scheduled = s.getScheduled();
        sr.unschedulable = s.getUnschedulable();
        sr.rejected = s.getRejected();
        sr.stillPending = s.getStillPending();
        sr.totalEnergyKwh = s.getTotalEnergyKwh();
        sr.workingDaysSimulated = s.getWorkingDaysSimulated();
        sr.lastDayLabel = s.getLastDayLabel();
        resp.summary = sr;

        List<DispatchResponse.UnplacedOrder> unplaced = new ArrayList<>();
        for (Order o : result.getOrders()) {
            if (o.isScheduled()) {
                continue;
            }
            DispatchResponse.UnplacedOrder u = new DispatchResponse.UnplacedOrder();
            u.orderId = o.getId();
            u.productType = o.getProductType();
            u.status = o.getStatus().name();
            u.reason = o.getFailureReason();
            u.attempts = o.getAttempts();
            unplaced.add(u);
        }
        resp.unplaced = unplaced;
        return resp;
    }
}
