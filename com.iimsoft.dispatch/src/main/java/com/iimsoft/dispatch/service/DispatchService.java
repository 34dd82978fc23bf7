package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.calendar.WorkCalendar;
import com.iimsoft.dispatch.config.PlantConfig;
import com.iimsoft.dispatch.domain.Assignment;
import com.iimsoft.dispatch.domain.MachineType;
import com.iimsoft.dispatch.domain.Order;
import com.iimsoft.dispatch.domain.OrderStatus;
import com.iimsoft.dispatch.domain.ResourceCatalog;
import com.iimsoft.dispatch.domain.Workflow;
import com.iimsoft.dispatch.estimate.TimeEstimator;
import com.iimsoft.dispatch.log.ProductionLog;
import com.iimsoft.dispatch.log.ProductionLogEntry;
import com.iimsoft.dispatch.log.ScheduleSummary;
import com.iimsoft.dispatch.operator.OperatorLedger;
import com.iimsoft.dispatch.timeline.SlotCandidate;
import com.iimsoft.dispatch.timeline.UnitTimelineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 按天推进的派工调度器。
 * <p>
 * 每个工作日：取出待排订单，按 (优先级, 订单号) 排序逐个尝试：
 * 分类流程 -> 估算工时和操作工 -> 找最早可用的机器空档 -> 检查操作工名额 -> 同时提交。
 * 排不下的订单留到下一个工作日；没有待排订单时结束。
 * <p>
 * 不回溯、不重排已落位的订单。每次 {@link #dispatch(List)} 都新建占用表、台账和日志，
 * 所以同一个实例可以重复使用，但单次运行本身是单线程的。
 */
public class DispatchService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchService.class);

    /** 紧急优先，其次订单号升序 */
    static final Comparator<Order> DISPATCH_ORDER = Comparator
            .comparingInt((Order o) -> o.getPriority().getRank())
            .thenComparing(Order::getId);

    private final ResourceCatalog catalog;
    private final ProductRouting routing;
    private final WorkCalendar calendar;
    private final int maxAttemptsPerOrder;
    private final int maxWorkingDays;

    /**
     * @param maxAttemptsPerOrder 因目录缺机型被跳过的天数上限，必须 &gt;= 1
     * @param maxWorkingDays      模拟的工作日上限，&lt;=0 表示不限
     */
    public DispatchService(ResourceCatalog catalog, ProductRouting routing, WorkCalendar calendar,
                           int maxAttemptsPerOrder, int maxWorkingDays) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.routing = Objects.requireNonNull(routing, "routing");
        this.calendar = Objects.requireNonNull(calendar, "calendar");
        if (maxAttemptsPerOrder < 1) {
            throw new IllegalArgumentException("maxAttemptsPerOrder must be >= 1, was " + maxAttemptsPerOrder);
        }
        this.maxAttemptsPerOrder = maxAttemptsPerOrder;
        this.maxWorkingDays = maxWorkingDays;
    }

    public static DispatchService fromConfig(PlantConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        ResourceCatalog catalog = ResourceCatalog.from(cfg);
        LocalDate startDate = cfg.getStartDate() == null || cfg.getStartDate().isBlank()
                ? null
                : LocalDate.parse(cfg.getStartDate().trim());
        return new DispatchService(
                catalog,
                ProductRouting.from(cfg),
                new WorkCalendar(catalog.getWorkDaysPerWeek(), startDate),
                cfg.getMaxAttemptsPerOrder(),
                cfg.getMaxWorkingDays());
    }

    public DispatchResult dispatch(List<Order> orders) {
        Objects.requireNonNull(orders, "orders");

        UnitTimelineStore store = new UnitTimelineStore(catalog.createUnits(), catalog.getDailyWorkMinutes());
        OperatorLedger ledger = new OperatorLedger(catalog.getTotalOperatorsPool());
        ProductionLog log = new ProductionLog();

        int rejected = new OrderValidator(routing).validate(orders);
        LOGGER.info("Dispatching {} orders ({} rejected at intake) on {} machine units, operator pool {}",
                orders.size(), rejected, store.getUnits().size(), ledger.getPoolSize());

        int day = WorkCalendar.FIRST_DAY;
        int workingDays = 0;
        String lastDayLabel = null;

        while (true) {
            List<Order> pending = pendingOf(orders);
            if (pending.isEmpty()) {
                LOGGER.info("No pending orders left after {} working day(s)", workingDays);
                break;
            }
            if (maxWorkingDays > 0 && workingDays >= maxWorkingDays) {
                LOGGER.warn("Working-day limit {} reached, {} order(s) still pending", maxWorkingDays, pending.size());
                break;
            }

            workingDays++;
            lastDayLabel = calendar.labelOf(day);
            store.openDay(day);
            ledger.openDay(day);
            pending.sort(DISPATCH_ORDER);
            LOGGER.info("---- {}: {} pending order(s) ----", lastDayLabel, pending.size());

            boolean progress = false;
            for (Order order : pending) {
                // 同一轮里已经处理过（重复条目）
                if (!order.isPending()) {
                    continue;
                }
                if (tryPlace(order, day, store, ledger, log)) {
                    progress = true;
                }
            }

            if (!progress && !pendingOf(orders).isEmpty()) {
                LOGGER.info("Nothing could be placed on {}, moving to the next working day", lastDayLabel);
            }
            day = calendar.nextWorkingDay(day);
        }

        ScheduleSummary summary = summarize(orders, log, workingDays, lastDayLabel);
        LOGGER.info("Dispatch finished: {}/{} scheduled, {} unschedulable, {} rejected, {} still pending, {} kWh",
                summary.getScheduled(), summary.getSubmitted(), summary.getUnschedulable(),
                summary.getRejected(), summary.getStillPending(), String.format("%.2f", summary.getTotalEnergyKwh()));
        return new DispatchResult(orders, log, store, ledger, summary);
    }

    /**
     * 尝试在指定工作日落位一个订单。
     *
     * @return true 表示已落位
     */
    private boolean tryPlace(Order order, int day, UnitTimelineStore store, OperatorLedger ledger, ProductionLog log) {
        order.recordAttempt();

        Optional<ProductRouting.Route> resolved = routing.resolve(order.getProductType());
        if (resolved.isEmpty()) {
            order.markUnschedulable("unknown product type: " + order.getProductType());
            LOGGER.error("Order {}: unknown product type '{}', giving up", order.getId(), order.getProductType());
            return false;
        }
        ProductRouting.Route route = resolved.get();

        MachineType machine = catalog.find(route.getMachineTypeId()).orElse(null);
        if (machine == null || machine.isProcessRole()) {
            return configurationError(order, "no schedulable machine '" + route.getMachineTypeId()
                    + "' in the catalog for product type " + order.getProductType());
        }

        double etcMinutes;
        int operators = machine.getOperatorsNeeded();
        if (route.getWorkflow() == Workflow.FORMING) {
            if (!machine.isLengthRated()) {
                return configurationError(order, "machine " + machine.getId() + " has no length rate");
            }
            etcMinutes = TimeEstimator.estimateForming(order.getTotalLengthM(), machine.getSpeedMPerMin());
        } else {
            if (!machine.isCycleRated()) {
                return configurationError(order, "machine " + machine.getId() + " has no bend rate");
            }
            // 剪板、叉车等协作角色只占操作工，不占机时
            for (String roleId : route.getSupportRoleIds()) {
                Optional<MachineType> role = catalog.find(roleId);
                if (role.isEmpty()) {
                    return configurationError(order, "process role '" + roleId + "' missing from the catalog");
                }
                operators += role.get().getOperatorsNeeded();
            }
            etcMinutes = TimeEstimator.estimateBending(order.getTotalBends(), machine.getSecondsPerBend());
        }
        LOGGER.debug("Order {}: workflow {} on {}, ETC {} min, {} operator(s)",
                order.getId(), route.getWorkflow(), machine.getId(), String.format("%.2f", etcMinutes), operators);

        String infeasible = infeasibility(etcMinutes, operators);
        if (infeasible != null) {
            order.markUnschedulable(infeasible);
            LOGGER.warn("Order {} can never be scheduled: {}", order.getId(), infeasible);
            return false;
        }

        Optional<SlotCandidate> slot = store.selectBestUnit(machine.getId(), day, etcMinutes);
        if (slot.isEmpty()) {
            LOGGER.debug("Order {} ({}): no {} unit free on day {}, deferred",
                    order.getId(), order.getPriority(), machine.getId(), day);
            return false;
        }
        if (!ledger.canAdmit(day, operators)) {
            LOGGER.debug("Order {} ({}): needs {} operator(s), only {} left on day {}, deferred",
                    order.getId(), order.getPriority(), operators, ledger.remaining(day), day);
            return false;
        }

        SlotCandidate s = slot.get();
        store.commit(s.getUnit(), day, s.getStart(), s.getEnd(), order.getId());
        ledger.commit(day, operators);

        double energyKwh = TimeEstimator.estimateEnergy(machine.getPowerKw(), etcMinutes);
        order.markScheduled(new Assignment(s.getUnit(), day, s.getStart(), s.getEnd(), etcMinutes, operators, energyKwh));
        log.append(new ProductionLogEntry(order.getId(), order.getProductType(), route.getWorkflow(),
                s.getUnit().getDisplayId(), day, calendar.labelOf(day),
                s.getStart(), s.getEnd(), etcMinutes, operators, energyKwh));

        LOGGER.info("Order {} ({}) scheduled on {} from minute {} to {}",
                order.getId(), order.getProductType(), s.getUnit().getDisplayId(),
                String.format("%.2f", s.getStart()), String.format("%.2f", s.getEnd()));
        return true;
    }

    /**
     * 目录缺机型：本轮跳过，下个工作日再试；累计超过上限后放弃。
     */
    private boolean configurationError(Order order, String reason) {
        int count = order.recordConfigurationError();
        if (count >= maxAttemptsPerOrder) {
            order.markUnschedulable("configuration error on " + count + " working day(s): " + reason);
            LOGGER.error("Order {}: {} (attempt ceiling {} reached, giving up)", order.getId(), reason, maxAttemptsPerOrder);
        } else {
            LOGGER.warn("Order {}: {}, skipped for today", order.getId(), reason);
        }
        return false;
    }

    /**
     * 空机、满员的一天都放不下的需求，再等也没用。
     *
     * @return null 表示可行
     */
    private String infeasibility(double etcMinutes, int operators) {
        if (!Double.isFinite(etcMinutes)) {
            return "machine rate is not positive, ETC is infinite";
        }
        if (etcMinutes > catalog.getDailyWorkMinutes()) {
            return String.format("ETC %.2f min exceeds the %d-minute working day", etcMinutes, catalog.getDailyWorkMinutes());
        }
        // 当天最晚的起点上 start + etc 仍要大于 start，否则区间宽度为 0
        int dailyMinutes = catalog.getDailyWorkMinutes();
        if (!(etcMinutes > 0) || !(dailyMinutes + etcMinutes > dailyMinutes)) {
            return String.format("ETC %s min is too small to occupy a time slot", etcMinutes);
        }
        if (operators > catalog.getTotalOperatorsPool()) {
            return "needs " + operators + " operators, pool has only " + catalog.getTotalOperatorsPool();
        }
        return null;
    }

    private static List<Order> pendingOf(List<Order> orders) {
        List<Order> pending = new ArrayList<>();
        for (Order o : orders) {
            if (o.getStatus() == OrderStatus.PENDING) {
                pending.add(o);
            }
        }
        return pending;
    }

    private static ScheduleSummary summarize(List<Order> orders, ProductionLog log, int workingDays, String lastDayLabel) {
        int scheduled = 0;
        int unschedulable = 0;
        int rejected = 0;
        int pending = 0;
        for (Order o : orders) {
            switch (o.getStatus()) {
                case SCHEDULED:
                    scheduled++;
                    break;
                case UNSCHEDULABLE:
                    unschedulable++;
                    break;
                case REJECTED:
                    rejected++;
                    break;
                default:
                    pending++;
                    break;
            }
        }
        return new ScheduleSummary(orders.size(), scheduled, unschedulable, rejected, pending,
                log.totalEnergyKwh(), workingDays, lastDayLabel);
    }

    public ResourceCatalog getCatalog() {
        return catalog;
    }

    public ProductRouting getRouting() {
        return routing;
    }

    public WorkCalendar getCalendar() {
        return calendar;
    }
}
