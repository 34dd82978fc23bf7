package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.calendar.WorkCalendar;
import com.iimsoft.dispatch.config.PlantConfig;
import com.iimsoft.dispatch.domain.Assignment;
import com.iimsoft.dispatch.domain.MachineType;
import com.iimsoft.dispatch.domain.MachineUnit;
import com.iimsoft.dispatch.domain.Order;
import com.iimsoft.dispatch.domain.OrderStatus;
import com.iimsoft.dispatch.domain.Priority;
import com.iimsoft.dispatch.domain.ResourceCatalog;
import com.iimsoft.dispatch.domain.Workflow;
import com.iimsoft.dispatch.log.ProductionLogEntry;
import com.iimsoft.dispatch.log.ScheduleSummary;
import com.iimsoft.dispatch.timeline.TimeInterval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DispatchService Tests")
class DispatchServiceTest {

    private static final double EPS = 1e-9;

    private static DispatchService defaultPlant() {
        return DispatchService.fromConfig(PlantConfig.defaultPlant());
    }

    /** 一台 16 m/min 的成型机，10 名操作工，每天 480 分钟 */
    private static DispatchService singleFormingUnit(int maxAttempts, int maxDays) {
        ResourceCatalog catalog = new ResourceCatalog(
                List.of(new MachineType("Former", 16.0, null, 11, 1, 1)), 10, 480, 5);
        ProductRouting routing = new ProductRouting(List.of(
                new ProductRouting.Route("Sheet", Workflow.FORMING, "Former", List.of()),
                new ProductRouting.Route("Ghost", Workflow.FORMING, "MissingMachine", List.of())));
        return new DispatchService(catalog, routing, new WorkCalendar(5), maxAttempts, maxDays);
    }

    private static List<String> idsOf(List<ProductionLogEntry> entries) {
        return entries.stream().map(ProductionLogEntry::getOrderId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Single forming unit scenario")
    class SingleUnit {

        @Test
        @DisplayName("4800 m at 16 m/min is placed on day 1 at [0,300) using 55 kWh")
        void placesOnDayOne() {
            Order order = Order.forming("O1", "Sheet", Priority.NORMAL, 4800);

            DispatchResult result = singleFormingUnit(30, 0).dispatch(new ArrayList<>(List.of(order)));

            assertEquals(OrderStatus.SCHEDULED, order.getStatus());
            Assignment a = order.getAssignment();
            assertEquals(new MachineUnit("Former", 1), a.getUnit());
            assertEquals(1, a.getDay());
            assertEquals(0.0, a.getStartMinute(), EPS);
            assertEquals(300.0, a.getEndMinute(), EPS);
            assertEquals(300.0, a.getDurationMinutes(), EPS);
            assertEquals(1, a.getOperatorsUsed());
            assertEquals(11.0 * 300 / 60, a.getEnergyKwh(), EPS);

            ProductionLogEntry entry = result.getProductionLog().getEntries().get(0);
            assertEquals("Former_1", entry.getUnitId());
            assertEquals("Day 1", entry.getDayLabel());
            assertEquals(Workflow.FORMING, entry.getWorkflow());
            assertEquals(1, result.getSummary().getWorkingDaysSimulated());
        }

        @Test
        @DisplayName("Second order on the same unit starts where the first ended")
        void secondOrderFollowsFirst() {
            Order first = Order.forming("O1", "Sheet", Priority.NORMAL, 1600);
            Order second = Order.forming("O2", "Sheet", Priority.NORMAL, 800);

            singleFormingUnit(30, 0).dispatch(new ArrayList<>(List.of(second, first)));

            assertEquals(0.0, first.getAssignment().getStartMinute(), EPS);
            assertEquals(100.0, second.getAssignment().getStartMinute(), EPS);
            assertEquals(150.0, second.getAssignment().getEndMinute(), EPS);
        }

        @Test
        @DisplayName("Full-day orders skip the weekend after the fifth working day")
        void weekendSkip() {
            List<Order> orders = new ArrayList<>();
            for (int i = 1; i <= 6; i++) {
                orders.add(Order.forming("O" + i, "Sheet", Priority.NORMAL, 16 * 480));
            }

            DispatchResult result = singleFormingUnit(30, 0).dispatch(orders);

            List<Integer> days = result.getProductionLog().getEntries().stream()
                    .map(ProductionLogEntry::getDay).collect(Collectors.toList());
            assertEquals(List.of(1, 2, 3, 4, 5, 8), days);
            assertEquals(6, result.getSummary().getWorkingDaysSimulated());
            assertEquals("Day 8", result.getSummary().getLastDayLabel());
        }
    }

    @Nested
    @DisplayName("Operator pool")
    class OperatorPool {

        /** 两台机器各需 6 人，池子 10 人：一天只能开一台 */
        private DispatchService twoHungryMachines() {
            ResourceCatalog catalog = new ResourceCatalog(List.of(
                    new MachineType("A", 10.0, null, 5, 1, 6),
                    new MachineType("B", 10.0, null, 5, 1, 6)), 10, 480, 5);
            ProductRouting routing = new ProductRouting(List.of(
                    new ProductRouting.Route("ProdA", Workflow.FORMING, "A", List.of()),
                    new ProductRouting.Route("ProdB", Workflow.FORMING, "B", List.of())));
            return new DispatchService(catalog, routing, new WorkCalendar(5), 30, 0);
        }

        @Test
        @DisplayName("12 operators against a pool of 10: urgent order placed, the other deferred to the next day")
        void urgentWins_otherDeferred() {
            Order normal = Order.forming("O1", "ProdA", Priority.NORMAL, 1000);
            Order urgent = Order.forming("O2", "ProdB", Priority.URGENT, 1000);

            DispatchResult result = twoHungryMachines().dispatch(new ArrayList<>(List.of(normal, urgent)));

            assertEquals(1, urgent.getAssignment().getDay());
            assertEquals(2, normal.getAssignment().getDay());
            assertEquals(List.of("O2", "O1"), idsOf(result.getProductionLog().getEntries()));
            assertEquals(6, result.getOperatorLedger().committed(1));
            assertEquals(6, result.getOperatorLedger().committed(2));
            assertEquals(2, normal.getAttempts());
        }

        @Test
        @DisplayName("With equal priority the smaller identifier wins")
        void equalPriority_smallerIdWins() {
            Order later = Order.forming("O2", "ProdA", Priority.NORMAL, 1000);
            Order earlier = Order.forming("O1", "ProdB", Priority.NORMAL, 1000);

            twoHungryMachines().dispatch(new ArrayList<>(List.of(later, earlier)));

            assertEquals(1, earlier.getAssignment().getDay());
            assertEquals(2, later.getAssignment().getDay());
        }

        @Test
        @DisplayName("Operator requirement above the whole pool is reported as unschedulable")
        void requirementAbovePool() {
            PlantConfig cfg = PlantConfig.defaultPlant();
            cfg.setTotalOperatorsPool(4);
            Order accessory = Order.accessory("A1", "Aksesoris", Priority.URGENT, 2, 10);

            DispatchResult result = DispatchService.fromConfig(cfg).dispatch(new ArrayList<>(List.of(accessory)));

            assertEquals(OrderStatus.UNSCHEDULABLE, accessory.getStatus());
            assertTrue(accessory.getFailureReason().contains("5 operators"));
            assertEquals(1, result.getSummary().getUnschedulable());
        }
    }

    @Nested
    @DisplayName("Workflow classification")
    class Classification {

        @Test
        @DisplayName("SD680 and Kabe325 run on the Yane750 machine")
        void derivedTypes_runOnYane750() {
            Order sd = Order.forming("P1", "SD680", Priority.NORMAL, 2000);
            Order kabe = Order.forming("P2", "Kabe325", Priority.NORMAL, 400);

            defaultPlant().dispatch(new ArrayList<>(List.of(sd, kabe)));

            assertEquals("Yane750_1", sd.getAssignment().getUnit().getDisplayId());
            assertEquals(100.0, sd.getAssignment().getDurationMinutes(), EPS);
            assertEquals(9.5 * 100 / 60, sd.getAssignment().getEnergyKwh(), EPS);
            assertEquals("Yane750_1", kabe.getAssignment().getUnit().getDisplayId());
            assertEquals(100.0, kabe.getAssignment().getStartMinute(), EPS);
        }

        @Test
        @DisplayName("Accessories occupy a bending unit and take shearing + forklift + bending operators")
        void accessory_usesBendingAndThreeRoles() {
            Order accessory = Order.accessory("A1", "Aksesoris", Priority.NORMAL, 4, 300);

            DispatchResult result = defaultPlant().dispatch(new ArrayList<>(List.of(accessory)));

            Assignment a = accessory.getAssignment();
            assertEquals("Bending_1", a.getUnit().getDisplayId());
            assertEquals(80.0, a.getDurationMinutes(), EPS);
            assertEquals(5, a.getOperatorsUsed());
            assertEquals(9.7 * 80 / 60, a.getEnergyKwh(), EPS);
            assertEquals(Workflow.SHEARING_BENDING, result.getProductionLog().getEntries().get(0).getWorkflow());
        }

        @Test
        @DisplayName("Unknown product type is permanently unschedulable and never retried")
        void unknownProductType() {
            Order unknown = Order.forming("X1", "Genteng", Priority.URGENT, 100);
            Order fine = Order.forming("X2", "Yane600", Priority.NORMAL, 100);

            DispatchResult result = defaultPlant().dispatch(new ArrayList<>(List.of(unknown, fine)));

            assertEquals(OrderStatus.UNSCHEDULABLE, unknown.getStatus());
            assertEquals(1, unknown.getAttempts());
            assertEquals(OrderStatus.SCHEDULED, fine.getStatus());
            assertEquals(1, result.getSummary().getWorkingDaysSimulated());
        }

        @Test
        @DisplayName("Missing catalog machine is retried until the attempt ceiling, then given up")
        void configurationError_boundedByAttempts() {
            Order ghost = Order.forming("G1", "Ghost", Priority.NORMAL, 100);

            DispatchResult result = singleFormingUnit(3, 0).dispatch(new ArrayList<>(List.of(ghost)));

            assertEquals(OrderStatus.UNSCHEDULABLE, ghost.getStatus());
            assertEquals(3, ghost.getConfigurationErrors());
            assertEquals(3, result.getSummary().getWorkingDaysSimulated());
            assertTrue(ghost.getFailureReason().startsWith("configuration error on 3 working day(s)"));
        }

        @Test
        @DisplayName("Working-day limit stops the run and reports still-pending orders")
        void workingDayLimit() {
            Order ghost = Order.forming("G1", "Ghost", Priority.NORMAL, 100);

            DispatchResult result = singleFormingUnit(30, 4).dispatch(new ArrayList<>(List.of(ghost)));

            ScheduleSummary summary = result.getSummary();
            assertEquals(OrderStatus.PENDING, ghost.getStatus());
            assertEquals(1, summary.getStillPending());
            assertEquals(4, summary.getWorkingDaysSimulated());
            assertEquals(0, summary.getPermanentlyFailed());
        }

        @Test
        @DisplayName("Attempt ceiling below one is refused at construction")
        void attemptCeilingMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> singleFormingUnit(0, 0));
            assertThrows(IllegalArgumentException.class, () -> singleFormingUnit(-1, 10));

            PlantConfig cfg = PlantConfig.defaultPlant();
            cfg.setMaxAttemptsPerOrder(0);
            assertThrows(IllegalArgumentException.class, () -> DispatchService.fromConfig(cfg));
        }
    }

    @Nested
    @DisplayName("Infeasible demand")
    class Infeasible {

        @Test
        @DisplayName("ETC longer than the working day is unschedulable, not retried forever")
        void etcAboveDay() {
            Order tooLong = Order.forming("L1", "Yane600", Priority.NORMAL, 16 * 481);

            DispatchResult result = defaultPlant().dispatch(new ArrayList<>(List.of(tooLong)));

            assertEquals(OrderStatus.UNSCHEDULABLE, tooLong.getStatus());
            assertTrue(tooLong.getFailureReason().contains("exceeds the 480-minute working day"));
            assertTrue(result.getProductionLog().isEmpty());
        }

        @Test
        @DisplayName("A machine with zero rate yields an infinite ETC and is unschedulable")
        void zeroRate() {
            ResourceCatalog catalog = new ResourceCatalog(
                    List.of(new MachineType("Stuck", 0.0, null, 5, 1, 1)), 10, 480, 5);
            ProductRouting routing = new ProductRouting(List.of(
                    new ProductRouting.Route("Sheet", Workflow.FORMING, "Stuck", List.of())));
            Order order = Order.forming("Z1", "Sheet", Priority.NORMAL, 10);

            new DispatchService(catalog, routing, new WorkCalendar(5), 30, 0).dispatch(new ArrayList<>(List.of(order)));

            assertEquals(OrderStatus.UNSCHEDULABLE, order.getStatus());
            assertTrue(order.getFailureReason().contains("infinite"));
        }

        @Test
        @DisplayName("Quantity too small to widen a slot is unschedulable and the run carries on")
        void etcBelowTimeResolution() {
            Order big = Order.forming("P1", "Yane750", Priority.NORMAL, 6000);
            Order tiny = Order.forming("P2", "Yane750", Priority.NORMAL, 1e-13);
            Order other = Order.forming("P3", "Yane600", Priority.NORMAL, 160);

            DispatchResult result = defaultPlant().dispatch(new ArrayList<>(List.of(big, tiny, other)));

            assertEquals(OrderStatus.SCHEDULED, big.getStatus());
            assertEquals(OrderStatus.UNSCHEDULABLE, tiny.getStatus());
            assertTrue(tiny.getFailureReason().contains("too small to occupy a time slot"));
            assertEquals(OrderStatus.SCHEDULED, other.getStatus());
            assertEquals(List.of("P1", "P3"), idsOf(result.getProductionLog().getEntries()));
        }

        @Test
        @DisplayName("A full working day fits exactly")
        void exactlyOneDay() {
            Order exact = Order.forming("E1", "Yane600", Priority.NORMAL, 16 * 480);

            defaultPlant().dispatch(new ArrayList<>(List.of(exact)));

            assertEquals(OrderStatus.SCHEDULED, exact.getStatus());
            assertEquals(480.0, exact.getAssignment().getEndMinute(), EPS);
        }
    }

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        private List<Order> mixedOrders() {
            String[] types = {"Yane600", "Yane672", "Yane750", "SD680", "Kabe325"};
            List<Order> orders = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = String.format("P%03d", i);
                Priority priority = i % 3 == 0 ? Priority.URGENT : Priority.NORMAL;
                if (i % 4 == 3) {
                    orders.add(Order.accessory(id, "Aksesoris", priority, 3 + i % 5, 50 + 10 * i));
                } else {
                    orders.add(Order.forming(id, types[i % types.length], priority, 500 + 137.5 * i));
                }
            }
            return orders;
        }

        @Test
        @DisplayName("No two intervals on a unit and day overlap, and every interval fits the day")
        void noOverlap() {
            DispatchResult result = defaultPlant().dispatch(mixedOrders());

            assertEquals(40, result.getSummary().getScheduled());
            for (ProductionLogEntry e : result.getProductionLog().getEntries()) {
                for (MachineUnit unit : result.getTimelineStore().getUnits()) {
                    List<TimeInterval> intervals = result.getTimelineStore().intervalsOf(unit, e.getDay());
                    double occupied = 0;
                    for (int i = 0; i < intervals.size(); i++) {
                        TimeInterval a = intervals.get(i);
                        assertTrue(a.getStart() >= 0 && a.getEnd() <= 480);
                        occupied += a.length();
                        for (int j = i + 1; j < intervals.size(); j++) {
                            assertFalse(a.overlaps(intervals.get(j)), unit + " day " + e.getDay());
                        }
                    }
                    assertTrue(occupied <= 480 + EPS);
                }
            }
        }

        @Test
        @DisplayName("Committed operators never exceed the pool on any day")
        void operatorBudget() {
            DispatchResult result = defaultPlant().dispatch(mixedOrders());

            for (ProductionLogEntry e : result.getProductionLog().getEntries()) {
                assertTrue(result.getOperatorLedger().committed(e.getDay()) <= 10);
            }
            int sumForDay1 = result.getProductionLog().getEntries().stream()
                    .filter(e -> e.getDay() == 1).mapToInt(ProductionLogEntry::getOperatorsUsed).sum();
            assertEquals(result.getOperatorLedger().committed(1), sumForDay1);
        }

        @Test
        @DisplayName("The same input produces an identical schedule")
        void deterministic() {
            DispatchResult first = defaultPlant().dispatch(mixedOrders());
            DispatchResult second = defaultPlant().dispatch(mixedOrders());

            assertEquals(first.getProductionLog().getEntries().toString(),
                    second.getProductionLog().getEntries().toString());
        }

        @Test
        @DisplayName("Feasible orders are all placed within as many working days as there are orders")
        void terminationBound() {
            List<Order> orders = mixedOrders();
            DispatchResult result = defaultPlant().dispatch(orders);

            assertEquals(0, result.getSummary().getStillPending());
            assertTrue(result.getSummary().getWorkingDaysSimulated() <= orders.size());
            assertEquals(result.getProductionLog().size(), result.getSummary().getScheduled());
        }

        @Test
        @DisplayName("Total energy equals the sum over the production log")
        void totalEnergy() {
            DispatchResult result = defaultPlant().dispatch(mixedOrders());

            double sum = result.getProductionLog().getEntries().stream().mapToDouble(ProductionLogEntry::getEnergyKwh).sum();
            assertEquals(sum, result.getSummary().getTotalEnergyKwh(), 1e-6);
        }
    }

    @Test
    @DisplayName("Rejected orders never enter the loop")
    void rejectedOrdersSkipLoop() {
        Order bad = Order.forming("B1", "Yane600", Priority.NORMAL, -10);
        Order good = Order.forming("B2", "Yane600", Priority.NORMAL, 160);

        DispatchResult result = defaultPlant().dispatch(new ArrayList<>(List.of(bad, good)));

        assertEquals(OrderStatus.REJECTED, bad.getStatus());
        assertEquals(0, bad.getAttempts());
        assertEquals(1, result.getSummary().getRejected());
        assertEquals(1, result.getSummary().getScheduled());
    }

    @Test
    @DisplayName("Empty order list completes immediately")
    void emptyInput() {
        DispatchResult result = defaultPlant().dispatch(new ArrayList<>());

        assertEquals(0, result.getSummary().getSubmitted());
        assertEquals(0, result.getSummary().getWorkingDaysSimulated());
        assertNull(result.getSummary().getLastDayLabel());
    }
}
