package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.domain.Order;
import com.iimsoft.dispatch.domain.OrderStatus;
import com.iimsoft.dispatch.domain.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 入口校验：数量非正、非数值、缺字段、重复订单号的记录在进入调度循环前被标记为 REJECTED。
 * 未知产品类型不在这里处理，留给调度循环作为分类错误。
 */
public class OrderValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrderValidator.class);

    private final ProductRouting routing;

    public OrderValidator(ProductRouting routing) {
        this.routing = routing;
    }

    /**
     * @return 被拒绝的订单数
     */
    public int validate(List<Order> orders) {
        Set<String> seenIds = new HashSet<>();
        int rejected = 0;
        for (Order order : orders) {
            if (order.getStatus() != OrderStatus.PENDING) {
                continue;
            }
            String reason = firstProblem(order, seenIds);
            if (reason != null) {
                order.markRejected(reason);
                rejected++;
                LOGGER.warn("Order {} rejected: {}", order.getId(), reason);
            }
        }
        return rejected;
    }

    private String firstProblem(Order order, Set<String> seenIds) {
        if (order.getId() == null || order.getId().isBlank()) {
            return "missing order id";
        }
        if (!seenIds.add(order.getId())) {
            return "duplicate order id " + order.getId();
        }
        if (order.getProductType() == null || order.getProductType().isBlank()) {
            return "missing product type";
        }
        if (order.getPriority() == null) {
            return "missing or unknown priority";
        }

        Optional<ProductRouting.Route> route = routing.resolve(order.getProductType());
        if (route.isEmpty()) {
            return null;
        }
        if (route.get().getWorkflow() == Workflow.FORMING) {
            Double length = order.getTotalLengthM();
            if (length == null || !Double.isFinite(length) || length <= 0) {
                return "total length must be a positive number, was " + length;
            }
        } else {
            Integer bends = order.getBendsPerItem();
            Integer count = order.getItemCount();
            if (bends == null || bends <= 0) {
                return "bends per item must be a positive integer, was " + bends;
            }
            if (count == null || count <= 0) {
                return "item count must be a positive integer, was " + count;
            }
        }
        return null;
    }
}
