package com.iimsoft.dispatch.domain;

import java.util.Objects;

/**
 * 生产订单。
 * <p>
 * 成型类产品填 totalLengthM；配件（Aksesoris）填 bendsPerItem 和 itemCount。
 * 调度器只修改 status / assignment / attempts / failureReason。
 */
public class Order {
    private String id;
    private String productType;
    private Priority priority;
    private String thicknessBmt; // 只做展示，不参与计算

    private Double totalLengthM;
    private Integer bendsPerItem;
    private Integer itemCount;

    private OrderStatus status = OrderStatus.PENDING;
    private String failureReason;
    private int attempts;
    private int configurationErrors;
    private Assignment assignment;

    public Order() {}

    public Order(String id, String productType, Priority priority) {
        this.id = id;
        this.productType = productType;
        this.priority = priority;
    }

    public static Order forming(String id, String productType, Priority priority, double totalLengthM) {
        Order order = new Order(id, productType, priority);
        order.setTotalLengthM(totalLengthM);
        return order;
    }

    public static Order accessory(String id, String productType, Priority priority, int bendsPerItem, int itemCount) {
        Order order = new Order(id, productType, priority);
        order.setBendsPerItem(bendsPerItem);
        order.setItemCount(itemCount);
        return order;
    }

    public String getId() { return id; }
    public String getProductType() { return productType; }
    public Priority getPriority() { return priority; }
    public String getThicknessBmt() { return thicknessBmt; }
    public Double getTotalLengthM() { return totalLengthM; }
    public Integer getBendsPerItem() { return bendsPerItem; }
    public Integer getItemCount() { return itemCount; }
    public OrderStatus getStatus() { return status; }
    public String getFailureReason() { return failureReason; }
    public int getAttempts() { return attempts; }
    public int getConfigurationErrors() { return configurationErrors; }
    public Assignment getAssignment() { return assignment; }

    public void setId(String id) { this.id = id; }
    public void setProductType(String productType) { this.productType = productType; }
    public void setPriority(Priority priority) { this.priority = priority; }
    public void setThicknessBmt(String thicknessBmt) { this.thicknessBmt = thicknessBmt; }
    public void setTotalLengthM(Double totalLengthM) { this.totalLengthM = totalLengthM; }
    public void setBendsPerItem(Integer bendsPerItem) { this.bendsPerItem = bendsPerItem; }
    public void setItemCount(Integer itemCount) { this.itemCount = itemCount; }

    public boolean isScheduled() {
        return status == OrderStatus.SCHEDULED;
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    /** 总折弯次数 = 每件折弯数 × 件数；字段缺失时返回 0 */
    public long getTotalBends() {
        if (bendsPerItem == null || itemCount == null) {
            return 0L;
        }
        return (long) bendsPerItem * (long) itemCount;
    }

    public void recordAttempt() {
        attempts++;
    }

    /** 目录缺机型导致本轮跳过；返回累计次数 */
    public int recordConfigurationError() {
        return ++configurationErrors;
    }

    public void markScheduled(Assignment assignment) {
        this.assignment = Objects.requireNonNull(assignment, "assignment");
        this.status = OrderStatus.SCHEDULED;
        this.failureReason = null;
    }

    public void markUnschedulable(String reason) {
        this.status = OrderStatus.UNSCHEDULABLE;
        this.failureReason = reason;
    }

    public void markRejected(String reason) {
        this.status = OrderStatus.REJECTED;
        this.failureReason = reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order)) return false;
        Order order = (Order) o;
        return Objects.equals(id, order.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Order{id='" + id + "', productType=" + productType + ", priority=" + priority + ", status=" + status + "}";
    }
}
