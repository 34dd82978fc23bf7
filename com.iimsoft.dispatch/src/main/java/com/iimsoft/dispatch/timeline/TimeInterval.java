package com.iimsoft.dispatch.timeline;

import java.util.Objects;

/**
 * 当天内的占用区间 [start, end)，单位分钟，带所属订单号。
 */
public final class TimeInterval {

    private final double start;
    private final double end;
    private final String orderId;

    public TimeInterval(double start, double end, String orderId) {
        if (!(start >= 0) || !(end > start)) {
            throw new IllegalArgumentException("Invalid interval [" + start + ", " + end + ") for order " + orderId);
        }
        this.start = start;
        this.end = end;
        this.orderId = orderId;
    }

    public double getStart() { return start; }
    public double getEnd() { return end; }
    public String getOrderId() { return orderId; }

    public double length() {
        return end - start;
    }

    public boolean overlaps(TimeInterval other) {
        return start < other.end && other.start < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeInterval)) return false;
        TimeInterval that = (TimeInterval) o;
        return Double.compare(start, that.start) == 0
                && Double.compare(end, that.end) == 0
                && Objects.equals(orderId, that.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, orderId);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") " + orderId;
    }
}
