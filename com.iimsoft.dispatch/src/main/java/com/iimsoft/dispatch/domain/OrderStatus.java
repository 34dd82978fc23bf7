package com.iimsoft.dispatch.domain;

public enum OrderStatus {
    /** 待排，下一个工作日会再试 */
    PENDING,
    SCHEDULED,
    /** 永久无法排程（未知产品类型、需求不可行、超过尝试上限） */
    UNSCHEDULABLE,
    /** 入口校验不通过，从未进入调度循环 */
    REJECTED;

    public boolean isTerminalFailure() {
        return this == UNSCHEDULABLE || this == REJECTED;
    }
}
