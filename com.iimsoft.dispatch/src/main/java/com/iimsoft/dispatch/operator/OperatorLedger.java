package com.iimsoft.dispatch.operator;

import java.util.HashMap;
import java.util.Map;

/**
 * 每日操作工占用台账。committed(day) 永远不超过 poolSize。
 * 只由单线程调度循环按“先 canAdmit 再 commit”的顺序调用，非线程安全。
 */
public class OperatorLedger {

    private final int poolSize;
    private final Map<Integer, Integer> committedByDay = new HashMap<>();

    public OperatorLedger(int poolSize) {
        if (poolSize < 0) {
            throw new IllegalArgumentException("poolSize must be >= 0, was " + poolSize);
        }
        this.poolSize = poolSize;
    }

    /** 当天开工前建好记录，初始为 0 */
    public void openDay(int day) {
        committedByDay.putIfAbsent(day, 0);
    }

    public boolean canAdmit(int day, int requiredOperators) {
        return remaining(day) >= requiredOperators;
    }

    public void commit(int day, int requiredOperators) {
        if (requiredOperators < 0) {
            throw new IllegalArgumentException("requiredOperators must be >= 0, was " + requiredOperators);
        }
        if (!canAdmit(day, requiredOperators)) {
            throw new IllegalStateException("Day " + day + ": committing " + requiredOperators
                    + " operators would exceed the pool of " + poolSize + " (already " + committed(day) + ")");
        }
        committedByDay.merge(day, requiredOperators, Integer::sum);
    }

    public int committed(int day) {
        return committedByDay.getOrDefault(day, 0);
    }

    public int remaining(int day) {
        return poolSize - committed(day);
    }

    public int getPoolSize() {
        return poolSize;
    }
}
