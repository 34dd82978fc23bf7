package com.iimsoft.dispatch.domain;

/**
 * 订单优先级。rank 越小越先排。
 */
public enum Priority {
    URGENT(1, "Mendesak"),
    NORMAL(2, "Normal");

    private final int rank;
    private final String localLabel;

    Priority(int rank, String localLabel) {
        this.rank = rank;
        this.localLabel = localLabel;
    }

    public int getRank() {
        return rank;
    }

    public String getLocalLabel() {
        return localLabel;
    }

    /**
     * 解析外部输入：接受枚举名（大小写不敏感）或车间本地叫法（Mendesak / Normal）。
     *
     * @return null 表示无法识别
     */
    public static Priority parse(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        for (Priority p : values()) {
            if (p.name().equalsIgnoreCase(v) || p.localLabel.equalsIgnoreCase(v)) {
                return p;
            }
        }
        return null;
    }
}
