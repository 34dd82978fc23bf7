package com.iimsoft.dispatch.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 只追加的生产日志，顺序即落位顺序（不一定按日期或优先级）。
 */
public class ProductionLog {

    private final List<ProductionLogEntry> entries = new ArrayList<>();

    public void append(ProductionLogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry is null");
        }
        entries.add(entry);
    }

    public List<ProductionLogEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public double totalEnergyKwh() {
        double sum = 0;
        for (ProductionLogEntry e : entries) {
            sum += e.getEnergyKwh();
        }
        return sum;
    }
}
