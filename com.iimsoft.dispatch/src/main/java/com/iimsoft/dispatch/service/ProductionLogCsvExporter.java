package com.iimsoft.dispatch.service;

import com.iimsoft.dispatch.log.ProductionLog;
import com.iimsoft.dispatch.log.ProductionLogEntry;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 生产日志导出为 CSV，一行一个落位，顺序与日志一致。
 * 表头：order_id,product_type,workflow,unit,day,day_label,start_minute,end_minute,duration_minutes,operators,energy_kwh
 */
public class ProductionLogCsvExporter {

    public static final String HEADER =
            "order_id,product_type,workflow,unit,day,day_label,start_minute,end_minute,duration_minutes,operators,energy_kwh";

    public void export(ProductionLog log, String csvPath) throws IOException {
        File file = new File(csvPath);
        if (!file.isAbsolute()) {
            String cwd = System.getProperty("user.dir");
            file = new File(cwd, csvPath);
        }
        if (file.isDirectory()) {
            throw new IOException("目标路径是目录: " + file.getAbsolutePath());
        }
        File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("无法创建目录: " + parent.getAbsolutePath());
        }
        try (BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file, false), StandardCharsets.UTF_8))) {
            write(log, writer);
        }
    }

    public void write(ProductionLog log, Writer writer) throws IOException {
        String sep = System.lineSeparator();
        writer.write(HEADER);
        writer.write(sep);
        for (ProductionLogEntry e : log.getEntries()) {
            writer.write(String.join(",",
                    escape(e.getOrderId()),
                    escape(e.getProductType()),
                    e.getWorkflow().name(),
                    escape(e.getUnitId()),
                    String.valueOf(e.getDay()),
                    escape(e.getDayLabel()),
                    String.format(Locale.ROOT, "%.2f", e.getStartMinute()),
                    String.format(Locale.ROOT, "%.2f", e.getEndMinute()),
                    String.format(Locale.ROOT, "%.2f", e.getDurationMinutes()),
                    String.valueOf(e.getOperatorsUsed()),
                    String.format(Locale.ROOT, "%.4f", e.getEnergyKwh())
            ));
            writer.write(sep);
        }
        writer.flush();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
