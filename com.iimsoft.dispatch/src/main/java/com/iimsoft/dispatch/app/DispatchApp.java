package com.iimsoft.dispatch.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.dispatch.api.dto.DispatchRequest;
import com.iimsoft.dispatch.api.dto.DispatchResponse;
import com.iimsoft.dispatch.service.DispatchRequestMapper;
import com.iimsoft.dispatch.service.DispatchResult;
import com.iimsoft.dispatch.service.DispatchService;
import com.iimsoft.dispatch.service.ProductionLogCsvExporter;
import com.iimsoft.dispatch.service.ScheduleReportPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 统一入口：从 JSON 请求调用调度器，响应 JSON 输出到 stdout，文本报告写日志。
 *
 * 用法：
 * - 读取文件：mvn exec:java -Dexec.args=path/to/request.json
 * - 读取 stdin：mvn exec:java -Dexec.args=- < request.json
 * - 同时导出 CSV：mvn exec:java -Dexec.args="request.json --csv out/schedule.csv"
 */
public class DispatchApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchApp.class);

    static final int EXIT_USAGE = 2;

    public static void main(String[] args) throws Exception {
        int code = new DispatchApp().run(args, System.in, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) throws Exception {
        if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
            stderr.println("缺少参数：DispatchRequest JSON 文件路径，或 '-' 代表从 stdin 读取。\n" +
                    "示例：mvn exec:java -Dexec.args=request.json [--csv schedule.csv]");
            return EXIT_USAGE;
        }
        String csvPath = null;
        for (int i = 1; i < args.length; i++) {
            if ("--csv".equals(args[i]) && i + 1 < args.length) {
                csvPath = args[++i];
            } else {
                stderr.println("未知参数：" + args[i]);
                return EXIT_USAGE;
            }
        }

        ObjectMapper mapper = new ObjectMapper();

        DispatchRequest request;
        String input = args[0].trim();
        if ("-".equals(input)) {
            request = mapper.readValue(stdin, DispatchRequest.class);
        } else {
            Path path = Path.of(input);
            if (!Files.exists(path) || Files.isDirectory(path)) {
                stderr.println("请求文件不存在或是目录：" + path.toAbsolutePath());
                return EXIT_USAGE;
            }
            request = mapper.readValue(new File(path.toString()), DispatchRequest.class);
        }

        DispatchRequestMapper requestMapper = new DispatchRequestMapper();
        DispatchService service = DispatchService.fromConfig(requestMapper.resolvePlant(request));

        long startTime = System.currentTimeMillis();
        DispatchResult result = service.dispatch(requestMapper.toOrders(request));
        LOGGER.info("Dispatch completed in {} ms", System.currentTimeMillis() - startTime);

        new ScheduleReportPrinter().print(result);
        if (csvPath != null) {
            new ProductionLogCsvExporter().export(result.getProductionLog(), csvPath);
            LOGGER.info("Production log exported to {}", csvPath);
        }

        DispatchResponse response = requestMapper.toResponse(result, service.getCalendar());
        stdout.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
        return 0;
    }
}
