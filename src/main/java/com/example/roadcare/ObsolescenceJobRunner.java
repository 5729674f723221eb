package com.example.roadcare;

import com.example.roadcare.config.ObsolescenceProperties;
import com.example.roadcare.dto.ObsolescenceRunReport;
import com.example.roadcare.dto.ObsolescenceRunRequest;
import com.example.roadcare.service.ObsolescenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * 批处理模式：启动时按配置运行一次，失败时退出码为 1
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObsolescenceJobRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ObsolescenceService obsolescenceService;
    private final ObsolescenceProperties properties;

    private volatile int exitCode = 0;

    @Override
    public void run(String... args) {
        if (!properties.isRunOnStartup()) {
            return;
        }
        log.info("以批处理模式启动过时标记...");
        try {
            ObsolescenceRunReport report = obsolescenceService.run(new ObsolescenceRunRequest()).block();
            if (report == null || !report.isSuccess()) {
                exitCode = 1;
                return;
            }
            log.info("读取 {} 条, 处理 {} 条轴线, 评估 {} 对, 标记 {} 个ID, 更新 {} 行",
                    report.getRecordsLoaded(), report.getPartitionsProcessed(), report.getCandidatePairsEvaluated(),
                    report.getIdsMarkedObsolete(), report.getRowsUpdated());
        } catch (RuntimeException e) {
            log.error("批处理运行失败，退出码 1: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public boolean isEnabled() {
        return properties.isRunOnStartup();
    }
}
