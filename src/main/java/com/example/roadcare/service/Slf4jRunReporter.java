package com.example.roadcare.service;

import com.example.roadcare.domain.PartitionResult;
import com.example.roadcare.dto.ObsolescenceRunReport;
import com.example.roadcare.exception.PartitionProcessingException;
import com.example.roadcare.store.IdUniquenessReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class Slf4jRunReporter implements RunReporter {

    @Override
    public void onUniquenessChecked(IdUniquenessReport report) {
        if (!report.isConstrained() && report.hasDuplicates()) {
            log.warn("⚠️ image.id 没有唯一约束，发现 {} 个重复ID（多出 {} 行），样例: {}，改用去重读取",
                    report.getDuplicateIdCount(), report.getSurplusRowCount(), report.getSampleDuplicateIds());
        } else if (!report.isConstrained()) {
            log.info("image.id 没有唯一约束，当前无重复ID，仍使用去重读取");
        } else {
            log.debug("image.id 唯一性由约束保证");
        }
    }

    @Override
    public void onFlagsReset(long rowsReset) {
        log.info("已重置 {} 条记录的过时标记", rowsReset);
    }

    @Override
    public void onRecordsLoaded(int rowsRead, int uniqueRecords) {
        if (rowsRead != uniqueRecords) {
            log.warn("读取 {} 行，去重后 {} 条记录", rowsRead, uniqueRecords);
        } else {
            log.info("读取 {} 条记录", rowsRead);
        }
    }

    @Override
    public void onPartitioned(int partitions, int partitionsWithWork, int recordsExcluded) {
        log.info("共 {} 条轴线，其中 {} 条需要并行处理，排除 {} 条记录", partitions, partitionsWithWork, recordsExcluded);
    }

    @Override
    public void onPartitionCompleted(PartitionResult result) {
        log.debug("轴线 '{}': 评估 {} 对，标记 {} 条", result.getAxis(), result.getPairsEvaluated(),
                result.getObsoleteIds().size());
    }

    @Override
    public void onAggregated(int idsToMark, int overlappingIds) {
        if (overlappingIds > 0) {
            log.warn("有 {} 个ID同时出现在多个分区的结果中", overlappingIds);
        }
        log.info("合计 {} 条记录待标记为过时", idsToMark);
    }

    @Override
    public void onMarked(int idsTargeted, long rowsUpdated) {
        double ratio = idsTargeted == 0 ? 0.0 : (double) rowsUpdated / idsTargeted;
        if (ratio > 1.0) {
            log.warn("⚠️ 更新 {} 行 / 目标 {} 个ID (比例 {})，存在重复行", rowsUpdated, idsTargeted,
                    String.format("%.3f", ratio));
        } else {
            log.info("更新 {} 行 / 目标 {} 个ID (比例 {})", rowsUpdated, idsTargeted, String.format("%.3f", ratio));
        }
    }

    @Override
    public void onRunCompleted(ObsolescenceRunReport report) {
        log.info("✅ 处理完成，耗时 {} ms，标记过时 {} 条", report.getDurationMs(), report.getRowsUpdated());
    }

    @Override
    public void onRunFailed(Throwable error) {
        if (error instanceof PartitionProcessingException) {
            log.error("❌ 运行中止，失败轴线: {}", ((PartitionProcessingException) error).getAxis(), error);
        } else {
            log.error("❌ 运行中止: {}", error.getMessage(), error);
        }
    }
}
