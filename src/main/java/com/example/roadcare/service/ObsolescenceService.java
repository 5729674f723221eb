package com.example.roadcare.service;

import com.example.roadcare.config.ObsolescenceProperties;
import com.example.roadcare.domain.AxisPartition;
import com.example.roadcare.domain.ImageRecord;
import com.example.roadcare.domain.PartitionResult;
import com.example.roadcare.dto.ObsolescenceRunReport;
import com.example.roadcare.dto.ObsolescenceRunRequest;
import com.example.roadcare.engine.AxisPartitioner;
import com.example.roadcare.engine.ObsolescenceAggregator;
import com.example.roadcare.engine.PartitionWorker;
import com.example.roadcare.engine.RecordDeduplicator;
import com.example.roadcare.exception.ObsolescenceRunException;
import com.example.roadcare.store.IdUniquenessReport;
import com.example.roadcare.store.ImageRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 过时标记的完整运行
 * <p>
 * 一次运行在同一个事务内完成：
 * 唯一性检查 → 重置标记 → 读取 → 分区 → 并行裁决 → 合并 → 分批标记。
 * 任何一步失败都会回滚，标记保持运行前的状态。
 * 工作线程只做计算，读取在并行之前完成，写入在全部分区结束之后进行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObsolescenceService {

    private final ImageRecordStore store;
    private final ObsolescenceWriter writer;
    private final AxisPartitioner partitioner;
    private final PartitionWorker partitionWorker;
    private final ObsolescenceAggregator aggregator;
    private final RecordDeduplicator deduplicator;
    private final TransactionalOperator transactionalOperator;
    private final ObsolescenceProperties properties;
    private final RunReporter defaultReporter;

    public Mono<ObsolescenceRunReport> run(ObsolescenceRunRequest request) {
        return run(request, defaultReporter);
    }

    public Mono<ObsolescenceRunReport> run(ObsolescenceRunRequest request, RunReporter reporter) {
        return Mono.defer(() -> {
            RunSettings settings = RunSettings.resolve(properties, request);
            log.info("开始过时标记: 距离窗口 {} 米, {} 个工作线程, 轴线范围 {}",
                    settings.getDistanceThreshold(), settings.getWorkerCount(),
                    settings.isAllAxes() ? "全部" : settings.getAxisFilter());

            ObsolescenceRunReport report = ObsolescenceRunReport.builder()
                    .startTime(LocalDateTime.now())
                    .axisFilter(new ArrayList<>(settings.getAxisFilter()))
                    .distanceThreshold(settings.getDistanceThreshold())
                    .workerCount(settings.getWorkerCount())
                    .build();
            long startNanos = System.nanoTime();
            Scheduler workers = Schedulers.newParallel("obsolescence-worker", settings.getWorkerCount());

            Mono<ObsolescenceRunReport> pipeline = store.checkIdUniqueness()
                    .doOnNext(reporter::onUniquenessChecked)
                    .flatMap(uniqueness -> {
                        report.setIdUniquenessGuaranteed(uniqueness.isConstrained());
                        report.setDuplicateIdsDetected(uniqueness.getDuplicateIdCount());
                        return writer.reset(settings.getAxisFilter(), reporter)
                                .doOnNext(report::setRowsReset)
                                .then(loadRecords(settings, uniqueness, report, reporter));
                    })
                    .flatMap(records -> evaluate(records, settings, workers, report, reporter))
                    .flatMap(ids -> writer.mark(ids, settings.getAxisFilter(), settings.getBatchSize(),
                                    reporter)
                            .map(rows -> complete(report, ids.size(), rows, startNanos)));

            return transactionalOperator.transactional(pipeline)
                    .onErrorMap(e -> !(e instanceof ObsolescenceRunException),
                            e -> new ObsolescenceRunException("过时标记运行失败: " + e.getMessage(), e))
                    .doOnNext(reporter::onRunCompleted)
                    .doOnError(reporter::onRunFailed)
                    .doFinally(signal -> workers.dispose());
        });
    }

    private Mono<List<ImageRecord>> loadRecords(RunSettings settings, IdUniquenessReport uniqueness,
                                                ObsolescenceRunReport report, RunReporter reporter) {
        return store.loadActiveRecords(settings.getAxisFilter())
                .collectList()
                .map(rows -> {
                    List<ImageRecord> records = uniqueness.requiresDeduplication()
                            ? deduplicator.deduplicate(rows)
                            : rows;
                    report.setRecordsLoaded(rows.size());
                    report.setDuplicateRowsMerged(rows.size() - records.size());
                    reporter.onRecordsLoaded(rows.size(), records.size());
                    return records;
                });
    }

    /**
     * 每条轴线一个任务，join 之后合并
     */
    private Mono<Set<String>> evaluate(List<ImageRecord> records, RunSettings settings, Scheduler workers,
                                       ObsolescenceRunReport report, RunReporter reporter) {
        List<AxisPartition> partitions = partitioner.partition(records, settings.getAxisFilter());
        List<AxisPartition> workItems = partitions.stream()
                .filter(AxisPartition::hasWork)
                .collect(Collectors.toList());
        int partitioned = partitions.stream().mapToInt(AxisPartition::size).sum();

        report.setRecordsExcluded(records.size() - partitioned);
        report.setPartitionsProcessed(workItems.size());
        reporter.onPartitioned(partitions.size(), workItems.size(), records.size() - partitioned);

        double threshold = settings.getDistanceThreshold();
        return Flux.fromIterable(workItems)
                .parallel(settings.getWorkerCount())
                .runOn(workers)
                .map(partition -> partitionWorker.process(partition, threshold))
                .doOnNext(reporter::onPartitionCompleted)
                .sequential()
                .collectList()
                .map(results -> {
                    report.setCandidatePairsEvaluated(results.stream()
                            .mapToLong(PartitionResult::getPairsEvaluated)
                            .sum());
                    return aggregator.aggregate(results, reporter);
                });
    }

    private static ObsolescenceRunReport complete(ObsolescenceRunReport report, int idsMarked, long rowsUpdated,
                                                  long startNanos) {
        report.setIdsMarkedObsolete(idsMarked);
        report.setRowsUpdated(rowsUpdated);
        report.setRowsPerId(idsMarked == 0 ? 0.0 : (double) rowsUpdated / idsMarked);
        report.setEndTime(LocalDateTime.now());
        report.setDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        report.setSuccess(true);
        return report;
    }
}
