package com.example.roadcare.store;

import com.example.roadcare.domain.ImageRecord;
import com.example.roadcare.entity.ImageRow;
import com.example.roadcare.entity.ImageRowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 R2DBC 的影像记录存储
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class R2dbcImageRecordStore implements ImageRecordStore {

    private static final int SAMPLE_SIZE = 10;
    private static final int PROGRESS_EVERY_BATCHES = 10;

    // 当前 schema 中 image.id 上的单列主键或唯一约束
    private static final String ID_CONSTRAINT_SQL =
            "SELECT COUNT(*) AS n FROM information_schema.table_constraints tc "
                    + "JOIN information_schema.key_column_usage kcu "
                    + "ON tc.constraint_name = kcu.constraint_name "
                    + "AND tc.table_schema = kcu.table_schema AND tc.table_name = kcu.table_name "
                    + "WHERE tc.constraint_type IN ('PRIMARY KEY', 'UNIQUE') "
                    + "AND LOWER(tc.table_schema) = LOWER(current_schema) "
                    + "AND LOWER(tc.table_name) = 'image' AND LOWER(kcu.column_name) = 'id' "
                    + "AND NOT EXISTS (SELECT 1 FROM information_schema.key_column_usage k2 "
                    + "WHERE k2.constraint_name = tc.constraint_name AND k2.table_schema = tc.table_schema "
                    + "AND k2.table_name = tc.table_name AND LOWER(k2.column_name) <> 'id')";

    private static final String DUPLICATE_COUNT_SQL =
            "SELECT COUNT(*) AS duplicate_ids, CAST(COALESCE(SUM(cnt - 1), 0) AS BIGINT) AS surplus_rows "
                    + "FROM (SELECT id, COUNT(*) AS cnt FROM image GROUP BY id HAVING COUNT(*) > 1) d";

    private static final String DUPLICATE_SAMPLE_SQL =
            "SELECT id FROM image GROUP BY id HAVING COUNT(*) > 1 ORDER BY id LIMIT " + SAMPLE_SIZE;

    private final ImageRowRepository imageRowRepository;
    private final DatabaseClient databaseClient;

    @Override
    public Flux<ImageRecord> loadActiveRecords(Set<String> axisFilter) {
        Flux<ImageRow> rows = isAll(axisFilter)
                ? imageRowRepository.findActive()
                : imageRowRepository.findActiveByAxes(axisFilter);
        return rows.map(R2dbcImageRecordStore::toRecord);
    }

    @Override
    public Mono<Long> resetObsoleteFlag(Set<String> axisFilter) {
        Mono<Integer> updated = isAll(axisFilter)
                ? imageRowRepository.resetAll()
                : imageRowRepository.resetByAxes(axisFilter);
        return updated.map(Integer::longValue)
                .defaultIfEmpty(0L)
                .doOnNext(count -> log.debug("重置过时标记 {} 行", count));
    }

    @Override
    public Mono<Long> markObsolete(Collection<String> ids, Set<String> axisFilter, int batchSize) {
        if (batchSize <= 0) {
            return Mono.error(new IllegalArgumentException("batchSize 必须大于0: " + batchSize));
        }
        if (ids == null || ids.isEmpty()) {
            log.info("没有需要标记的记录");
            return Mono.just(0L);
        }

        return Mono.fromCallable(() -> toBatches(ids, batchSize))
                .flatMap(batches -> {
                    log.info("分 {} 批标记 {} 条记录，每批 {} 条", batches.size(),
                            batches.stream().mapToInt(List::size).sum(), batchSize);
                    AtomicLong total = new AtomicLong();
                    return Flux.fromIterable(batches)
                            .index()
                            .concatMap(indexed -> markBatch(indexed.getT2(), axisFilter)
                                    .defaultIfEmpty(0)
                                    .doOnNext(updated -> {
                                        long soFar = total.addAndGet(updated);
                                        if ((indexed.getT1() + 1) % PROGRESS_EVERY_BATCHES == 0) {
                                            log.info("已更新 {} 条记录...", soFar);
                                        }
                                    }))
                            .then(Mono.fromCallable(total::get));
                });
    }

    private Mono<Integer> markBatch(List<UUID> batch, Set<String> axisFilter) {
        return isAll(axisFilter)
                ? imageRowRepository.markObsolete(batch)
                : imageRowRepository.markObsoleteInAxes(batch, axisFilter);
    }

    @Override
    public Mono<IdUniquenessReport> checkIdUniqueness() {
        return databaseClient.sql(ID_CONSTRAINT_SQL)
                .map((row, meta) -> toLong(row.get("n", Number.class)))
                .one()
                .defaultIfEmpty(0L)
                .flatMap(constraints -> {
                    if (constraints > 0) {
                        return Mono.just(IdUniquenessReport.guaranteed());
                    }
                    return duplicateReport();
                });
    }

    private Mono<IdUniquenessReport> duplicateReport() {
        Mono<long[]> counts = databaseClient.sql(DUPLICATE_COUNT_SQL)
                .map((row, meta) -> new long[]{
                        toLong(row.get("duplicate_ids", Number.class)),
                        toLong(row.get("surplus_rows", Number.class))})
                .one()
                .defaultIfEmpty(new long[]{0L, 0L});

        Mono<List<String>> sample = databaseClient.sql(DUPLICATE_SAMPLE_SQL)
                .map((row, meta) -> String.valueOf(row.get("id")))
                .all()
                .collectList();

        return Mono.zip(counts, sample)
                .map(tuple -> IdUniquenessReport.builder()
                        .constrained(false)
                        .duplicateIdCount(tuple.getT1()[0])
                        .surplusRowCount(tuple.getT1()[1])
                        .sampleDuplicateIds(tuple.getT2())
                        .build());
    }

    /**
     * 去重后按固定大小切批，ID 非法时抛出 IllegalArgumentException
     */
    static List<List<UUID>> toBatches(Collection<String> ids, int batchSize) {
        List<UUID> unique = new ArrayList<>(new LinkedHashSet<>(toUuids(ids)));
        List<List<UUID>> batches = new ArrayList<>();
        for (int i = 0; i < unique.size(); i += batchSize) {
            batches.add(unique.subList(i, Math.min(i + batchSize, unique.size())));
        }
        return batches;
    }

    private static List<UUID> toUuids(Collection<String> ids) {
        List<UUID> uuids = new ArrayList<>(ids.size());
        for (String id : ids) {
            uuids.add(UUID.fromString(id));
        }
        return uuids;
    }

    static ImageRecord toRecord(ImageRow row) {
        return ImageRecord.builder()
                .id(row.getId() != null ? row.getId().toString() : null)
                .axis(row.getAxe())
                .sessionId(row.getSessionId())
                .cumuld(row.getCumuld())
                .cumuldSession(row.getCumuldSession())
                .sens(row.getSens())
                .index(row.getIndex() != null ? row.getIndex() : ImageRecord.UNKNOWN_INDEX)
                .captureDate(row.getCaptureDate())
                .qualityScore(row.getNoteGlobale())
                .obsolete(Boolean.TRUE.equals(row.getObsolette()))
                .build();
    }

    private static boolean isAll(Set<String> axisFilter) {
        return axisFilter == null || axisFilter.isEmpty();
    }

    private static long toLong(Number value) {
        return value != null ? value.longValue() : 0L;
    }
}
