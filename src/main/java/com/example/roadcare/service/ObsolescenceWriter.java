package com.example.roadcare.service;

import com.example.roadcare.exception.ObsolescenceWriteException;
import com.example.roadcare.exception.ObsolescenceWriteException.Phase;
import com.example.roadcare.store.ImageRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * 过时标记写入：先重置范围内的标记，再分批标记
 * <p>
 * 事务边界由调用方控制，任一批失败都会让整个写入回滚。
 */
@Component
@RequiredArgsConstructor
public class ObsolescenceWriter {

    private final ImageRecordStore store;

    public Mono<Long> reset(Set<String> axisFilter, RunReporter reporter) {
        return store.resetObsoleteFlag(axisFilter)
                .defaultIfEmpty(0L)
                .onErrorMap(e -> !(e instanceof ObsolescenceWriteException),
                        e -> new ObsolescenceWriteException(Phase.RESET, e))
                .doOnNext(reporter::onFlagsReset);
    }

    public Mono<Long> mark(Set<String> ids, Set<String> axisFilter, int batchSize, RunReporter reporter) {
        return store.markObsolete(ids, axisFilter, batchSize)
                .defaultIfEmpty(0L)
                .onErrorMap(e -> !(e instanceof ObsolescenceWriteException),
                        e -> new ObsolescenceWriteException(Phase.MARK, e))
                .doOnNext(rows -> reporter.onMarked(ids.size(), rows));
    }
}
