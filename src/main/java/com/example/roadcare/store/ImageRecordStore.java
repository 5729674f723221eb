package com.example.roadcare.store;

import com.example.roadcare.domain.ImageRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Set;

/**
 * 影像记录存储
 * <p>
 * axisFilter 为空集合时表示全部轴线。
 */
public interface ImageRecordStore {

    /**
     * 读取未过时、有轴线和 cumuld 的记录，顺序不保证
     */
    Flux<ImageRecord> loadActiveRecords(Set<String> axisFilter);

    /**
     * 将范围内的过时标记重置为 false，返回受影响行数
     */
    Mono<Long> resetObsoleteFlag(Set<String> axisFilter);

    /**
     * 分批标记过时，输入中的重复ID先去重，返回实际更新行数
     * <p>
     * 只更新 axisFilter 范围内的行：同一ID在范围外轴线上的重复行保持不变。
     */
    Mono<Long> markObsolete(Collection<String> ids, Set<String> axisFilter, int batchSize);

    Mono<IdUniquenessReport> checkIdUniqueness();
}
