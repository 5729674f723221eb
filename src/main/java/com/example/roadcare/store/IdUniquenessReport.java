package com.example.roadcare.store;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * id 列唯一性检查结果
 */
@Value
@Builder
public class IdUniquenessReport {

    /** 是否存在 id 单列主键/唯一约束 */
    boolean constrained;

    /** 出现多次的ID个数 */
    long duplicateIdCount;

    /** 多出来的行数（总行数 - 不同ID数） */
    long surplusRowCount;

    /** 部分重复ID样例 */
    @Builder.Default
    List<String> sampleDuplicateIds = List.of();

    public static IdUniquenessReport guaranteed() {
        return IdUniquenessReport.builder().constrained(true).build();
    }

    /**
     * 没有约束时读取需要去重
     */
    public boolean requiresDeduplication() {
        return !constrained;
    }

    public boolean hasDuplicates() {
        return duplicateIdCount > 0;
    }
}
