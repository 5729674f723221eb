package com.example.roadcare.domain;

import lombok.Value;

import java.util.Set;

/**
 * 单个分区的处理结果
 */
@Value
public class PartitionResult {
    String axis;
    Set<String> obsoleteIds;
    int pairsEvaluated;

    public PartitionResult(String axis, Set<String> obsoleteIds, int pairsEvaluated) {
        this.axis = axis;
        this.obsoleteIds = Set.copyOf(obsoleteIds);
        this.pairsEvaluated = pairsEvaluated;
    }
}
