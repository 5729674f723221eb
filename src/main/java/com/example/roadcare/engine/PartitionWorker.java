package com.example.roadcare.engine;

import com.example.roadcare.domain.AxisPartition;
import com.example.roadcare.domain.CandidatePair;
import com.example.roadcare.domain.ImageRecord;
import com.example.roadcare.domain.PartitionResult;
import com.example.roadcare.domain.Verdict;
import com.example.roadcare.exception.PartitionProcessingException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 处理单条轴线：候选对查找 + 规则裁决
 * <p>
 * 只读取自己的分区和阈值，结果以返回值交出，不触碰共享状态。
 */
@Component
@RequiredArgsConstructor
public class PartitionWorker {

    private final CandidatePairFinder pairFinder;
    private final ConflictRuleEngine ruleEngine;

    public PartitionResult process(AxisPartition partition, double distanceThreshold) {
        try {
            List<ImageRecord> records = partition.getRecords();
            Set<String> obsoleteIds = new HashSet<>();
            List<CandidatePair> pairs = pairFinder.findPairs(records, distanceThreshold);

            for (CandidatePair pair : pairs) {
                Verdict verdict = ruleEngine.resolve(records.get(pair.getFirst()), records.get(pair.getSecond()));
                verdict.marked().ifPresent(obsoleteIds::add);
            }
            return new PartitionResult(partition.getAxis(), obsoleteIds, pairs.size());
        } catch (RuntimeException e) {
            throw new PartitionProcessingException(partition.getAxis(), e);
        }
    }
}
