package com.example.roadcare.engine;

import com.example.roadcare.domain.PartitionResult;
import com.example.roadcare.service.RunReporter;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * 合并各分区的过时ID
 * <p>
 * 分区按轴线互斥，正常不会重叠；出现重叠时照常合并并上报重叠数。
 */
@Component
public class ObsolescenceAggregator {

    public Set<String> aggregate(Collection<PartitionResult> results, RunReporter reporter) {
        Set<String> all = new TreeSet<>();
        int overlapping = 0;
        for (PartitionResult result : results) {
            for (String id : result.getObsoleteIds()) {
                if (!all.add(id)) {
                    overlapping++;
                }
            }
        }
        reporter.onAggregated(all.size(), overlapping);
        return all;
    }
}
