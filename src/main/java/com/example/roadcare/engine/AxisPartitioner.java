package com.example.roadcare.engine;

import com.example.roadcare.domain.AxisPartition;
import com.example.roadcare.domain.ImageRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 按道路轴线分组
 */
@Component
public class AxisPartitioner {

    // 同一 cumuld 按ID排序，保证分区内顺序确定
    private static final Comparator<ImageRecord> BY_CUMULD =
            Comparator.comparingDouble(ImageRecord::getCumuld).thenComparing(ImageRecord::getId,
                    Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * 仅保留未过时、有轴线、有 cumuld 的记录；axisFilter 为空时处理全部轴线。
     * 返回按轴线名排序的分区，含不足两条记录的分区。
     */
    public List<AxisPartition> partition(Collection<ImageRecord> records, Set<String> axisFilter) {
        Map<String, List<ImageRecord>> byAxis = new TreeMap<>();
        boolean filtered = axisFilter != null && !axisFilter.isEmpty();

        for (ImageRecord record : records) {
            if (record.isObsolete() || !record.hasAxis() || !record.hasCumuld()) {
                continue;
            }
            if (filtered && !axisFilter.contains(record.getAxis())) {
                continue;
            }
            byAxis.computeIfAbsent(record.getAxis(), k -> new ArrayList<>()).add(record);
        }

        List<AxisPartition> partitions = new ArrayList<>(byAxis.size());
        byAxis.forEach((axis, list) -> {
            list.sort(BY_CUMULD);
            partitions.add(new AxisPartition(axis, list));
        });
        return partitions;
    }
}
