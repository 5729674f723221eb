package com.example.roadcare.engine;

import com.example.roadcare.domain.CandidatePair;
import com.example.roadcare.domain.ImageRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 在已排序的分区内查找距离窗口内的候选对
 * <p>
 * 每个无序对只产生一次 (i &lt; j)：数组有序，对 i 只需扫描
 * (i, upperBound(cumuld[i] + threshold)) 这段连续区间。
 */
@Component
public class CandidatePairFinder {

    public List<CandidatePair> findPairs(List<ImageRecord> sorted, double distanceThreshold) {
        if (Double.isNaN(distanceThreshold) || distanceThreshold < 0) {
            throw new IllegalArgumentException("distanceThreshold 必须为非负数: " + distanceThreshold);
        }
        double[] positions = positionsOf(sorted);
        List<CandidatePair> pairs = new ArrayList<>();

        for (int i = 0; i < positions.length - 1; i++) {
            int end = upperBound(positions, i + 1, positions[i] + distanceThreshold);
            for (int j = i + 1; j < end; j++) {
                pairs.add(new CandidatePair(i, j));
            }
        }
        return pairs;
    }

    private static double[] positionsOf(List<ImageRecord> sorted) {
        double[] positions = new double[sorted.size()];
        for (int i = 0; i < positions.length; i++) {
            ImageRecord record = sorted.get(i);
            if (!record.hasCumuld()) {
                throw new IllegalArgumentException("记录缺少 cumuld: " + record.getId());
            }
            positions[i] = record.getCumuld();
            if (i > 0 && positions[i] < positions[i - 1]) {
                throw new IllegalArgumentException("分区未按 cumuld 排序，位置 " + i + " 处: " + record.getId());
            }
        }
        return positions;
    }

    /**
     * 在 [from, length) 中找第一个大于 limit 的下标
     */
    static int upperBound(double[] values, int from, double limit) {
        int lo = from;
        int hi = values.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (values[mid] <= limit) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
