package com.example.roadcare.service;

import com.example.roadcare.config.ObsolescenceProperties;
import com.example.roadcare.dto.ObsolescenceRunRequest;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 单次运行的生效参数：配置值 + 请求覆盖
 */
@Value
@Builder
public class RunSettings {

    double distanceThreshold;
    int workerCount;
    Set<String> axisFilter;
    int batchSize;

    public static RunSettings resolve(ObsolescenceProperties properties, ObsolescenceRunRequest request) {
        ObsolescenceRunRequest req = request != null ? request : new ObsolescenceRunRequest();

        double threshold = req.getDistanceThreshold() != null
                ? req.getDistanceThreshold() : properties.getDistanceThreshold();
        int workers = req.getWorkerCount() != null ? req.getWorkerCount() : properties.getWorkerCount();
        int batchSize = req.getBatchSize() != null ? req.getBatchSize() : properties.getBatchSize();
        List<String> axes = req.getAxisFilter() != null ? req.getAxisFilter() : properties.getAxisFilter();

        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("distanceThreshold 必须为非负数: " + threshold);
        }
        if (workers < 0) {
            throw new IllegalArgumentException("workerCount 不能为负数: " + workers);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize 必须大于0: " + batchSize);
        }

        return RunSettings.builder()
                .distanceThreshold(threshold)
                .workerCount(workers == 0 ? Runtime.getRuntime().availableProcessors() : workers)
                .axisFilter(toAxisSet(axes))
                .batchSize(batchSize)
                .build();
    }

    private static Set<String> toAxisSet(List<String> axes) {
        if (axes == null || axes.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> set = new TreeSet<>();
        for (String axis : axes) {
            if (axis != null && !axis.isBlank()) {
                set.add(axis.trim());
            }
        }
        // 显式给出的轴线全为空白时不能退化为“全部轴线”
        if (set.isEmpty()) {
            throw new IllegalArgumentException("axisFilter 不能只包含空白轴线: " + axes);
        }
        return Collections.unmodifiableSet(set);
    }

    public boolean isAllAxes() {
        return axisFilter.isEmpty();
    }
}
