package com.example.roadcare.domain;

import lombok.Value;

import java.util.List;

/**
 * 单条轴线的记录集合，按 cumuld 升序
 */
@Value
public class AxisPartition {
    String axis;
    List<ImageRecord> records;

    public AxisPartition(String axis, List<ImageRecord> records) {
        this.axis = axis;
        this.records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * 少于两条记录时不可能产生冲突
     */
    public boolean hasWork() {
        return records.size() >= 2;
    }
}
