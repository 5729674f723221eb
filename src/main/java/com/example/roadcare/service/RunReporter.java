package com.example.roadcare.service;

import com.example.roadcare.domain.PartitionResult;
import com.example.roadcare.dto.ObsolescenceRunReport;
import com.example.roadcare.store.IdUniquenessReport;

/**
 * 运行过程事件的上报接口，由调用方注入到各阶段
 * <p>
 * onPartitionCompleted 会在工作线程上并发调用，实现需线程安全。
 */
public interface RunReporter {

    void onUniquenessChecked(IdUniquenessReport report);

    void onFlagsReset(long rowsReset);

    void onRecordsLoaded(int rowsRead, int uniqueRecords);

    void onPartitioned(int partitions, int partitionsWithWork, int recordsExcluded);

    void onPartitionCompleted(PartitionResult result);

    void onAggregated(int idsToMark, int overlappingIds);

    /**
     * 标记阶段完成；rowsUpdated / idsTargeted 大于 1 说明存在重复行
     */
    void onMarked(int idsTargeted, long rowsUpdated);

    void onRunCompleted(ObsolescenceRunReport report);

    void onRunFailed(Throwable error);
}
