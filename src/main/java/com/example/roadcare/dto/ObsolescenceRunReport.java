package com.example.roadcare.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 运行统计
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ObsolescenceRunReport {

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    /** 处理范围，空表示全部轴线 */
    private List<String> axisFilter;

    private double distanceThreshold;

    private int workerCount;

    /** 重置过时标记的行数 */
    private long rowsReset;

    /** 读取行数 */
    private int recordsLoaded;

    /** 去重合并掉的行数 */
    private int duplicateRowsMerged;

    /** 缺少轴线或 cumuld 被排除的记录数 */
    private int recordsExcluded;

    private boolean idUniquenessGuaranteed;

    private long duplicateIdsDetected;

    private int partitionsProcessed;

    private long candidatePairsEvaluated;

    private int idsMarkedObsolete;

    /** 实际更新行数 */
    private long rowsUpdated;

    /** 更新行数 / 目标ID数 */
    private double rowsPerId;

    private long durationMs;

    private boolean success;
}
