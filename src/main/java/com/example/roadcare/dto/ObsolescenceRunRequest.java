package com.example.roadcare.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * 单次运行参数，未填写的字段使用配置值
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ObsolescenceRunRequest {

    /** 候选对距离窗口（米） */
    @PositiveOrZero
    private Double distanceThreshold;

    /** 并行线程数，0 表示可用CPU数 */
    @PositiveOrZero
    private Integer workerCount;

    /** 仅处理这些轴线 */
    private List<String> axisFilter;

    /** 每条 UPDATE 语句的ID数 */
    @Positive
    private Integer batchSize;
}
