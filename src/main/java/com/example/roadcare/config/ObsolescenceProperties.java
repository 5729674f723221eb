package com.example.roadcare.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "roadcare.obsolescence")
public class ObsolescenceProperties {

    /** 候选对距离窗口（米） */
    private double distanceThreshold = 6.0;

    /** 并行线程数，0 表示可用CPU数 */
    private int workerCount = 0;

    /** 仅处理这些轴线，空表示全部 */
    private List<String> axisFilter = new ArrayList<>();

    private int batchSize = 5000;

    private double sessionProximityMeters = 100.0;

    private int dateGapDays = 30;

    private String forwardSens = "+";

    /** 启动时运行一次后退出 */
    private boolean runOnStartup = false;
}
