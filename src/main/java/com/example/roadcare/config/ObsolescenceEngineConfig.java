package com.example.roadcare.config;

import com.example.roadcare.engine.ConflictRuleEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ObsolescenceEngineConfig {

    @Bean
    public ConflictRuleEngine conflictRuleEngine(ObsolescenceProperties properties) {
        log.info("冲突规则: 会话邻近 {} 米, 日期间隔 {} 天, 正向标记 '{}'",
                properties.getSessionProximityMeters(), properties.getDateGapDays(), properties.getForwardSens());
        return new ConflictRuleEngine(
                properties.getSessionProximityMeters(),
                properties.getDateGapDays(),
                properties.getForwardSens());
    }
}
