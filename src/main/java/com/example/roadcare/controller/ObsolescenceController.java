package com.example.roadcare.controller;

import com.example.roadcare.config.ObsolescenceProperties;
import com.example.roadcare.dto.ObsolescenceRunRequest;
import com.example.roadcare.exception.ObsolescenceWriteException;
import com.example.roadcare.exception.PartitionProcessingException;
import com.example.roadcare.service.ObsolescenceService;
import com.example.roadcare.store.ImageRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import javax.validation.Valid;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/obsolescence")
@RequiredArgsConstructor
public class ObsolescenceController {

    private final ObsolescenceService obsolescenceService;
    private final ImageRecordStore imageRecordStore;
    private final ObsolescenceProperties properties;

    /**
     * 执行一次完整的过时标记
     */
    @PostMapping("/run")
    public Mono<ResponseEntity<Map<String, Object>>> run(
            @RequestBody(required = false) @Valid ObsolescenceRunRequest request) {

        return obsolescenceService.run(request != null ? request : new ObsolescenceRunRequest())
                .map(report -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("result", report);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> {
                    log.error("过时标记失败: {}", ex.getMessage());
                    Map<String, Object> errorResponse = new HashMap<>();
                    errorResponse.put("success", false);
                    errorResponse.put("error", ex.getMessage());
                    if (ex instanceof PartitionProcessingException) {
                        errorResponse.put("failedAxis", ((PartitionProcessingException) ex).getAxis());
                    }
                    if (ex instanceof ObsolescenceWriteException) {
                        errorResponse.put("failedPhase", ((ObsolescenceWriteException) ex).getPhase());
                    }
                    HttpStatus status = ex instanceof IllegalArgumentException
                            ? HttpStatus.BAD_REQUEST
                            : HttpStatus.INTERNAL_SERVER_ERROR;
                    return Mono.just(ResponseEntity.status(status).body(errorResponse));
                });
    }

    /**
     * 检查 image.id 唯一性
     */
    @GetMapping("/uniqueness")
    public Mono<ResponseEntity<Map<String, Object>>> checkUniqueness() {
        return imageRecordStore.checkIdUniqueness()
                .map(report -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("result", report);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> {
                    log.error("唯一性检查失败: {}", ex.getMessage(), ex);
                    Map<String, Object> errorResponse = new HashMap<>();
                    errorResponse.put("success", false);
                    errorResponse.put("error", ex.getMessage());
                    return Mono.just(ResponseEntity.internalServerError().body(errorResponse));
                });
    }

    /**
     * 当前生效配置
     */
    @GetMapping("/settings")
    public Mono<ResponseEntity<Map<String, Object>>> getSettings() {
        return Mono.fromCallable(() -> {
            Map<String, Object> settings = new HashMap<>();
            settings.put("distanceThreshold", properties.getDistanceThreshold());
            settings.put("workerCount", properties.getWorkerCount() == 0
                    ? Runtime.getRuntime().availableProcessors()
                    : properties.getWorkerCount());
            settings.put("axisFilter", properties.getAxisFilter());
            settings.put("batchSize", properties.getBatchSize());
            settings.put("sessionProximityMeters", properties.getSessionProximityMeters());
            settings.put("dateGapDays", properties.getDateGapDays());
            settings.put("forwardSens", properties.getForwardSens());
            return ResponseEntity.ok(settings);
        });
    }
}
