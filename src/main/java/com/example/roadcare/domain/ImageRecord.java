package com.example.roadcare.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 一张巡检影像的不可变记录
 * <p>
 * 可缺省字段用包装类型表示，null 即未定义：
 * cumuld / cumuldSession / captureDate / qualityScore。
 * 序号未知时 index 为 {@link #UNKNOWN_INDEX}。
 */
@Value
@Builder(toBuilder = true)
public class ImageRecord {

    public static final int UNKNOWN_INDEX = -1;

    /** 影像ID（通常为UUID字符串） */
    String id;

    /** 道路轴线，分区键 */
    String axis;

    /** 采集会话ID */
    String sessionId;

    /** 沿轴线的累计距离（米） */
    Double cumuld;

    /** 沿采集会话的累计距离（米） */
    Double cumuldSession;

    /** 行驶方向标记 */
    String sens;

    /** 会话内采集序号 */
    @Builder.Default
    int index = UNKNOWN_INDEX;

    /** 采集时间 */
    LocalDateTime captureDate;

    /** 综合质量评分 (note_globale) */
    Double qualityScore;

    boolean obsolete;

    public boolean hasAxis() {
        return axis != null && !axis.isEmpty();
    }

    public boolean hasCumuld() {
        return cumuld != null && !cumuld.isNaN();
    }

    public boolean hasCumuldSession() {
        return cumuldSession != null && !cumuldSession.isNaN();
    }

    public boolean hasKnownIndex() {
        return index >= 0;
    }

    public boolean hasCaptureDate() {
        return captureDate != null;
    }

    /**
     * 缺失评分按 0 处理
     */
    public double qualityScoreOrZero() {
        return qualityScore != null ? qualityScore : 0.0;
    }
}
