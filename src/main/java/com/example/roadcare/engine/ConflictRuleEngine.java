package com.example.roadcare.engine;

import com.example.roadcare.domain.ImageRecord;
import com.example.roadcare.domain.Verdict;
import com.example.roadcare.domain.Verdict.Rule;

import java.time.Duration;
import java.util.Objects;

/**
 * 两条候选记录的冲突裁决规则
 * <p>
 * 纯函数，规则按固定顺序判断：
 * <ol>
 *   <li>同一会话：
 *     <ol>
 *       <li>两者 cumuld_session 都有值且相差不超过会话邻近阈值 → 不裁决</li>
 *       <li>方向不同 → 标记正向 ("+") 的一条</li>
 *       <li>方向相同且序号都已知 → 标记序号较小的一条</li>
 *     </ol>
 *   </li>
 *   <li>不同会话：
 *     <ol>
 *       <li>方向不同 → 标记正向的一条</li>
 *       <li>方向相同且采集时间都有值：相差超过阈值天数标记较旧的，否则标记评分较低的</li>
 *     </ol>
 *   </li>
 * </ol>
 * 其余情况不裁决。结果与参数顺序无关，且不会同时标记两条记录。
 */
public class ConflictRuleEngine {

    public static final double DEFAULT_SESSION_PROXIMITY_METERS = 100.0;
    public static final int DEFAULT_DATE_GAP_DAYS = 30;
    public static final String DEFAULT_FORWARD_SENS = "+";

    private final double sessionProximityMeters;
    private final int dateGapDays;
    private final String forwardSens;

    public ConflictRuleEngine() {
        this(DEFAULT_SESSION_PROXIMITY_METERS, DEFAULT_DATE_GAP_DAYS, DEFAULT_FORWARD_SENS);
    }

    public ConflictRuleEngine(double sessionProximityMeters, int dateGapDays, String forwardSens) {
        if (Double.isNaN(sessionProximityMeters) || sessionProximityMeters < 0) {
            throw new IllegalArgumentException("sessionProximityMeters 必须为非负数: " + sessionProximityMeters);
        }
        if (dateGapDays < 0) {
            throw new IllegalArgumentException("dateGapDays 必须为非负数: " + dateGapDays);
        }
        this.sessionProximityMeters = sessionProximityMeters;
        this.dateGapDays = dateGapDays;
        this.forwardSens = Objects.requireNonNull(forwardSens, "forwardSens");
    }

    public Verdict resolve(ImageRecord a, ImageRecord b) {
        if (Objects.equals(a.getSessionId(), b.getSessionId())) {
            return resolveSameSession(a, b);
        }
        return resolveCrossSession(a, b);
    }

    private Verdict resolveSameSession(ImageRecord a, ImageRecord b) {
        // 只有一侧有 cumuld_session 时不短路
        if (a.hasCumuldSession() && b.hasCumuldSession()
                && Math.abs(a.getCumuldSession() - b.getCumuldSession()) <= sessionProximityMeters) {
            return Verdict.none(Rule.SESSION_PROXIMITY);
        }
        if (!sameSens(a, b)) {
            return resolveDirection(a, b);
        }
        if (a.hasKnownIndex() && b.hasKnownIndex() && a.getIndex() != b.getIndex()) {
            return Verdict.obsolete(a.getIndex() < b.getIndex() ? a.getId() : b.getId(), Rule.SEQUENCE_INDEX);
        }
        return Verdict.none(Rule.UNDECIDED);
    }

    private Verdict resolveCrossSession(ImageRecord a, ImageRecord b) {
        if (!sameSens(a, b)) {
            return resolveDirection(a, b);
        }
        if (!a.hasCaptureDate() || !b.hasCaptureDate()) {
            return Verdict.none(Rule.UNDECIDED);
        }

        Duration gap = Duration.between(a.getCaptureDate(), b.getCaptureDate()).abs();
        if (gap.compareTo(Duration.ofDays(dateGapDays)) > 0) {
            return Verdict.obsolete(a.getCaptureDate().isBefore(b.getCaptureDate()) ? a.getId() : b.getId(),
                    Rule.CAPTURE_DATE);
        }

        int cmp = Double.compare(a.qualityScoreOrZero(), b.qualityScoreOrZero());
        if (cmp == 0) {
            return Verdict.none(Rule.QUALITY_SCORE);
        }
        return Verdict.obsolete(cmp < 0 ? a.getId() : b.getId(), Rule.QUALITY_SCORE);
    }

    /**
     * 方向不同时保留反向采集的一条
     */
    private Verdict resolveDirection(ImageRecord a, ImageRecord b) {
        if (forwardSens.equals(sensOf(a))) {
            return Verdict.obsolete(a.getId(), Rule.DIRECTION);
        }
        if (forwardSens.equals(sensOf(b))) {
            return Verdict.obsolete(b.getId(), Rule.DIRECTION);
        }
        return Verdict.none(Rule.UNDECIDED);
    }

    private static boolean sameSens(ImageRecord a, ImageRecord b) {
        return sensOf(a).equals(sensOf(b));
    }

    private static String sensOf(ImageRecord record) {
        return record.getSens() != null ? record.getSens() : "";
    }
}
