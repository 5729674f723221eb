package com.example.roadcare.engine;

import com.example.roadcare.domain.ImageRecord;
import com.example.roadcare.domain.Verdict;
import com.example.roadcare.domain.Verdict.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.example.roadcare.support.Records.BASE_DATE;
import static com.example.roadcare.support.Records.image;
import static org.junit.Assert.*;

public class ConflictRuleEngineTest {

    private final ConflictRuleEngine engine = new ConflictRuleEngine();

    // ---------- 同一会话 ----------

    @Test
    public void testSameSessionWithinProximityProducesNoVerdict() {
        ImageRecord a = image("D1", 0).sessionId("S1").cumuldSession(1000.0).sens("+").index(3).build();
        ImageRecord b = image("D1", 2).sessionId("S1").cumuldSession(1080.0).sens("-").index(9).build();

        Verdict verdict = engine.resolve(a, b);

        assertFalse("会话距离 80 米，不应裁决", verdict.isObsolete());
        assertEquals(Rule.SESSION_PROXIMITY, verdict.getRule());
    }

    @Test
    public void testProximityGuardIsInclusive() {
        ImageRecord a = image("D1", 0).sessionId("S1").cumuldSession(0.0).index(1).build();
        ImageRecord b = image("D1", 1).sessionId("S1").cumuldSession(100.0).index(2).build();

        assertFalse(engine.resolve(a, b).isObsolete());
    }

    @Test
    public void testProximityGuardNeedsBothSessionDistances() {
        ImageRecord a = image("D1", 0).sessionId("S1").cumuldSession(0.0).sens("+").index(1).build();
        ImageRecord b = image("D1", 1).sessionId("S1").sens("+").index(2).build();

        Verdict verdict = engine.resolve(a, b);

        assertEquals("只有一侧有会话距离时继续判断序号", a.getId(), verdict.getObsoleteId());
        assertEquals(Rule.SEQUENCE_INDEX, verdict.getRule());
    }

    @Test
    public void testSameSessionDifferentSensMarksForward() {
        ImageRecord forward = image("D1", 0).sessionId("S1").cumuldSession(0.0).sens("+").index(10).build();
        ImageRecord reverse = image("D1", 1).sessionId("S1").cumuldSession(500.0).sens("-").index(2).build();

        Verdict verdict = engine.resolve(forward, reverse);

        assertEquals(forward.getId(), verdict.getObsoleteId());
        assertEquals(Rule.DIRECTION, verdict.getRule());
        assertEquals(forward.getId(), engine.resolve(reverse, forward).getObsoleteId());
    }

    @Test
    public void testSameSessionSameSensMarksSmallerIndex() {
        ImageRecord earlier = image("D1", 0).sessionId("S1").sens("-").index(4).build();
        ImageRecord later = image("D1", 1).sessionId("S1").sens("-").index(7).build();

        assertEquals(earlier.getId(), engine.resolve(earlier, later).getObsoleteId());
        assertEquals(earlier.getId(), engine.resolve(later, earlier).getObsoleteId());
    }

    @Test
    public void testSameSessionUnknownIndexProducesNoVerdict() {
        ImageRecord a = image("D1", 0).sessionId("S1").index(4).build();
        ImageRecord b = image("D1", 1).sessionId("S1").build();

        Verdict verdict = engine.resolve(a, b);

        assertFalse(verdict.isObsolete());
        assertEquals(Rule.UNDECIDED, verdict.getRule());
    }

    @Test
    public void testSameSessionEqualIndexProducesNoVerdict() {
        ImageRecord a = image("D1", 0).sessionId("S1").index(4).build();
        ImageRecord b = image("D1", 1).sessionId("S1").index(4).build();

        assertFalse(engine.resolve(a, b).isObsolete());
        assertFalse(engine.resolve(b, a).isObsolete());
    }

    @Test
    public void testDifferentSensWithoutForwardMarkerProducesNoVerdict() {
        ImageRecord a = image("D1", 0).sessionId("S1").sens("-").index(1).build();
        ImageRecord b = image("D1", 1).sessionId("S1").sens("?").index(2).build();

        assertFalse("方向不同但都不是正向时不回退到序号规则", engine.resolve(a, b).isObsolete());
    }

    // ---------- 不同会话 ----------

    @Test
    public void testCrossSessionDifferentSensMarksForward() {
        ImageRecord forward = image("D1", 0).sessionId("S1").sens("+").captureDate(BASE_DATE).build();
        ImageRecord reverse = image("D1", 1).sessionId("S2").sens("-").captureDate(BASE_DATE.minusDays(200)).build();

        Verdict verdict = engine.resolve(reverse, forward);

        assertEquals(forward.getId(), verdict.getObsoleteId());
        assertEquals(Rule.DIRECTION, verdict.getRule());
    }

    @Test
    public void testCrossSessionLargeDateGapMarksOlder() {
        ImageRecord older = image("D1", 0).sessionId("S1").captureDate(BASE_DATE).qualityScore(0.9).build();
        ImageRecord newer = image("D1", 1).sessionId("S2").captureDate(BASE_DATE.plusDays(45)).qualityScore(0.1).build();

        Verdict verdict = engine.resolve(newer, older);

        assertEquals("相隔 45 天，标记较旧的一条", older.getId(), verdict.getObsoleteId());
        assertEquals(Rule.CAPTURE_DATE, verdict.getRule());
    }

    @Test
    public void testCrossSessionCloseDatesMarksLowerQuality() {
        ImageRecord good = image("D1", 0).sessionId("S1").captureDate(BASE_DATE).qualityScore(0.9).build();
        ImageRecord poor = image("D1", 1).sessionId("S2").captureDate(BASE_DATE.plusDays(10)).qualityScore(0.4).build();

        Verdict verdict = engine.resolve(good, poor);

        assertEquals("相隔 10 天，标记评分较低 (0.4) 的一条", poor.getId(), verdict.getObsoleteId());
        assertEquals(Rule.QUALITY_SCORE, verdict.getRule());
        assertEquals(poor.getId(), engine.resolve(poor, good).getObsoleteId());
    }

    @Test
    public void testExactlyThirtyDaysUsesQuality() {
        ImageRecord a = image("D1", 0).sessionId("S1").captureDate(BASE_DATE).qualityScore(0.2).build();
        ImageRecord b = image("D1", 1).sessionId("S2").captureDate(BASE_DATE.plusDays(30)).qualityScore(0.8).build();

        Verdict verdict = engine.resolve(a, b);

        assertEquals(a.getId(), verdict.getObsoleteId());
        assertEquals(Rule.QUALITY_SCORE, verdict.getRule());
    }

    @Test
    public void testFractionalDayBeyondThirtyUsesDate() {
        ImageRecord older = image("D1", 0).sessionId("S1").captureDate(BASE_DATE).qualityScore(0.9).build();
        ImageRecord newer = image("D1", 1).sessionId("S2").captureDate(BASE_DATE.plusDays(30).plusHours(23))
                .qualityScore(0.1).build();

        Verdict verdict = engine.resolve(newer, older);

        assertEquals("相隔 30 天 23 小时，已超过 30 天", older.getId(), verdict.getObsoleteId());
        assertEquals(Rule.CAPTURE_DATE, verdict.getRule());
    }

    @Test
    public void testMissingQualityCountsAsZero() {
        ImageRecord scored = image("D1", 0).sessionId("S1").captureDate(BASE_DATE).qualityScore(0.3).build();
        ImageRecord unscored = image("D1", 1).sessionId("S2").captureDate(BASE_DATE).build();

        assertEquals(unscored.getId(), engine.resolve(scored, unscored).getObsoleteId());
    }

    @Test
    public void testEqualQualityProducesNoVerdict() {
        ImageRecord a = image("D1", 0).sessionId("S1").captureDate(BASE_DATE).qualityScore(0.5).build();
        ImageRecord b = image("D1", 1).sessionId("S2").captureDate(BASE_DATE.plusDays(3)).qualityScore(0.5).build();

        assertFalse(engine.resolve(a, b).isObsolete());
    }

    @Test
    public void testMissingDateProducesNoVerdict() {
        ImageRecord a = image("D1", 0).sessionId("S1").captureDate(BASE_DATE).qualityScore(0.9).build();
        ImageRecord b = image("D1", 1).sessionId("S2").qualityScore(0.1).build();

        Verdict verdict = engine.resolve(a, b);

        assertFalse(verdict.isObsolete());
        assertEquals(Rule.UNDECIDED, verdict.getRule());
    }

    @Test
    public void testCustomThresholds() {
        ConflictRuleEngine strict = new ConflictRuleEngine(10.0, 5, "F");
        ImageRecord older = image("D1", 0).sessionId("S1").sens("B").captureDate(BASE_DATE).build();
        ImageRecord newer = image("D1", 1).sessionId("S2").sens("B").captureDate(BASE_DATE.plusDays(6)).build();
        ImageRecord forward = image("D1", 2).sessionId("S3").sens("F").build();

        assertEquals(older.getId(), strict.resolve(older, newer).getObsoleteId());
        assertEquals(forward.getId(), strict.resolve(older, forward).getObsoleteId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeProximityRejected() {
        new ConflictRuleEngine(-1.0, 30, "+");
    }

    // ---------- 对称性 ----------

    @Test
    public void testArgumentOrderNeverMarksDifferentIds() {
        Random random = new Random(42);
        String[] sessions = {"S1", "S2", "S3"};
        String[] sens = {"+", "-", null};
        List<ImageRecord> records = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            ImageRecord.ImageRecordBuilder builder = image("D1", i)
                    .sessionId(sessions[random.nextInt(sessions.length)])
                    .sens(sens[random.nextInt(sens.length)])
                    .index(random.nextInt(5) - 1)
                    .qualityScore(random.nextBoolean() ? random.nextInt(4) / 4.0 : null);
            if (random.nextInt(4) > 0) {
                builder.captureDate(BASE_DATE.plusDays(random.nextInt(90)));
            }
            if (random.nextBoolean()) {
                builder.cumuldSession((double) random.nextInt(400));
            }
            records.add(builder.build());
        }

        for (ImageRecord a : records) {
            for (ImageRecord b : records) {
                if (a == b) {
                    continue;
                }
                Verdict ab = engine.resolve(a, b);
                Verdict ba = engine.resolve(b, a);
                assertEquals("参数顺序不应影响裁决", ab.getObsoleteId(), ba.getObsoleteId());
                if (ab.isObsolete()) {
                    assertTrue(ab.getObsoleteId().equals(a.getId()) || ab.getObsoleteId().equals(b.getId()));
                }
            }
        }
    }
}
