package com.example.roadcare.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * 一对记录的裁决：最多标记一个ID为过时
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Verdict {

    /** 产生（或放弃）裁决的规则 */
    public enum Rule {
        SESSION_PROXIMITY,
        DIRECTION,
        SEQUENCE_INDEX,
        CAPTURE_DATE,
        QUALITY_SCORE,
        UNDECIDED
    }

    String obsoleteId;
    Rule rule;

    public static Verdict obsolete(String id, Rule rule) {
        if (id == null) {
            throw new IllegalArgumentException("过时ID不能为空");
        }
        return new Verdict(id, rule);
    }

    public static Verdict none(Rule rule) {
        return new Verdict(null, rule);
    }

    public boolean isObsolete() {
        return obsoleteId != null;
    }

    public Optional<String> marked() {
        return Optional.ofNullable(obsoleteId);
    }
}
