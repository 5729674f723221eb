package com.example.roadcare.domain;

import lombok.Value;

/**
 * 分区内的一对候选记录下标，始终满足 first &lt; second
 */
@Value
public class CandidatePair {
    int first;
    int second;

    public CandidatePair(int first, int second) {
        if (first >= second) {
            throw new IllegalArgumentException("候选对下标必须满足 first < second: " + first + ", " + second);
        }
        this.first = first;
        this.second = second;
    }
}
