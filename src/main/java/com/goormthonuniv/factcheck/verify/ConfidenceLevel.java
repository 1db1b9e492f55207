package com.goormthonuniv.factcheck.verify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {
    HIGH, MEDIUM, LOW;

    static final int HIGH_MIN_SOURCES = 5;
    static final int MEDIUM_MIN_SOURCES = 3;
    static final double HIGH_MIN_SCORE = 80.0;
    static final double MEDIUM_MIN_SCORE = 60.0;

    /**
     * 소스 수 게이트를 먼저, 그 다음 점수 구간을 본다.
     * - 소스 &lt; 3 또는 점수 없음 → LOW
     * - 소스 ≥ 5 이고 점수 ≥ 80 → HIGH
     * - 소스 3~4 또는 점수 [60, 80) → MEDIUM
     * - 그 외 → LOW
     */
    public static ConfidenceLevel of(int sources, Double score) {
        if (sources < MEDIUM_MIN_SOURCES || score == null) return LOW;
        if (sources >= HIGH_MIN_SOURCES && score >= HIGH_MIN_SCORE) return HIGH;
        if (sources < HIGH_MIN_SOURCES) return MEDIUM;
        if (score >= MEDIUM_MIN_SCORE && score < HIGH_MIN_SCORE) return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
