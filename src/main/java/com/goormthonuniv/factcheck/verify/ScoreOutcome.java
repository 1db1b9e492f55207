package com.goormthonuniv.factcheck.verify;

/**
 * overallScore 가 null 이면 "검증 불가" (0점 = 거짓 과 구분).
 */
public record ScoreOutcome(
        Double overallScore,
        ConfidenceLevel confidenceLevel,
        int analyzedSources,
        int contributingSources,
        double weightedSum,
        double totalWeight
) {
    public boolean hasScore() { return overallScore != null; }
}
