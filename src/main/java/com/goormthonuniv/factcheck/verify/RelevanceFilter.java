package com.goormthonuniv.factcheck.verify;

/**
 * relevanceScore 하나로 소스 통과/탈락을 가르는 순수 술어. 비교 작업 전에 적용하는 비용 차단 게이트이며
 * 통과 이후에는 점수 입력으로 다시 쓰이지 않는다.
 *
 * score &lt; threshold → FILTERED (경계값 threshold 자체는 통과).
 * 점수가 없으면(null/NaN) missingDefault(0.5)로 보고 통과시킨다.
 */
public final class RelevanceFilter {

    public static final double DEFAULT_THRESHOLD = 0.4;
    public static final double DEFAULT_MISSING_SCORE = 0.5;

    private final double threshold;
    private final double missingDefault;

    public RelevanceFilter() {
        this(DEFAULT_THRESHOLD, DEFAULT_MISSING_SCORE);
    }

    public RelevanceFilter(double threshold, double missingDefault) {
        this.threshold = threshold;
        this.missingDefault = missingDefault;
    }

    public double effectiveScore(Double relevanceScore) {
        if (relevanceScore == null || relevanceScore.isNaN()) return missingDefault;
        return Math.max(0.0, Math.min(1.0, relevanceScore));
    }

    public boolean passes(Double relevanceScore) {
        return !(effectiveScore(relevanceScore) < threshold);
    }

    /** 통과 시 ANALYZED(비교 결과가 이미 붙은 상태) 아니면 FILTERED */
    public SourceStatus apply(Double relevanceScore) {
        return passes(relevanceScore) ? SourceStatus.ANALYZED : SourceStatus.FILTERED;
    }

    public double threshold() { return threshold; }
}
