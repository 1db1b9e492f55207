package com.goormthonuniv.factcheck.verify;

import java.util.List;

/**
 * analyzed 소스들의 가중 평균 정확도 점수(0~100)와 신뢰 등급을 계산한다.
 *
 * contribution = agreementRatio × reliabilityWeight × relevanceScore
 * overall      = 100 × Σcontribution / Σ(reliabilityWeight × relevanceScore)
 *
 * lowSignal 소스(비교 가능한 판정 0개)는 분자·분모와 신뢰 등급의 소스 수에서 빠진다.
 * 기여 소스가 없으면 점수는 null, 등급은 LOW.
 */
public final class WeightedScoringEngine {

    private final ReliabilityWeights weights;

    public WeightedScoringEngine(ReliabilityWeights weights) {
        this.weights = weights == null ? ReliabilityWeights.defaults() : weights;
    }

    public double contribution(ScoredSource s) {
        return s.agreement().agreementRatio() * weightOf(s) * s.relevanceScore();
    }

    public double weightOf(ScoredSource s) {
        return weights.weightOf(s.sourceType());
    }

    public ScoreOutcome score(List<ScoredSource> analyzed) {
        List<ScoredSource> sources = analyzed == null ? List.of() : analyzed;
        double sum = 0.0;
        double total = 0.0;
        int contributing = 0;
        for (ScoredSource s : sources) {
            if (s.agreement().lowSignal()) continue;
            sum += contribution(s);
            total += weightOf(s) * s.relevanceScore();
            contributing++;
        }

        Double overall = total > 0.0 ? clamp(100.0 * sum / total) : null;
        ConfidenceLevel level = ConfidenceLevel.of(contributing, overall);
        return new ScoreOutcome(overall, level, sources.size(), contributing, sum, total);
    }

    private static double clamp(double v) {
        if (v < 0.0) return 0.0;
        if (v > 100.0) return 100.0;
        return v;
    }
}
