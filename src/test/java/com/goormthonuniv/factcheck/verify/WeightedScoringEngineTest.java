package com.goormthonuniv.factcheck.verify;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WeightedScoringEngineTest {

    private final WeightedScoringEngine engine = new WeightedScoringEngine(ReliabilityWeights.defaults());

    /** matches/conflicts 로 원하는 agreementRatio 를 만든다 */
    private static ScoredSource source(SourceType type, int matches, int conflicts, double relevance) {
        int denom = matches + conflicts;
        double ratio = denom == 0 ? 0.0 : (double) matches / denom;
        SourceAgreement a = new SourceAgreement(matches, conflicts, 0, denom, ratio, denom == 0, List.of(), List.of());
        return new ScoredSource("https://" + type.wireName() + ".example/" + matches + conflicts, type, relevance, a);
    }

    @Test
    void threeSourceScenario_isWeightedAverageWithMediumConfidence() {
        List<ScoredSource> sources = List.of(
                source(SourceType.OFFICIAL, 1, 0, 0.9),
                source(SourceType.NEWS, 1, 1, 0.7),
                source(SourceType.BLOG, 0, 1, 0.6));

        ScoreOutcome out = engine.score(sources);

        assertThat(out.overallScore()).isCloseTo(100.0 * 1.18 / 1.7, within(1e-9));
        assertThat(out.overallScore()).isCloseTo(69.4, within(0.05));
        assertThat(out.confidenceLevel()).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(out.analyzedSources()).isEqualTo(3);
        assertThat(out.weightedSum()).isCloseTo(1.18, within(1e-9));
        assertThat(out.totalWeight()).isCloseTo(1.7, within(1e-9));
    }

    @Test
    void zeroSources_scoreUndefinedAndLow() {
        ScoreOutcome out = engine.score(List.of());

        assertThat(out.hasScore()).isFalse();
        assertThat(out.overallScore()).isNull();
        assertThat(out.confidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
    }

    @Test
    void lowSignalSourcesAreExcluded() {
        ScoredSource lowSignal = source(SourceType.OFFICIAL, 0, 0, 1.0);

        ScoreOutcome onlyLow = engine.score(List.of(lowSignal));
        ScoreOutcome mixed = engine.score(List.of(lowSignal, source(SourceType.NEWS, 1, 0, 0.8)));

        assertThat(onlyLow.overallScore()).isNull();
        assertThat(onlyLow.analyzedSources()).isEqualTo(1);
        assertThat(mixed.overallScore()).isCloseTo(100.0, within(1e-9));
        assertThat(mixed.contributingSources()).isEqualTo(1);
    }

    @Test
    void addingPerfectOfficialSourceStrictlyIncreasesScore() {
        List<ScoredSource> sources = new ArrayList<>(List.of(
                source(SourceType.NEWS, 0, 2, 0.9),
                source(SourceType.BLOG, 0, 1, 0.5),
                source(SourceType.SOCIAL, 0, 3, 0.7)));
        double before = engine.score(sources).overallScore();

        sources.add(source(SourceType.OFFICIAL, 1, 0, 1.0));
        double after = engine.score(sources).overallScore();

        assertThat(before).isZero();
        assertThat(after).isGreaterThan(before);
    }

    @Test
    void scoreStaysWithinBounds() {
        List<ScoredSource> sources = new ArrayList<>();
        SourceType[] types = SourceType.values();
        for (int i = 0; i < 20; i++) {
            sources.add(source(types[i % types.length], i % 4, (i * 7) % 3, 0.4 + (i % 6) / 10.0));
            ScoreOutcome out = engine.score(sources);
            if (out.hasScore()) {
                assertThat(out.overallScore()).isBetween(0.0, 100.0);
            }
        }
    }

    @Test
    void lessRelevantSourceWeighsLess() {
        ScoredSource agreeing = source(SourceType.NEWS, 1, 0, 0.45);
        ScoredSource disagreeing = source(SourceType.NEWS, 0, 1, 0.95);

        assertThat(engine.score(List.of(agreeing, disagreeing)).overallScore()).isLessThan(50.0);
    }

    @Test
    void fewerThanThreeSourcesIsAlwaysLow() {
        ScoreOutcome out = engine.score(List.of(
                source(SourceType.OFFICIAL, 5, 0, 1.0),
                source(SourceType.OFFICIAL, 3, 0, 1.0)));

        assertThat(out.overallScore()).isCloseTo(100.0, within(1e-9));
        assertThat(out.confidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
    }

    @Test
    void customWeightsAreValidated() {
        assertThatThrownBy(() -> ReliabilityWeights.of(java.util.Map.of(SourceType.BLOG, 1.5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ReliabilityWeights.of(java.util.Map.of(SourceType.BLOG, 0.2)).weightOf(SourceType.BLOG)).isEqualTo(0.2);
        assertThat(ReliabilityWeights.defaults().weightOf(null)).isEqualTo(0.5);
    }
}
