package com.goormthonuniv.factcheck.verify;

import com.goormthonuniv.factcheck.fact.FactHierarchy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.goormthonuniv.factcheck.fact.FactFixtures.simple;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparisonAggregatorTest {

    private final FactHierarchy original = simple(FactHierarchy.ORIGINAL_ID, 3, 2);
    private final FactHierarchy source = simple("source-1", 3, 2);

    @Test
    void ratioIsMatchesOverMatchesPlusConflicts_absentIgnored() {
        List<ComparisonVerdict> verdicts = List.of(
                ComparisonVerdict.match("W1", "W1"),
                ComparisonVerdict.match("W2", "W3"),
                ComparisonVerdict.conflict("C1", "C2"),
                ComparisonVerdict.absent("W3"),
                ComparisonVerdict.absent("C2"));

        SourceAgreement a = ComparisonAggregator.aggregate(verdicts, original, source);

        assertThat(a.matches()).isEqualTo(2);
        assertThat(a.conflicts()).isEqualTo(1);
        assertThat(a.absent()).isEqualTo(2);
        assertThat(a.comparableCount()).isEqualTo(5);
        assertThat(a.agreementRatio()).isEqualTo(2.0 / 3.0);
        assertThat(a.lowSignal()).isFalse();
        assertThat(a.matched()).extracting(p -> p.source().id()).containsExactly("W1", "W3");
        assertThat(a.conflicting()).extracting(p -> p.original().id()).containsExactly("C1");
    }

    @Test
    void noComparableVerdicts_isZeroAndLowSignal() {
        SourceAgreement onlyAbsent = ComparisonAggregator.aggregate(
                List.of(ComparisonVerdict.absent("W1")), original, source);
        SourceAgreement none = ComparisonAggregator.aggregate(List.of(), original, source);

        assertThat(onlyAbsent.agreementRatio()).isZero();
        assertThat(onlyAbsent.lowSignal()).isTrue();
        assertThat(none.agreementRatio()).isZero();
        assertThat(none.lowSignal()).isTrue();
    }

    @Test
    void resultIsInvariantToVerdictOrder() {
        List<ComparisonVerdict> verdicts = new ArrayList<>(List.of(
                ComparisonVerdict.conflict("W1", "W2"),
                ComparisonVerdict.match("W2", "W1"),
                ComparisonVerdict.match("W3", "W3"),
                ComparisonVerdict.match("C1", "C1"),
                ComparisonVerdict.absent("C2")));
        SourceAgreement base = ComparisonAggregator.aggregate(verdicts, original, source);

        Collections.reverse(verdicts);
        SourceAgreement reversed = ComparisonAggregator.aggregate(verdicts, original, source);

        assertThat(reversed).isEqualTo(base);
        assertThat(base.agreementRatio()).isBetween(0.0, 1.0);
        assertThat(base.matched()).extracting(p -> p.original().id()).containsExactly("W2", "W3", "C1");
    }

    @Test
    void rejectsSecondVerdictForSameOriginalFact() {
        List<ComparisonVerdict> verdicts = List.of(
                ComparisonVerdict.match("W1", "W1"),
                ComparisonVerdict.conflict("W1", "W2"));

        assertThatThrownBy(() -> ComparisonAggregator.aggregate(verdicts, original, source))
                .isInstanceOf(InvalidComparisonException.class)
                .hasMessageContaining("W1");
    }

    @Test
    void rejectsUnknownReferences() {
        assertThatThrownBy(() -> ComparisonAggregator.aggregate(
                List.of(ComparisonVerdict.match("W9", "W1")), original, source))
                .isInstanceOf(InvalidComparisonException.class);
        assertThatThrownBy(() -> ComparisonAggregator.aggregate(
                List.of(ComparisonVerdict.match("W1", "W9")), original, source))
                .isInstanceOf(InvalidComparisonException.class);
    }
}
