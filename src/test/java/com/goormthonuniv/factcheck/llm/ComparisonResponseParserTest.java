package com.goormthonuniv.factcheck.llm;

import com.goormthonuniv.factcheck.verify.ComparisonResult;
import com.goormthonuniv.factcheck.verify.ComparisonVerdict;
import com.goormthonuniv.factcheck.verify.InvalidComparisonException;
import com.goormthonuniv.factcheck.verify.VerdictOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparisonResponseParserTest {

    @Test
    void parsesVerdictsScoreAndNotes() {
        String json = """
                {
                  "relevance_score": 0.85,
                  "verdicts": [
                    {"original_id": "W1", "outcome": "match", "source_id": "W2", "match_strength": "moderate"},
                    {"original_id": "C1", "outcome": "conflict", "source_id": "C1",
                     "conflict_type": "partial_mismatch", "conflict_severity": "high"},
                    {"original_id": "W2", "outcome": "absent", "source_id": null}
                  ],
                  "analysis_notes": "same launch event"
                }
                """;

        ComparisonResult r = ComparisonResponseParser.parse(json);

        assertThat(r.relevanceScore()).isEqualTo(0.85);
        assertThat(r.analysisNotes()).isEqualTo("same launch event");
        assertThat(r.verdicts()).extracting(ComparisonVerdict::outcome)
                .containsExactly(VerdictOutcome.MATCH, VerdictOutcome.CONFLICT, VerdictOutcome.ABSENT);
        assertThat(r.verdicts().get(0).matchStrength()).isEqualTo("moderate");
        assertThat(r.verdicts().get(1).conflictType()).isEqualTo("partial_mismatch");
        assertThat(r.verdicts().get(2).matchedSourceFactId()).isNull();
    }

    @Test
    void missingOrNonNumericScoreIsNull() {
        assertThat(ComparisonResponseParser.parse("{\"verdicts\": []}").relevanceScore()).isNull();
        assertThat(ComparisonResponseParser.parse("{\"relevance_score\": \"high\", \"verdicts\": []}").relevanceScore()).isNull();
    }

    @Test
    void acceptsFencedOutput() {
        ComparisonResult r = ComparisonResponseParser.parse("```json\n{\"relevance_score\": 0.3, \"verdicts\": []}\n```");

        assertThat(r.relevanceScore()).isEqualTo(0.3);
        assertThat(r.verdicts()).isEmpty();
    }

    @Test
    void rejectsUnknownOutcomeAndBrokenShapes() {
        assertThatThrownBy(() -> ComparisonResponseParser.parse(
                "{\"verdicts\": [{\"original_id\": \"W1\", \"outcome\": \"maybe\"}]}"))
                .isInstanceOf(InvalidComparisonException.class)
                .hasMessageContaining("maybe");
        assertThatThrownBy(() -> ComparisonResponseParser.parse("{\"verdicts\": [{\"outcome\": \"match\"}]}"))
                .isInstanceOf(InvalidComparisonException.class);
        assertThatThrownBy(() -> ComparisonResponseParser.parse("{\"matching\": []}"))
                .isInstanceOf(InvalidComparisonException.class);
        assertThatThrownBy(() -> ComparisonResponseParser.parse("garbage"))
                .isInstanceOf(InvalidComparisonException.class);
    }
}
