package com.goormthonuniv.factcheck.verify;

import java.util.Objects;

/**
 * 원문 fact 하나를 한 소스의 계층과 비교한 판정. 외부 비교 서비스가 만들고 소스에 귀속된다.
 * matchStrength, conflictType, conflictSeverity 는 리포트 표시용 부가 정보.
 */
public record ComparisonVerdict(
        String originalFactId,
        VerdictOutcome outcome,
        String matchedSourceFactId,   // outcome = match|conflict 일 때만
        String matchStrength,         // strong | moderate
        String conflictType,          // contradiction | partial_mismatch | emphasis_difference | context_mismatch
        String conflictSeverity       // high | medium | low
) {
    public ComparisonVerdict {
        Objects.requireNonNull(originalFactId, "originalFactId");
        Objects.requireNonNull(outcome, "outcome");
    }

    public static ComparisonVerdict match(String originalFactId, String sourceFactId) {
        return new ComparisonVerdict(originalFactId, VerdictOutcome.MATCH, sourceFactId, null, null, null);
    }

    public static ComparisonVerdict conflict(String originalFactId, String sourceFactId) {
        return new ComparisonVerdict(originalFactId, VerdictOutcome.CONFLICT, sourceFactId, null, null, null);
    }

    public static ComparisonVerdict absent(String originalFactId) {
        return new ComparisonVerdict(originalFactId, VerdictOutcome.ABSENT, null, null, null, null);
    }

    /** 같은 판정인지(부가 정보 제외) */
    public boolean sameJudgement(ComparisonVerdict other) {
        return other != null
                && originalFactId.equals(other.originalFactId)
                && outcome == other.outcome
                && Objects.equals(matchedSourceFactId, other.matchedSourceFactId);
    }
}
