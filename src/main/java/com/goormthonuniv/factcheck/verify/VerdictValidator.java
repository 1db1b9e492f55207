package com.goormthonuniv.factcheck.verify;

import com.goormthonuniv.factcheck.fact.FactHierarchy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 비교 서비스 출력 스키마 검사.
 * - originalFactId 는 원문 계층에 있어야 함
 * - match/conflict 는 소스 계층에 있는 matchedSourceFactId 필수, absent 는 없어야 함
 * - 같은 원문 fact 에 대한 판정이 여러 개면: 완전히 같은 판정은 하나로 합치고, 다르면 거부
 */
public final class VerdictValidator {

    private VerdictValidator() {}

    public static List<ComparisonVerdict> validate(List<ComparisonVerdict> verdicts,
                                                   FactHierarchy original,
                                                   FactHierarchy source) {
        Map<String, ComparisonVerdict> byOriginal = new LinkedHashMap<>();
        for (ComparisonVerdict v : verdicts) {
            if (original.find(v.originalFactId()).isEmpty()) {
                throw new InvalidComparisonException("verdict references unknown original fact " + v.originalFactId());
            }
            if (v.outcome().requiresSourceRef()) {
                if (v.matchedSourceFactId() == null || v.matchedSourceFactId().isBlank()) {
                    throw new InvalidComparisonException(v.outcome().wireName() + " verdict for " + v.originalFactId() + " has no source fact");
                }
                if (source.find(v.matchedSourceFactId()).isEmpty()) {
                    throw new InvalidComparisonException("verdict references unknown source fact " + v.matchedSourceFactId());
                }
            } else if (v.matchedSourceFactId() != null && !v.matchedSourceFactId().isBlank()) {
                throw new InvalidComparisonException("absent verdict for " + v.originalFactId() + " must not reference a source fact");
            }

            ComparisonVerdict prev = byOriginal.get(v.originalFactId());
            if (prev == null) {
                byOriginal.put(v.originalFactId(), v);
            } else if (!prev.sameJudgement(v)) {
                throw new InvalidComparisonException("conflicting verdicts for original fact " + v.originalFactId()
                        + ": " + prev.outcome().wireName() + " vs " + v.outcome().wireName());
            }
        }
        return new ArrayList<>(byOriginal.values());
    }
}
