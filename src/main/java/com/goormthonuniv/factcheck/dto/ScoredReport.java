package com.goormthonuniv.factcheck.dto;

import com.goormthonuniv.factcheck.verify.ConfidenceLevel;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 분석 실행 하나의 최종 결과. 생성 후 불변.
 * overallScore == null 이면 검증 불가 (0점과 다름).
 */
public record ScoredReport(
        String reportId,
        OffsetDateTime createdAt,
        String articleUrl,
        String articleTitle,
        Double overallScore,
        ConfidenceLevel confidenceLevel,
        int sourcesConsidered,
        int sourcesFiltered,
        int sourcesFailed,
        int sourcesCandidates,
        List<String> queries,
        List<FactView> originalFacts,
        String summary,
        List<String> recommendations,
        Map<String, TypeBreakdown> scoreBreakdown,
        Map<String, Integer> sourceDistribution,
        FactVerification factVerification,
        List<SourceBreakdown> sources
) {
    public ScoredReport {
        queries = queries == null ? List.of() : List.copyOf(queries);
        originalFacts = originalFacts == null ? List.of() : List.copyOf(originalFacts);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        scoreBreakdown = scoreBreakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scoreBreakdown));
        sourceDistribution = sourceDistribution == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sourceDistribution));
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
