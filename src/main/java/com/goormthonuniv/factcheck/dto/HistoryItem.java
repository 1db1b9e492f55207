package com.goormthonuniv.factcheck.dto;

import com.goormthonuniv.factcheck.verify.ConfidenceLevel;

import java.time.OffsetDateTime;

public record HistoryItem(
        String reportId,
        String articleTitle,
        String articleUrl,
        Double overallScore,
        ConfidenceLevel confidenceLevel,
        int sourcesConsidered,
        OffsetDateTime createdAt
) {
    public static HistoryItem of(ScoredReport r) {
        return new HistoryItem(r.reportId(), r.articleTitle(), r.articleUrl(), r.overallScore(),
                r.confidenceLevel(), r.sourcesConsidered(), r.createdAt());
    }
}
