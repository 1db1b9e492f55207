package com.goormthonuniv.factcheck.verify;

import java.util.Objects;

/**
 * 점수 계산 입력: analyzed 상태 소스 하나.
 */
public record ScoredSource(String url, SourceType sourceType, double relevanceScore, SourceAgreement agreement) {
    public ScoredSource {
        Objects.requireNonNull(agreement, "agreement");
        sourceType = sourceType == null ? SourceType.UNKNOWN : sourceType;
    }
}
