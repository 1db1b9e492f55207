package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.fact.FactHierarchy;

import java.time.Instant;

/**
 * 분석 실행 하나의 상태. 파이프라인 단계마다 명시적으로 넘긴다.
 */
public record AnalysisContext(
        String runId,
        String articleUrl,
        String articleTitle,
        FactHierarchy original,
        AnalysisSettings settings,
        Instant startedAt
) {}
