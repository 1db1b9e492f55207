package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.verify.RelevanceFilter;
import com.goormthonuniv.factcheck.verify.ReliabilityWeights;

import java.time.Duration;

/**
 * 실행 시작 시점의 설정 스냅샷
 */
public record AnalysisSettings(
        int maxSources,
        int maxQueries,
        int resultsPerQuery,
        Duration perSourceTimeout,
        RelevanceFilter relevanceFilter,
        ReliabilityWeights weights
) {
    public static AnalysisSettings from(FactCheckProperties props) {
        return new AnalysisSettings(
                Math.max(0, props.getMaxSources()),
                Math.max(1, props.getMaxQueries()),
                Math.max(1, props.getResultsPerQuery()),
                props.getPerSourceTimeout(),
                props.relevanceFilter(),
                props.weights());
    }
}
