package com.goormthonuniv.factcheck.config;

import com.goormthonuniv.factcheck.verify.ReliabilityWeights;
import com.goormthonuniv.factcheck.verify.RelevanceFilter;
import com.goormthonuniv.factcheck.verify.SourceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 분석 파이프라인 설정 (application.yml: factcheck.*)
 */
@Configuration
@ConfigurationProperties(prefix = "factcheck")
@Data
public class FactCheckProperties {

    /** 한 번의 분석에서 확인할 최대 소스 수 (외부 호출 총량 상한) */
    private int maxSources = 10;

    /** QueryPrioritizer 최대 쿼리 수 */
    private int maxQueries = 3;

    /** 쿼리 하나·어댑터 하나당 요청할 결과 수 */
    private int resultsPerQuery = 5;

    /** 소스별 fetch → 추출 → 비교 체인 제한 시간 */
    private Duration perSourceTimeout = Duration.ofSeconds(30);

    /** 기사 HTML 가져오기 타임아웃 */
    private Duration fetchTimeout = Duration.ofSeconds(15);

    /** 소스 분석 동시 작업 수 */
    private int workerThreads = 4;

    private double relevanceThreshold = RelevanceFilter.DEFAULT_THRESHOLD;

    /** 비교 결과에 relevance 가 없을 때 쓰는 값 */
    private double defaultRelevance = RelevanceFilter.DEFAULT_MISSING_SCORE;

    private Map<SourceType, Double> reliabilityWeights = new EnumMap<>(ReliabilityWeights.defaults().asMap());

    private Cors cors = new Cors();

    @Data
    public static class Cors {
        private List<String> allowedOrigins = List.of("*");
    }

    public ReliabilityWeights weights() {
        return ReliabilityWeights.of(reliabilityWeights);
    }

    public RelevanceFilter relevanceFilter() {
        return new RelevanceFilter(relevanceThreshold, defaultRelevance);
    }
}
