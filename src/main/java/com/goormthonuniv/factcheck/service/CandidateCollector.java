package com.goormthonuniv.factcheck.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.factcheck.search.SearchAdapter;
import com.goormthonuniv.factcheck.search.SearchResult;
import com.goormthonuniv.factcheck.util.UrlUtils;
import com.goormthonuniv.factcheck.verify.SourceClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;

/**
 * 우선순위 순서대로 쿼리 × 어댑터 검색, host+path 기준 중복 제거, 원문 URL 제외, maxSources 에서 중단.
 */
@Slf4j
@Component
public class CandidateCollector {

    private final List<SearchAdapter> adapters;
    private final SourceClassifier classifier;

    // ===== 캐시 =====
    private final Cache<String, List<SearchResult>> searchCache = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(15))
            .maximumSize(2000)
            .build();

    public CandidateCollector(List<SearchAdapter> adapters, SourceClassifier classifier) {
        this.adapters = adapters;
        this.classifier = classifier;
    }

    public List<CandidateSource> collect(List<String> queries, String originalUrl, int maxSources, int resultsPerQuery) {
        Set<String> seen = new HashSet<>();
        if (originalUrl != null && !originalUrl.isBlank()) {
            seen.add(UrlUtils.dedupeKey(originalUrl));
        }

        List<CandidateSource> out = new ArrayList<>();
        for (String query : queries) {
            for (SearchAdapter adapter : adapters) {
                if (out.size() >= maxSources) return out;
                List<SearchResult> hits = searchCache.get(adapter.name() + "|" + resultsPerQuery + "|" + query,
                        k -> runSearch(adapter, query, resultsPerQuery));
                log.debug("adapter={} query=\"{}\" hits={}", adapter.name(), query, hits.size());

                for (SearchResult r : hits) {
                    if (out.size() >= maxSources) return out;
                    String key = UrlUtils.dedupeKey(r.url());
                    if (key.isEmpty() || !seen.add(key)) continue;
                    out.add(new CandidateSource(
                            "source-" + (out.size() + 1),
                            r.url(),
                            UrlUtils.normalizeHost(r.url()),
                            r.title(),
                            r.snippet(),
                            classifier.classify(r.url()),
                            r.source()));
                }
            }
        }
        return out;
    }

    private static List<SearchResult> runSearch(SearchAdapter adapter, String query, int limit) {
        try {
            List<SearchResult> res = adapter.search(query, limit);
            return res == null ? List.of() : List.copyOf(res);
        } catch (RuntimeException e) {
            log.warn("adapter={} error={}", adapter.name(), e.getMessage());
            return List.of();
        }
    }
}
