package com.goormthonuniv.factcheck.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * newsapi.org /v2/everything (영문, relevancy 정렬)
 */
@Slf4j
@Order(1)
@Component
public class NewsApiAdapter implements SearchAdapter {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;
    private final String language;

    public NewsApiAdapter(RestClient rest,
                          @Value("${factcheck.adapters.newsapi.endpoint:https://newsapi.org/v2/everything}") String endpoint,
                          @Value("${factcheck.adapters.newsapi.apiKey:}") String apiKey,
                          @Value("${factcheck.adapters.newsapi.language:en}") String language) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.language = language;
    }

    @Override public String name() { return "newsapi"; }

    @Override
    public List<SearchResult> search(String query, int limit) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("NewsAPI disabled (missing apiKey)");
            return List.of();
        }
        try {
            String url = "%s?q=%s&language=%s&sortBy=relevancy&pageSize=%d".formatted(
                    endpoint, URLEncoder.encode(query, StandardCharsets.UTF_8), language, Math.max(1, Math.min(limit, 100)));

            Map<String, Object> res = rest.get().uri(URI.create(url))
                    .header("X-Api-Key", apiKey)
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});

            if (res == null || !"ok".equals(res.get("status"))) {
                log.warn("NewsAPI non-ok response query=\"{}\" status={}", query, res == null ? null : res.get("status"));
                return List.of();
            }

            Object raw = res.get("articles");
            List<?> articles = (raw instanceof List<?> l) ? l : Collections.emptyList();

            List<SearchResult> out = new ArrayList<>();
            for (Object o : articles) {
                if (!(o instanceof Map<?,?> a)) continue;
                String link = Optional.ofNullable(a.get("url")).map(Object::toString).orElse("");
                if (link.isBlank()) continue;
                out.add(new SearchResult(name(),
                        SearchTexts.clean(a.get("title")),
                        link,
                        SearchTexts.clean(a.get("description")),
                        parseTime(a.get("publishedAt"))));
                if (out.size() >= limit) break;
            }
            return out;
        } catch (Exception e) {
            log.warn("NewsAPI error query=\"{}\": {}", query, e.getMessage());
            return List.of();
        }
    }

    private static OffsetDateTime parseTime(Object v) {
        if (!(v instanceof String s) || s.isBlank()) return null;
        try {
            return OffsetDateTime.parse(s);
        } catch (DateTimeParseException e) {
            log.debug("unparseable publishedAt {}", s);
            return null;
        }
    }
}
