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
import java.util.*;

@Slf4j
@Order(2)
@Component
public class GoogleCseAdapter implements SearchAdapter {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;
    private final String cx;

    public GoogleCseAdapter(RestClient rest,
                            @Value("${factcheck.adapters.google.endpoint:https://www.googleapis.com/customsearch/v1}") String endpoint,
                            @Value("${factcheck.adapters.google.apiKey:}") String apiKey,
                            @Value("${factcheck.adapters.google.cx:}") String cx) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.cx = cx;
    }

    @Override public String name() { return "google_cse"; }

    @Override
    public List<SearchResult> search(String query, int limit) {
        if (apiKey == null || apiKey.isBlank() || cx == null || cx.isBlank()) {
            log.warn("GoogleCSE disabled or misconfigured (missing apiKey/cx)");
            return List.of();
        }
        try {
            String encodedQ = URLEncoder.encode(query, StandardCharsets.UTF_8);
            // CSE 무료 티어는 한 페이지 최대 10건
            String url = "%s?key=%s&cx=%s&q=%s&num=%d"
                    .formatted(endpoint, apiKey, cx, encodedQ, Math.max(1, Math.min(limit, 10)));

            Map<String, Object> res = rest.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});

            if (res == null) return List.of();

            Object raw = res.get("items");
            List<?> list = (raw instanceof List<?> l) ? l : Collections.emptyList();

            List<SearchResult> out = new ArrayList<>();
            for (Object o : list) {
                if (!(o instanceof Map<?,?> m)) continue;

                String link = Optional.ofNullable(m.get("link")).map(Object::toString).orElse("");
                if (link.isBlank()) continue;
                out.add(new SearchResult(name(), SearchTexts.clean(m.get("title")), link, SearchTexts.clean(m.get("snippet")), null));
            }
            return out;
        } catch (Exception e) {
            log.warn("GoogleCSE error query=\"{}\": {}", query, e.getMessage());
            return List.of();
        }
    }
}
