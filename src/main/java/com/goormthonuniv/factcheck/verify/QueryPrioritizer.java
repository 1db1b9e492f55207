package com.goormthonuniv.factcheck.verify;

import com.goormthonuniv.factcheck.fact.Fact;
import com.goormthonuniv.factcheck.fact.FactHierarchy;
import com.goormthonuniv.factcheck.fact.Level;
import com.goormthonuniv.factcheck.util.TextUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 사실 계층에서 우선순위가 매겨진 검색 쿼리 목록을 만든다.
 *
 * 티어 순서 (티어 내부는 계층 삽입 순서 그대로, 재정렬 없음)
 * 1) importance=high WHAT fact
 * 2) importance=high CLAIM
 * 3) importance=medium WHAT fact
 * medium claim, low importance 는 쿼리하지 않는다.
 *
 * 쿼리 = "사건/주장 구절" + (첫 related-who 가 있으면) "who", 둘 다 정확어구 따옴표.
 * 출력은 원문 문자열(엔코딩 X). URL 조립 시점에서 URL-encode.
 */
public final class QueryPrioritizer {

    public static final int DEFAULT_MAX_QUERIES = 3;

    /** 정확어구가 너무 길면 검색 결과가 0이 되므로 앞부분만 사용 */
    static final int EVENT_MAX_WORDS = 10;
    static final int CLAIM_MAX_WORDS = 15;

    private QueryPrioritizer() {}

    public static List<String> prioritize(FactHierarchy hierarchy, int maxQueries) {
        if (hierarchy == null || maxQueries <= 0) return List.of();

        Set<String> queries = new LinkedHashSet<>();
        List<List<Fact>> tiers = List.of(
                select(hierarchy.whatFacts(), Level.HIGH),
                select(hierarchy.claims(), Level.HIGH),
                select(hierarchy.whatFacts(), Level.MEDIUM)
        );

        for (List<Fact> tier : tiers) {
            for (Fact f : tier) {
                if (queries.size() >= maxQueries) return new ArrayList<>(queries);
                String q = build(f);
                if (!q.isEmpty()) queries.add(q);
            }
        }
        return new ArrayList<>(queries);
    }

    /**
     * 계층에서 티어 쿼리가 하나도 안 나올 때의 비상 쿼리:
     * WHAT fact 최대 2개 + claim 1개의 첫 문장을 공백으로 이어 붙임.
     */
    public static String fallbackQuery(FactHierarchy hierarchy) {
        if (hierarchy == null) return "";
        List<String> parts = new ArrayList<>();
        hierarchy.whatFacts().stream().limit(2).map(f -> TextUtils.firstSentence(f.text())).forEach(parts::add);
        hierarchy.claims().stream().limit(1).map(f -> TextUtils.firstSentence(f.text())).forEach(parts::add);
        return parts.stream()
                .filter(TextUtils::notBlank)
                .collect(Collectors.joining(" "))
                .strip();
    }

    static String build(Fact f) {
        int maxWords = f.isEvent() ? EVENT_MAX_WORDS : CLAIM_MAX_WORDS;
        String phrase = quote(TextUtils.firstWords(f.text(), maxWords));
        if (phrase.isEmpty()) return "";
        return f.firstWho()
                .map(QueryPrioritizer::quote)
                .filter(w -> !w.isEmpty())
                .map(w -> phrase + " " + w)
                .orElse(phrase);
    }

    private static List<Fact> select(List<Fact> facts, Level importance) {
        return facts.stream().filter(f -> f.importance() == importance).toList();
    }

    private static String quote(String s) {
        if (s == null || s.isBlank()) return "";
        String val = TextUtils.normalizeSpaces(s.replace("\"", " "));
        return val.isEmpty() ? "" : "\"" + val + "\"";
    }
}
