package com.goormthonuniv.factcheck.verify;

import com.goormthonuniv.factcheck.fact.Fact;
import com.goormthonuniv.factcheck.fact.FactHierarchy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 한 소스의 판정들을 일치/충돌 목록과 agreementRatio 로 집계한다.
 * absent 는 분자/분모 어디에도 들어가지 않는다. 원문 fact 하나당 판정은 최대 하나.
 */
public final class ComparisonAggregator {

    private ComparisonAggregator() {}

    public static SourceAgreement aggregate(Collection<ComparisonVerdict> verdicts,
                                            FactHierarchy original,
                                            FactHierarchy source) {
        int comparable = original.comparableCount();
        checkCardinality(verdicts, comparable);

        int matches = 0, conflicts = 0, absent = 0;
        List<FactPair> matched = new ArrayList<>();
        List<FactPair> conflicting = new ArrayList<>();

        for (ComparisonVerdict v : verdicts) {
            Fact o = original.find(v.originalFactId())
                    .orElseThrow(() -> new InvalidComparisonException("unknown original fact " + v.originalFactId()));
            switch (v.outcome()) {
                case MATCH -> {
                    matches++;
                    matched.add(new FactPair(o, resolveSource(source, v), v));
                }
                case CONFLICT -> {
                    conflicts++;
                    conflicting.add(new FactPair(o, resolveSource(source, v), v));
                }
                case ABSENT -> absent++;
            }
        }

        // 표시 순서도 판정 입력 순서와 무관하게 원문 계층 순서로 고정
        Comparator<FactPair> byPosition = Comparator.comparingInt(p -> original.positionOf(p.original().id()));
        matched.sort(byPosition);
        conflicting.sort(byPosition);

        int denominator = matches + conflicts;
        double ratio = denominator == 0 ? 0.0 : (double) matches / denominator;
        return new SourceAgreement(matches, conflicts, absent, comparable, ratio, denominator == 0, matched, conflicting);
    }

    private static void checkCardinality(Collection<ComparisonVerdict> verdicts, int comparable) {
        Set<String> seen = new HashSet<>();
        for (ComparisonVerdict v : verdicts) {
            if (!seen.add(v.originalFactId())) {
                throw new InvalidComparisonException("more than one verdict for original fact " + v.originalFactId());
            }
        }
        if (seen.size() > comparable) {
            throw new InvalidComparisonException("got " + seen.size() + " verdicts for " + comparable + " comparable facts");
        }
    }

    private static Fact resolveSource(FactHierarchy source, ComparisonVerdict v) {
        return source.find(v.matchedSourceFactId())
                .orElseThrow(() -> new InvalidComparisonException("unknown source fact " + v.matchedSourceFactId()));
    }
}
