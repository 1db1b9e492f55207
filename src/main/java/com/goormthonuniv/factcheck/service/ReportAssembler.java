package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.dto.*;
import com.goormthonuniv.factcheck.verify.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;

/**
 * 소스 분석 결과 → ScoredReport. 점수·등급은 WeightedScoringEngine, 나머지는 표시용 요약.
 */
public final class ReportAssembler {

    static final String UNVERIFIABLE_SUMMARY = "Unable to verify: no corroborating sources could be analyzed.";
    static final String UNVERIFIABLE_RECOMMENDATION =
            "The article could not be fact-checked due to lack of analyzable sources. Exercise extreme caution with this information.";
    static final String NO_OFFICIAL =
            "No official sources were found. Consider checking government or institutional sources.";
    static final String LOW_DIVERSITY =
            "Limited source diversity. Cross-reference with different types of sources.";

    private ReportAssembler() {}

    public static ScoredReport assemble(AnalysisContext ctx,
                                        String reportId,
                                        List<String> queries,
                                        int candidates,
                                        List<SourceAnalysis> results) {
        WeightedScoringEngine engine = new WeightedScoringEngine(ctx.settings().weights());

        List<SourceAnalysis> analyzed = results.stream().filter(SourceAnalysis::isAnalyzed).toList();
        // lowSignal 소스는 점수와 마찬가지로 요약·권고·유형별 평균에서 빠진다
        List<SourceAnalysis> signal = analyzed.stream().filter(a -> !a.agreement().lowSignal()).toList();
        List<ScoredSource> scored = analyzed.stream()
                .map(a -> new ScoredSource(a.candidate().url(), a.candidate().sourceType(), a.relevanceScore(), a.agreement()))
                .toList();
        ScoreOutcome outcome = engine.score(scored);

        int filtered = (int) results.stream().filter(r -> r.status() == SourceStatus.FILTERED).count();
        int failed = (int) results.stream().filter(r -> r.status() == SourceStatus.FETCH_FAILED).count();

        FactVerification facts = factVerification(analyzed);
        Double display = outcome.hasScore() ? round2(outcome.overallScore()) : null;

        return new ScoredReport(
                reportId,
                OffsetDateTime.ofInstant(ctx.startedAt(), ZoneOffset.UTC),
                ctx.articleUrl(),
                ctx.articleTitle(),
                display,
                outcome.confidenceLevel(),
                analyzed.size(),
                filtered,
                failed,
                candidates,
                queries,
                ctx.original().all().stream().map(FactView::of).toList(),
                summary(outcome, signal.size(), facts),
                recommendations(outcome, signal),
                scoreBreakdown(signal),
                sourceDistribution(analyzed),
                facts,
                results.stream().map(r -> breakdown(r, ctx.settings().weights())).toList()
        );
    }

    static String summary(ScoreOutcome outcome, int sources, FactVerification facts) {
        if (!outcome.hasScore()) return UNVERIFIABLE_SUMMARY;
        double score = outcome.overallScore();
        String verdict;
        if (score >= 80) verdict = "highly accurate";
        else if (score >= 60) verdict = "moderately accurate";
        else if (score >= 40) verdict = "questionable accuracy";
        else verdict = "low accuracy";
        return String.format(Locale.ROOT,
                "Based on analysis of %d source(s), the article appears to be %s with an overall score of %.1f/100. "
                        + "Found %d corroborating fact(s) and %d conflicting claim(s) across sources.",
                sources, verdict, score, facts.totalMatchingFacts(), facts.totalConflictingFacts());
    }

    static List<String> recommendations(ScoreOutcome outcome, List<SourceAnalysis> signal) {
        if (!outcome.hasScore()) return List.of(UNVERIFIABLE_RECOMMENDATION);
        List<String> out = new ArrayList<>();
        double score = outcome.overallScore();
        if (score >= 80 && outcome.confidenceLevel() == ConfidenceLevel.HIGH) {
            out.add("The information appears reliable and well-supported by multiple sources.");
        } else if (score >= 60) {
            out.add("The information has moderate support. Consider seeking additional sources for verification.");
        } else {
            out.add("Exercise caution: The information has limited support or conflicting reports.");
        }
        Set<SourceType> types = EnumSet.noneOf(SourceType.class);
        signal.forEach(a -> types.add(a.candidate().sourceType()));
        if (!types.contains(SourceType.OFFICIAL)) out.add(NO_OFFICIAL);
        if (types.size() < 2) out.add(LOW_DIVERSITY);
        return out;
    }

    static Map<String, TypeBreakdown> scoreBreakdown(List<SourceAnalysis> signal) {
        Map<SourceType, List<Double>> ratios = new EnumMap<>(SourceType.class);
        for (SourceAnalysis a : signal) {
            ratios.computeIfAbsent(a.candidate().sourceType(), t -> new ArrayList<>()).add(a.agreement().agreementRatio());
        }
        Map<String, TypeBreakdown> out = new LinkedHashMap<>();
        ratios.forEach((type, list) -> out.put(type.wireName(),
                new TypeBreakdown(list.size(), list.stream().mapToDouble(Double::doubleValue).average().orElse(0.0))));
        return out;
    }

    static Map<String, Integer> sourceDistribution(List<SourceAnalysis> analyzed) {
        Map<SourceType, Integer> counts = new EnumMap<>(SourceType.class);
        analyzed.forEach(a -> counts.merge(a.candidate().sourceType(), 1, Integer::sum));
        Map<String, Integer> out = new LinkedHashMap<>();
        counts.forEach((type, n) -> out.put(type.wireName(), n));
        return out;
    }

    static FactVerification factVerification(List<SourceAnalysis> analyzed) {
        int matching = analyzed.stream().mapToInt(a -> a.agreement().matches()).sum();
        int conflicting = analyzed.stream().mapToInt(a -> a.agreement().conflicts()).sum();
        int total = matching + conflicting;
        return new FactVerification(matching, conflicting, total == 0 ? 0.0 : (double) matching / total);
    }

    private static SourceBreakdown breakdown(SourceAnalysis r, ReliabilityWeights weights) {
        CandidateSource c = r.candidate();
        SourceAgreement ag = r.agreement();
        boolean analyzed = r.isAnalyzed();
        return new SourceBreakdown(
                c.id(), c.url(), c.domain(), c.title(), c.sourceType(), r.status(),
                r.relevanceScore(),
                weights.weightOf(c.sourceType()),
                analyzed ? ag.agreementRatio() : null,
                analyzed && ag.lowSignal(),
                analyzed ? ag.matches() : 0,
                analyzed ? ag.conflicts() : 0,
                analyzed ? ag.absent() : 0,
                analyzed ? ag.matched().stream().map(FactPairView::of).toList() : List.of(),
                analyzed ? ag.conflicting().stream().map(FactPairView::of).toList() : List.of(),
                r.analysisNotes(),
                r.failureReason());
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
