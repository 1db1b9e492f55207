package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.fact.FactHierarchy;
import com.goormthonuniv.factcheck.fact.MalformedExtractionException;
import com.goormthonuniv.factcheck.llm.FactComparator;
import com.goormthonuniv.factcheck.llm.FactExtractor;
import com.goormthonuniv.factcheck.llm.LlmUnavailableException;
import com.goormthonuniv.factcheck.verify.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 소스 하나: fetch → 추출 → 비교 → relevance 필터 → 판정 검증 → 집계.
 * 소스 단위 실패는 FETCH_FAILED 결과로 돌려주고 밖으로 던지지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceAnalyzer {

    private final ArticleFetcher fetcher;
    private final FactExtractor extractor;
    private final FactComparator comparator;

    public SourceAnalysis analyze(AnalysisContext ctx, CandidateSource candidate) {
        try {
            FetchedArticle article = fetcher.fetch(candidate.url());
            FactHierarchy sourceFacts = extractor.extract(candidate.id(), article.title(), article.content());
            if (sourceFacts.isEmpty()) {
                return SourceAnalysis.failed(candidate, "no facts extracted");
            }

            ComparisonResult result = comparator.compare(ctx.original(), sourceFacts);
            RelevanceFilter filter = ctx.settings().relevanceFilter();
            double relevance = filter.effectiveScore(result.relevanceScore());
            if (filter.apply(result.relevanceScore()) == SourceStatus.FILTERED) {
                log.debug("[{}] filtered url={} relevance={}", ctx.runId(), candidate.url(), relevance);
                return SourceAnalysis.filtered(candidate, relevance, result.analysisNotes());
            }

            List<ComparisonVerdict> verdicts = VerdictValidator.validate(result.verdicts(), ctx.original(), sourceFacts);
            SourceAgreement agreement = ComparisonAggregator.aggregate(verdicts, ctx.original(), sourceFacts);
            return SourceAnalysis.analyzed(candidate, relevance, agreement, result.analysisNotes());
        } catch (ArticleFetchException e) {
            return fail(ctx, candidate, "fetch failed: " + e.getMessage());
        } catch (MalformedExtractionException e) {
            return fail(ctx, candidate, "malformed extraction: " + e.getMessage());
        } catch (InvalidComparisonException e) {
            return fail(ctx, candidate, "invalid comparison: " + e.getMessage());
        } catch (LlmUnavailableException e) {
            return fail(ctx, candidate, "llm unavailable: " + e.getMessage());
        }
    }

    private static SourceAnalysis fail(AnalysisContext ctx, CandidateSource candidate, String reason) {
        log.warn("[{}] source failed url={} reason={}", ctx.runId(), candidate.url(), reason);
        return SourceAnalysis.failed(candidate, reason);
    }
}
