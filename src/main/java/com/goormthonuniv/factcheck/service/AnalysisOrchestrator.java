package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.config.AsyncConfig;
import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.dto.AnalyzeRequest;
import com.goormthonuniv.factcheck.dto.ScoredReport;
import com.goormthonuniv.factcheck.fact.FactHierarchy;
import com.goormthonuniv.factcheck.llm.FactExtractor;
import com.goormthonuniv.factcheck.util.TextUtils;
import com.goormthonuniv.factcheck.verify.QueryPrioritizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class AnalysisOrchestrator {

    private final FactCheckProperties props;
    private final ArticleFetcher fetcher;
    private final FactExtractor extractor;
    private final CandidateCollector collector;
    private final SourceAnalyzer analyzer;
    private final ReportRepository repository;
    private final Executor executor;
    private final TaskScheduler timeoutScheduler;

    public AnalysisOrchestrator(FactCheckProperties props,
                                ArticleFetcher fetcher,
                                FactExtractor extractor,
                                CandidateCollector collector,
                                SourceAnalyzer analyzer,
                                ReportRepository repository,
                                @Qualifier(AsyncConfig.SOURCE_ANALYSIS_EXECUTOR) Executor executor,
                                @Qualifier(AsyncConfig.SOURCE_TIMEOUT_SCHEDULER) TaskScheduler timeoutScheduler) {
        this.props = props;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.collector = collector;
        this.analyzer = analyzer;
        this.repository = repository;
        this.executor = executor;
        this.timeoutScheduler = timeoutScheduler;
    }

    /** 메인 엔트리 */
    public ScoredReport analyze(AnalyzeRequest req) {
        final String runId = UUID.randomUUID().toString();
        final AnalysisSettings settings = AnalysisSettings.from(props);
        final Instant startedAt = Instant.now();

        // 1) 원문 확보 (url fetch 실패는 실행 실패)
        String url = TextUtils.notBlank(req.url()) ? req.url().strip() : null;
        String title = TextUtils.notBlank(req.title()) ? req.title().strip() : null;
        String text;
        if (req.hasText()) {
            text = req.text();
        } else {
            FetchedArticle article = fetcher.fetch(url);
            text = article.content();
            if (title == null) title = article.title();
        }
        log.info("[{}] analysis start url={} chars={}", runId, url, text.length());

        // 2) 원문 계층 추출 (형태 오류는 재시도 없이 실행 실패)
        FactHierarchy original = extractor.extract(FactHierarchy.ORIGINAL_ID, title, text);
        AnalysisContext ctx = new AnalysisContext(runId, url, title, original, settings, startedAt);

        // 3) 쿼리
        List<String> queries = buildQueries(original, settings.maxQueries());
        log.info("[{}] facts what={} claims={} queries={}", runId,
                original.whatFacts().size(), original.claims().size(), queries.size());

        // 4) 후보 수집
        List<CandidateSource> candidates = queries.isEmpty()
                ? List.of()
                : collector.collect(queries, url, settings.maxSources(), settings.resultsPerQuery());
        log.info("[{}] candidates={}", runId, candidates.size());

        // 5~7) 소스별 분석 후 전부 끝나면 집계
        List<SourceAnalysis> results = analyzeAll(ctx, candidates);
        ScoredReport report = ReportAssembler.assemble(ctx, runId, queries, candidates.size(), results);

        log.info("[{}] done score={} confidence={} analyzed={} filtered={} failed={}", runId,
                report.overallScore(), report.confidenceLevel().wireName(),
                report.sourcesConsidered(), report.sourcesFiltered(), report.sourcesFailed());
        return repository.save(report);
    }

    static List<String> buildQueries(FactHierarchy original, int maxQueries) {
        List<String> queries = QueryPrioritizer.prioritize(original, maxQueries);
        if (!queries.isEmpty()) return queries;
        String fallback = QueryPrioritizer.fallbackQuery(original);
        return fallback.isBlank() ? List.of() : List.of(fallback);
    }

    List<SourceAnalysis> analyzeAll(AnalysisContext ctx, List<CandidateSource> candidates) {
        List<CompletableFuture<SourceAnalysis>> futures = new ArrayList<>();
        for (CandidateSource c : candidates) {
            CompletableFuture<SourceAnalysis> result = new CompletableFuture<>();
            executor.execute(() -> runWithDeadline(ctx, c, result));
            futures.add(result.exceptionally(ex -> failed(ctx, c, ex)));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /**
     * 워커에서 실행. 마감은 큐 대기 시간을 빼고 작업 시작 시점부터 잰다.
     * 마감이 먼저 오면 결과를 timeout 실패로 확정하고 워커를 interrupt 한다.
     */
    private void runWithDeadline(AnalysisContext ctx, CandidateSource c, CompletableFuture<SourceAnalysis> result) {
        final Thread worker = Thread.currentThread();
        final Object guard = new Object();
        final boolean[] finished = {false};
        Instant deadline = Instant.now().plus(ctx.settings().perSourceTimeout());
        ScheduledFuture<?> watchdog = null;
        try {
            watchdog = timeoutScheduler.schedule(() -> {
                synchronized (guard) {
                    if (!finished[0] && result.completeExceptionally(new TimeoutException())) {
                        worker.interrupt();
                    }
                }
            }, deadline);
            result.complete(analyzer.analyze(ctx, c));
        } catch (Throwable t) {
            result.completeExceptionally(t);
        } finally {
            synchronized (guard) {
                finished[0] = true;
            }
            if (watchdog != null) watchdog.cancel(false);
            // 마감 interrupt 가 다음 작업으로 새지 않게
            Thread.interrupted();
        }
    }

    private static SourceAnalysis failed(AnalysisContext ctx, CandidateSource c, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        String reason = cause instanceof TimeoutException
                ? "timed out after " + ctx.settings().perSourceTimeout().toSeconds() + "s"
                : "error: " + cause.getMessage();
        log.warn("[{}] source failed url={} reason={}", ctx.runId(), c.url(), reason);
        return SourceAnalysis.failed(c, reason);
    }
}
