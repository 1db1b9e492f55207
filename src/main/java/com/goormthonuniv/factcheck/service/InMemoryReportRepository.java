package com.goormthonuniv.factcheck.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.factcheck.dto.ScoredReport;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class InMemoryReportRepository implements ReportRepository {

    private final Cache<String, ScoredReport> reports = Caffeine.newBuilder()
            .maximumSize(1000)
            .build();

    @Override
    public ScoredReport save(ScoredReport report) {
        reports.put(report.reportId(), report);
        return report;
    }

    @Override
    public Optional<ScoredReport> findById(String reportId) {
        return Optional.ofNullable(reports.getIfPresent(reportId));
    }

    @Override
    public List<ScoredReport> findRecent(int limit) {
        return reports.asMap().values().stream()
                .sorted(Comparator.comparing(ScoredReport::createdAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }
}
