package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.dto.ScoredReport;

import java.util.List;
import java.util.Optional;

public interface ReportRepository {

    ScoredReport save(ScoredReport report);

    Optional<ScoredReport> findById(String reportId);

    /** createdAt 내림차순 최대 limit 개 */
    List<ScoredReport> findRecent(int limit);
}
