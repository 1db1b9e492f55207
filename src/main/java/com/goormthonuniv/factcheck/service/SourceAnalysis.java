package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.verify.SourceAgreement;
import com.goormthonuniv.factcheck.verify.SourceStatus;

/**
 * 소스 하나의 최종 상태. relevanceScore 는 필터에 쓴 유효값(비교 전 실패면 null).
 */
public record SourceAnalysis(
        CandidateSource candidate,
        SourceStatus status,
        Double relevanceScore,
        SourceAgreement agreement,
        String analysisNotes,
        String failureReason
) {
    public static SourceAnalysis analyzed(CandidateSource c, double relevance, SourceAgreement agreement, String notes) {
        return new SourceAnalysis(c, SourceStatus.ANALYZED, relevance, agreement, notes, null);
    }

    public static SourceAnalysis filtered(CandidateSource c, double relevance, String notes) {
        return new SourceAnalysis(c, SourceStatus.FILTERED, relevance, null, notes, null);
    }

    public static SourceAnalysis failed(CandidateSource c, String reason) {
        return new SourceAnalysis(c, SourceStatus.FETCH_FAILED, null, null, null, reason);
    }

    public boolean isAnalyzed() { return status == SourceStatus.ANALYZED; }
}
