package com.goormthonuniv.factcheck.dto;

import com.goormthonuniv.factcheck.verify.SourceStatus;
import com.goormthonuniv.factcheck.verify.SourceType;

import java.util.List;

public record SourceBreakdown(
        String id,
        String url,
        String domain,
        String title,
        SourceType sourceType,
        SourceStatus status,
        Double relevanceScore,
        double reliabilityWeight,
        Double agreementRatio,        // analyzed 가 아니면 null
        boolean lowSignal,
        int matches,
        int conflicts,
        int absent,
        List<FactPairView> matched,
        List<FactPairView> conflicting,
        String analysisNotes,
        String failureReason
) {}
