package com.goormthonuniv.factcheck.dto;

public record FactVerification(
        int totalMatchingFacts,
        int totalConflictingFacts,
        double verificationRatio   // 비교 가능한 판정이 없으면 0
) {}
