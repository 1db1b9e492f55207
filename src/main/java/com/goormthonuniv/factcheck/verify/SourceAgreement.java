package com.goormthonuniv.factcheck.verify;

import java.util.List;

/**
 * 소스 하나에 대한 집계 결과.
 * agreementRatio = matches / (matches + conflicts), 분모 0이면 0 이고 lowSignal=true.
 */
public record SourceAgreement(
        int matches,
        int conflicts,
        int absent,
        int comparableCount,
        double agreementRatio,
        boolean lowSignal,
        List<FactPair> matched,
        List<FactPair> conflicting
) {
    public SourceAgreement {
        matched = matched == null ? List.of() : List.copyOf(matched);
        conflicting = conflicting == null ? List.of() : List.copyOf(conflicting);
    }
}
