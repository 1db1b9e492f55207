package com.goormthonuniv.factcheck.dto;

import com.goormthonuniv.factcheck.verify.FactPair;

/**
 * 리포트 표시용 일치/충돌 쌍
 */
public record FactPairView(
        FactView original,
        FactView source,
        String matchStrength,     // match 일 때
        String conflictType,      // conflict 일 때
        String conflictSeverity
) {
    public static FactPairView of(FactPair p) {
        return new FactPairView(
                FactView.of(p.original()),
                FactView.of(p.source()),
                p.verdict().matchStrength(),
                p.verdict().conflictType(),
                p.verdict().conflictSeverity());
    }
}
