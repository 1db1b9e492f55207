package com.goormthonuniv.factcheck.verify;

import java.util.List;

/**
 * 비교 서비스 한 번의 결과. relevanceScore 는 없을 수 있다(null).
 */
public record ComparisonResult(
        Double relevanceScore,
        List<ComparisonVerdict> verdicts,
        String analysisNotes
) {
    public ComparisonResult {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
        analysisNotes = analysisNotes == null ? "" : analysisNotes;
    }
}
