package com.goormthonuniv.factcheck.llm;

import com.goormthonuniv.factcheck.fact.FactHierarchy;
import com.goormthonuniv.factcheck.verify.ComparisonResult;

public interface FactComparator {
    /**
     * 원문 계층과 소스 계층 비교. 판정은 fact id(W1, C2 ...)로 참조한다.
     * @throws com.goormthonuniv.factcheck.verify.InvalidComparisonException 응답 스키마 위반
     */
    ComparisonResult compare(FactHierarchy original, FactHierarchy source);
}
