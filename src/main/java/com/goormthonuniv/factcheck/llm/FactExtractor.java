package com.goormthonuniv.factcheck.llm;

import com.goormthonuniv.factcheck.fact.FactHierarchy;

public interface FactExtractor {
    /**
     * 기사 본문에서 WHAT fact / claim 계층 추출.
     * @throws com.goormthonuniv.factcheck.fact.MalformedExtractionException 출력 형태가 계층으로 분해되지 않을 때
     * @throws LlmUnavailableException 추출 서비스 호출 자체가 불가할 때
     */
    FactHierarchy extract(String sourceId, String title, String text);
}
