package com.goormthonuniv.factcheck.fact;

/**
 * 추출 결과를 whatFacts/claims 구조로 분해할 수 없을 때. 같은 호출을 다시 해도 고쳐지지 않으므로 재시도하지 않는다.
 */
public class MalformedExtractionException extends RuntimeException {

    private final String sourceId;

    public MalformedExtractionException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public MalformedExtractionException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() { return sourceId; }
}
