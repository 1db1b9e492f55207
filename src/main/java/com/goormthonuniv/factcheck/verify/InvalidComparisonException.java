package com.goormthonuniv.factcheck.verify;

/**
 * 비교 결과가 데이터 계약을 어길 때 (모르는 fact id, 같은 fact에 대한 상충 판정 등).
 */
public class InvalidComparisonException extends RuntimeException {

    public InvalidComparisonException(String message) {
        super(message);
    }

    public InvalidComparisonException(String message, Throwable cause) {
        super(message, cause);
    }
}
