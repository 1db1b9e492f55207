package com.goormthonuniv.factcheck.verify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * pending → filtered | analyzed | fetch_failed. 세 종료 상태는 되돌아가지 않는다.
 */
public enum SourceStatus {
    PENDING, ANALYZED, FILTERED, FETCH_FAILED;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
