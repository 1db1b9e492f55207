package com.goormthonuniv.factcheck.fact;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * importance / confidence 공용 3단계 등급.
 */
public enum Level {
    HIGH, MEDIUM, LOW;

    /** 세 값 밖의 입력(null, 오타, 숫자 등)은 전부 MEDIUM으로 클램프 */
    public static Level parse(String raw) {
        if (raw == null) return MEDIUM;
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "low" -> LOW;
            default -> MEDIUM;
        };
    }

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
