package com.goormthonuniv.factcheck.verify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerdictOutcome {
    MATCH, CONFLICT, ABSENT;

    /** match/conflict 는 소스 쪽 fact 참조가 반드시 있어야 한다 */
    public boolean requiresSourceRef() { return this != ABSENT; }

    /** 모르는 값이면 null */
    public static VerdictOutcome parse(String raw) {
        if (raw == null) return null;
        return switch (raw.strip().toLowerCase(Locale.ROOT)) {
            case "match", "matching" -> MATCH;
            case "conflict", "conflicting" -> CONFLICT;
            case "absent", "unique", "unique_to_original" -> ABSENT;
            default -> null;
        };
    }

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
