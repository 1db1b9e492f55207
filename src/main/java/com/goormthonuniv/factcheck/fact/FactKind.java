package com.goormthonuniv.factcheck.fact;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FactKind {
    EVENT("W"),   // WHAT fact
    CLAIM("C");

    private final String idPrefix;

    FactKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() { return idPrefix; }

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
