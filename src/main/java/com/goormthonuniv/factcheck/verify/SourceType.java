package com.goormthonuniv.factcheck.verify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {
    OFFICIAL, NEWS, BLOG, SOCIAL, UNKNOWN;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
