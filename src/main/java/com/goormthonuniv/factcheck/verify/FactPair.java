package com.goormthonuniv.factcheck.verify;

import com.goormthonuniv.factcheck.fact.Fact;

public record FactPair(Fact original, Fact source, ComparisonVerdict verdict) {}
