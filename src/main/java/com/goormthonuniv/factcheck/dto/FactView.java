package com.goormthonuniv.factcheck.dto;

import com.goormthonuniv.factcheck.fact.Fact;
import com.goormthonuniv.factcheck.fact.FactKind;
import com.goormthonuniv.factcheck.fact.Level;

import java.util.List;

public record FactView(
        String id,
        FactKind kind,
        String text,
        Level importance,
        Level confidence,
        List<String> relatedWho,
        List<String> relatedWhere,
        List<String> relatedWhen
) {
    public static FactView of(Fact f) {
        return new FactView(f.id(), f.kind(), f.text(), f.importance(), f.confidence(),
                f.relatedWho(), f.relatedWhere(), f.relatedWhen());
    }
}
