package com.goormthonuniv.factcheck.fact;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 하나의 WHAT fact 또는 CLAIM. 생성 후 불변이며 소유 계층(sourceId) 하나에만 속한다.
 * WHO/WHERE/WHEN은 독립적으로 매칭되지 않는 맥락 정보.
 */
public record Fact(
        String id,                 // 계층 내 식별자: W1, W2 ... / C1, C2 ...
        String sourceId,           // "original" | 소스 식별자
        FactKind kind,
        String text,
        Level importance,
        Level confidence,
        List<String> relatedWho,
        List<String> relatedWhere,
        List<String> relatedWhen
) {
    public Fact {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        importance = importance == null ? Level.MEDIUM : importance;
        confidence = confidence == null ? Level.MEDIUM : confidence;
        relatedWho = relatedWho == null ? List.of() : List.copyOf(relatedWho);
        relatedWhere = relatedWhere == null ? List.of() : List.copyOf(relatedWhere);
        relatedWhen = relatedWhen == null ? List.of() : List.copyOf(relatedWhen);
    }

    public Optional<String> firstWho() {
        return relatedWho.isEmpty() ? Optional.empty() : Optional.of(relatedWho.get(0));
    }

    public boolean isEvent() { return kind == FactKind.EVENT; }
}
