package com.goormthonuniv.factcheck.fact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 기사/소스 하나에서 추출된 사실 계층. whatFacts, claims 두 축으로 나뉘며 Fact를 소유한다(역참조 없음).
 * 비어 있는 계층도 유효하다(추출 실패 = 증거 부족 상태).
 */
public record FactHierarchy(String sourceId, List<Fact> whatFacts, List<Fact> claims) {

    public static final String ORIGINAL_ID = "original";

    public FactHierarchy {
        Objects.requireNonNull(sourceId, "sourceId");
        whatFacts = whatFacts == null ? List.of() : List.copyOf(whatFacts);
        claims = claims == null ? List.of() : List.copyOf(claims);
        for (Fact f : whatFacts) requireOwned(sourceId, f, FactKind.EVENT);
        for (Fact f : claims) requireOwned(sourceId, f, FactKind.CLAIM);
    }

    public static FactHierarchy empty(String sourceId) {
        return new FactHierarchy(sourceId, List.of(), List.of());
    }

    /** whatFacts 다음 claims 순서 */
    public List<Fact> all() {
        List<Fact> out = new ArrayList<>(whatFacts.size() + claims.size());
        out.addAll(whatFacts);
        out.addAll(claims);
        return Collections.unmodifiableList(out);
    }

    /** 비교 대상이 되는 사실 수 (WHO/WHERE/WHEN 제외) */
    public int comparableCount() {
        return whatFacts.size() + claims.size();
    }

    public boolean isEmpty() {
        return whatFacts.isEmpty() && claims.isEmpty();
    }

    public Optional<Fact> find(String factId) {
        if (factId == null) return Optional.empty();
        for (Fact f : whatFacts) if (f.id().equals(factId)) return Optional.of(f);
        for (Fact f : claims) if (f.id().equals(factId)) return Optional.of(f);
        return Optional.empty();
    }

    /** 계층 내 위치(whatFacts → claims 순). 없으면 -1 */
    public int positionOf(String factId) {
        List<Fact> all = all();
        for (int i = 0; i < all.size(); i++) {
            if (all.get(i).id().equals(factId)) return i;
        }
        return -1;
    }

    private static void requireOwned(String sourceId, Fact f, FactKind expected) {
        if (!sourceId.equals(f.sourceId())) {
            throw new IllegalArgumentException("fact " + f.id() + " belongs to " + f.sourceId() + ", not " + sourceId);
        }
        if (f.kind() != expected) {
            throw new IllegalArgumentException("fact " + f.id() + " is " + f.kind() + " but was placed under " + expected);
        }
    }
}
