package com.goormthonuniv.factcheck.verify;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * SourceType → 신뢰도 가중치 고정 테이블. 외부 설정으로 덮어쓸 수 있고 빠진 타입은 기본값.
 */
public final class ReliabilityWeights {

    private static final Map<SourceType, Double> DEFAULTS;
    static {
        EnumMap<SourceType, Double> m = new EnumMap<>(SourceType.class);
        m.put(SourceType.OFFICIAL, 1.0);
        m.put(SourceType.NEWS, 0.8);
        m.put(SourceType.BLOG, 0.4);
        m.put(SourceType.SOCIAL, 0.3);
        m.put(SourceType.UNKNOWN, 0.5);
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private final Map<SourceType, Double> table;

    private ReliabilityWeights(Map<SourceType, Double> table) {
        this.table = table;
    }

    public static ReliabilityWeights defaults() {
        return new ReliabilityWeights(DEFAULTS);
    }

    /** 가중치는 (0, 1] 범위여야 한다 */
    public static ReliabilityWeights of(Map<SourceType, Double> overrides) {
        EnumMap<SourceType, Double> m = new EnumMap<>(DEFAULTS);
        if (overrides != null) {
            overrides.forEach((type, w) -> {
                if (type == null || w == null) return;
                if (Double.isNaN(w) || w <= 0.0 || w > 1.0) {
                    throw new IllegalArgumentException("reliability weight for " + type + " must be in (0, 1]: " + w);
                }
                m.put(type, w);
            });
        }
        return new ReliabilityWeights(Collections.unmodifiableMap(m));
    }

    public double weightOf(SourceType type) {
        return table.getOrDefault(type == null ? SourceType.UNKNOWN : type, DEFAULTS.get(SourceType.UNKNOWN));
    }

    public Map<SourceType, Double> asMap() { return table; }
}
