package com.vibecoding.k8scapacity.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 표시용 메모리 단위
 */
public enum MemoryUnit {
    MIB("MiB", 1.0),
    GIB("GiB", 1024.0);

    private static final Logger log = LoggerFactory.getLogger(MemoryUnit.class);

    private final String displayName;
    private final double divisor;

    MemoryUnit(String displayName, double divisor) {
        this.displayName = displayName;
        this.divisor = divisor;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getDivisor() {
        return divisor;
    }

    /**
     * Accepts "GiB", "Gi", "MiB", "Mi" in any case. Unknown values fall back to GiB.
     */
    public static MemoryUnit fromString(String value) {
        if (value == null || value.isBlank()) {
            return GIB;
        }
        try {
            return of(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown memory unit '{}', using GiB", value);
            return GIB;
        }
    }

    /**
     * 요청 파라미터용 엄격한 변환. 알 수 없는 단위는 IllegalArgumentException.
     */
    public static MemoryUnit of(String value) {
        switch (value.trim().toUpperCase()) {
            case "GIB":
            case "GI":
                return GIB;
            case "MIB":
            case "MI":
                return MIB;
            default:
                throw new IllegalArgumentException("Unknown memory unit: " + value + " (expected GiB or MiB)");
        }
    }
}
