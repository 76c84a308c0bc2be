package com.vibecoding.k8scapacity.model;

import java.util.Arrays;
import java.util.Comparator;

/**
 * 네임스페이스 리포트 정렬 기준
 */
public enum SortKey {
    CPU_REQ("cpu-req", Comparator.comparingDouble(NamespaceTotals::getCpuRequestMillis).reversed()),
    CPU_LIM("cpu-lim", Comparator.comparingDouble(NamespaceTotals::getCpuLimitMillis).reversed()),
    MEM_REQ("mem-req", Comparator.comparingDouble(NamespaceTotals::getMemoryRequestMib).reversed()),
    MEM_LIM("mem-lim", Comparator.comparingDouble(NamespaceTotals::getMemoryLimitMib).reversed()),
    PODS("pods", Comparator.comparingInt(NamespaceTotals::getRunningPods).reversed()),
    NAME("name", Comparator.comparing(NamespaceTotals::getNamespace));

    private final String key;
    private final Comparator<NamespaceTotals> order;

    SortKey(String key, Comparator<NamespaceTotals> order) {
        this.key = key;
        this.order = order;
    }

    public String getKey() {
        return key;
    }

    /**
     * Ordering with namespace name as tie breaker, so the result never depends on arrival order.
     */
    public Comparator<NamespaceTotals> comparator() {
        return order.thenComparing(NamespaceTotals::getNamespace);
    }

    public static SortKey fromKey(String key) {
        return Arrays.stream(values())
                .filter(sortKey -> sortKey.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown sort key: " + key + " (expected one of cpu-req, cpu-lim, mem-req, mem-lim, pods, name)"));
    }
}
