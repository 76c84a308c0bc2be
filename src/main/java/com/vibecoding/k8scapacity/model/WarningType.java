package com.vibecoding.k8scapacity.model;

/**
 * 리포트 경고 유형
 */
public enum WarningType {
    FETCH_FAILED("Data fetch failed"),
    PODS_WITHOUT_REQUESTS("Pods without requests"),
    METRICS_UNAVAILABLE("Actual usage not available"),
    SKIPPED_WORKLOAD("Workload skipped"),
    UNMATCHED_PODS("Pods on unknown nodes"),
    UNPARSEABLE_QUANTITIES("Unparseable quantities");

    private final String displayName;

    WarningType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
