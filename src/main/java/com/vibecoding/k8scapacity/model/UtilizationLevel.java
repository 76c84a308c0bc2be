package com.vibecoding.k8scapacity.model;

/**
 * 사용률 경고 수준
 */
public enum UtilizationLevel {
    OK,
    WARN,
    CRITICAL;

    public static UtilizationLevel classify(double pct, double warnThreshold, double criticalThreshold) {
        if (pct >= criticalThreshold) {
            return CRITICAL;
        }
        if (pct >= warnThreshold) {
            return WARN;
        }
        return OK;
    }
}
