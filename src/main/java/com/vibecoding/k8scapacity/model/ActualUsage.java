package com.vibecoding.k8scapacity.model;

import lombok.Value;

/**
 * metrics-server 기준 실제 사용량 (millicore, MiB)
 */
@Value
public class ActualUsage {
    double cpuMillis;
    double memoryMib;

    public ActualUsage plus(ActualUsage other) {
        return new ActualUsage(cpuMillis + other.cpuMillis, memoryMib + other.memoryMib);
    }
}
