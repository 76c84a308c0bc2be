package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 노드 하나의 allocatable 대비 예약(requests) 현황
 */
@Value
@Builder(toBuilder = true)
public class NodeAccounting {
    String nodeName;
    double capacityMib;
    double allocatableMib;
    double committedMib;         // 배치된 Pod의 memory requests 합
    double memoryLimitsMib;      // 배치된 Pod의 memory limits 합
    double allocatableCpuMillis;
    double committedCpuMillis;
    double cpuLimitsMillis;      // 배치된 Pod의 cpu limits 합
    int podCount;
    ActualUsage actualUsage;     // null = 노드 메트릭 없음 (0 사용량과 다름)

    /**
     * Negative when the node is over-committed. Never clamped.
     */
    public double getFreeReserveMib() {
        return allocatableMib - committedMib;
    }

    public double getUtilizationPct() {
        return percentOf(committedMib, allocatableMib);
    }

    public double getOvercommitPct() {
        return percentOf(memoryLimitsMib, allocatableMib);
    }

    public double getCpuUtilizationPct() {
        return percentOf(committedCpuMillis, allocatableCpuMillis);
    }

    public double getActualMemoryPct() {
        return actualUsage != null ? percentOf(actualUsage.getMemoryMib(), allocatableMib) : 0.0;
    }

    public double getActualCpuPct() {
        return actualUsage != null ? percentOf(actualUsage.getCpuMillis(), allocatableCpuMillis) : 0.0;
    }

    public NodeAccounting withActualUsage(ActualUsage usage) {
        return toBuilder().actualUsage(usage).build();
    }

    private static double percentOf(double part, double whole) {
        return whole > 0 ? part / whole * 100.0 : 0.0;
    }
}
