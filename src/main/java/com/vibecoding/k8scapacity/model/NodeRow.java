package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 노드 리포트 행. 메모리는 표시 단위.
 */
@Value
@Builder
public class NodeRow {
    String nodeName;
    int podCount;
    double capacity;
    double allocatable;
    double committed;
    double freeReserve;
    double utilizationPct;
    UtilizationLevel utilizationLevel;
    double memoryLimits;
    double overcommitPct;
    UtilizationLevel overcommitLevel;
    double allocatableCpuMillis;
    double committedCpuMillis;
    double cpuUtilizationPct;
    UtilizationLevel cpuUtilizationLevel;
    double cpuLimitsMillis;
    boolean actualAvailable;
    Double actualCpuMillis;      // actualAvailable == false 이면 null
    Double actualMemory;
    Double actualMemoryPct;
    Double actualCpuPct;
}
