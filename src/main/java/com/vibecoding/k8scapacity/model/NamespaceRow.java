package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 네임스페이스 리포트 행. 메모리는 표시 단위, 값은 소수점 2자리로 반올림됨.
 */
@Value
@Builder
public class NamespaceRow {
    String namespace;
    int runningPods;
    double cpuRequestMillis;
    double cpuLimitMillis;
    double memoryRequest;
    double memoryLimit;
    boolean actualAvailable;
    Double actualCpuMillis;      // actualAvailable == false 이면 null
    Double actualMemory;
    int podsWithoutRequests;
    String error;
}
