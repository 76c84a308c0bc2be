package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 워크로드 리포트 행. 메모리는 표시 단위.
 */
@Value
@Builder
public class WorkloadRow {
    String namespace;
    String kind;
    String name;
    int replicas;
    double podCpuRequestMillis;
    double podCpuLimitMillis;
    double podMemoryRequest;
    double podMemoryLimit;
    double totalCpuRequestMillis;
    double totalCpuLimitMillis;
    double totalMemoryRequest;
    double totalMemoryLimit;
    boolean counted;
    String note;
}
