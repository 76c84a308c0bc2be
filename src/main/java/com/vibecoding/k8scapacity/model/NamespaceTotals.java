package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * 네임스페이스 단위 합계.
 * error가 있으면 수치는 모두 0이고 클러스터 합계에서 제외된다.
 */
@Value
@Builder(toBuilder = true)
public class NamespaceTotals {
    String namespace;
    int runningPods;
    double cpuRequestMillis;
    double cpuLimitMillis;
    double memoryRequestMib;
    double memoryLimitMib;
    int podsWithoutRequests;
    ActualUsage actualUsage;     // null = 측정 불가 (0 사용량과 다름)
    String error;

    public static NamespaceTotals failed(String namespace, String error) {
        return NamespaceTotals.builder()
                .namespace(namespace)
                .error(error == null || error.isBlank() ? "unknown error" : error)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }

    public Optional<ActualUsage> findActualUsage() {
        return Optional.ofNullable(actualUsage);
    }

    public NamespaceTotals withActualUsage(ActualUsage usage) {
        return toBuilder().actualUsage(usage).build();
    }
}
