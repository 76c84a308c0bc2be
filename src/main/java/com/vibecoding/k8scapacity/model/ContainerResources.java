package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 컨테이너 하나의 requests/limits 원본 값 (미지정 = null)
 */
@Value
@Builder
public class ContainerResources {
    String name;
    String cpuRequest;       // "500m", "0.5"
    String memoryRequest;    // "256Mi", "1Gi"
    String cpuLimit;
    String memoryLimit;

    /**
     * requests 중 하나라도 선언되었는지 (limits는 보지 않음)
     */
    public boolean hasAnyRequest() {
        return isDeclared(cpuRequest) || isDeclared(memoryRequest);
    }

    private static boolean isDeclared(String value) {
        return value != null && !value.isBlank();
    }
}
