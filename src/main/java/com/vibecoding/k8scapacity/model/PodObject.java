package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 정규화된 Pod 정보
 */
@Value
@Builder
public class PodObject {
    public static final String PHASE_RUNNING = "Running";
    public static final String PHASE_PENDING = "Pending";

    String name;
    String namespace;
    String phase;
    String nodeName;             // 스케줄 전이면 null
    @Singular
    List<ContainerResources> containers;   // init 컨테이너 제외

    public boolean isScheduled() {
        return nodeName != null && !nodeName.isBlank();
    }

    public boolean isRunningOrPending() {
        return PHASE_RUNNING.equals(phase) || PHASE_PENDING.equals(phase);
    }
}
