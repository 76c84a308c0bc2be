package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 워크로드 하나의 집계 결과 (레플리카당 프로파일 x 선언된 레플리카 수)
 */
@Value
@Builder
public class WorkloadAccounting {
    WorkloadKind kind;
    String name;
    String namespace;
    int declaredReplicas;
    PodResourceProfile perReplicaProfile;
    PodResourceProfile totalProfile;
    boolean skipped;             // 합산 대상에서 제외 (예: DaemonSet)
    String note;

    /**
     * 네임스페이스 합계에 더해지는지 여부
     */
    public boolean isCounted() {
        return !skipped && declaredReplicas > 0;
    }

    public String getIdentity() {
        return kind.getKindName() + "/" + name;
    }
}
