package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 종류와 무관하게 정규화된 워크로드 정의 (Deployment, StatefulSet, DeploymentConfig, DaemonSet, Pod)
 */
@Value
@Builder
public class WorkloadObject {
    WorkloadKind kind;
    String name;
    String namespace;
    Integer replicas;            // spec.replicas, 없으면 null
    @Singular
    List<ContainerResources> containers;   // init 컨테이너 제외
}
