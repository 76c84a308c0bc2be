package com.vibecoding.k8scapacity.fetcher;

import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.List;

/**
 * 워크로드 종류별 조회기 인터페이스
 */
public interface WorkloadFetcher {
    /**
     * 이 조회기가 해당 종류를 조회할 수 있는지 확인
     */
    boolean canFetch(WorkloadKind kind);

    /**
     * 네임스페이스의 워크로드를 정규화된 형태로 조회
     */
    List<WorkloadObject> fetch(KubernetesClient client, String namespace);

    /**
     * 이 조회기가 담당하는 워크로드 종류
     */
    WorkloadKind getKind();
}
