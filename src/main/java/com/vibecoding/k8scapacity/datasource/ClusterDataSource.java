package com.vibecoding.k8scapacity.datasource;

import com.vibecoding.k8scapacity.model.ClusterIdentity;
import com.vibecoding.k8scapacity.model.NodeObject;
import com.vibecoding.k8scapacity.model.NodeUsageSample;
import com.vibecoding.k8scapacity.model.PodObject;
import com.vibecoding.k8scapacity.model.PodUsageSample;
import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 클러스터 원본 데이터 조회 인터페이스.
 * 모든 구현은 종류별 JSON을 여기서 한 번만 정규화해서 돌려준다.
 * <p>
 * Listing methods throw {@link com.vibecoding.k8scapacity.exception.DataFetchException} for a
 * failure scoped to one namespace or resource type, and
 * {@link com.vibecoding.k8scapacity.exception.ClusterAccessException} when the cluster itself
 * cannot be used.
 */
public interface ClusterDataSource {

    /**
     * 접속/인증 확인. 실패하면 ClusterAccessException.
     */
    ClusterIdentity verifyAccess();

    List<String> listNamespaces();

    boolean namespaceExists(String namespace);

    List<WorkloadObject> listWorkloads(String namespace, Set<WorkloadKind> kinds);

    /**
     * @param namespace null이면 모든 네임스페이스
     * @param phases    비어 있으면 모든 phase
     */
    List<PodObject> listPods(String namespace, Set<String> phases);

    List<NodeObject> listNodes();

    /**
     * 실사용 스냅샷. metrics-server가 없거나 조회에 실패하면 empty.
     */
    Optional<List<PodUsageSample>> topPods(String namespace);

    /**
     * 노드별 실사용 스냅샷. 조회할 수 없으면 empty.
     */
    Optional<List<NodeUsageSample>> topNodes();
}
