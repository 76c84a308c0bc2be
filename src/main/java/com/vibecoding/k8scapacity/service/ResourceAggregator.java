package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.model.ActualUsage;
import com.vibecoding.k8scapacity.model.BareNumberConvention;
import com.vibecoding.k8scapacity.model.NamespaceTotals;
import com.vibecoding.k8scapacity.model.PodObject;
import com.vibecoding.k8scapacity.model.PodResourceProfile;
import com.vibecoding.k8scapacity.model.WorkloadAccounting;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Pod/워크로드 집계를 네임스페이스 합계와 클러스터 합계로 접는다
 */
@Component
@RequiredArgsConstructor
public class ResourceAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResourceAggregator.class);

    private final WorkloadResourceExtractor extractor;

    /**
     * 실행 중인 Pod 목록 -> 네임스페이스 합계. Pod 수는 컨테이너가 아니라 Pod 단위로 센다.
     */
    public NamespaceTotals aggregatePods(String namespace, List<PodObject> pods, BareNumberConvention memoryConvention) {
        PodResourceProfile sum = PodResourceProfile.ZERO;
        int podCount = 0;
        int withoutRequests = 0;

        for (PodObject pod : pods) {
            PodResourceProfile profile = extractor.profile(pod.getContainers(), memoryConvention);
            sum = sum.plus(profile);
            podCount++;
            if (!profile.isRequestsDeclared()) {
                withoutRequests++;
            }
        }

        log.debug("Aggregated {} pods in {} ({} without requests)", podCount, namespace, withoutRequests);
        return totals(namespace, sum, podCount, withoutRequests);
    }

    /**
     * 워크로드 집계 -> 네임스페이스 합계. 제외된 워크로드와 0 레플리카 워크로드는 더하지 않는다.
     */
    public NamespaceTotals aggregateWorkloads(String namespace, List<WorkloadAccounting> workloads) {
        PodResourceProfile sum = PodResourceProfile.ZERO;
        int podCount = 0;
        int withoutRequests = 0;

        for (WorkloadAccounting workload : workloads) {
            if (!workload.isCounted()) {
                continue;
            }
            sum = sum.plus(workload.getTotalProfile());
            podCount += workload.getDeclaredReplicas();
            if (!workload.getPerReplicaProfile().isRequestsDeclared()) {
                withoutRequests += workload.getDeclaredReplicas();
            }
        }

        return totals(namespace, sum, podCount, withoutRequests);
    }

    /**
     * 조회에 실패한 네임스페이스. 목록에는 남지만 합계에서는 빠진다.
     */
    public NamespaceTotals failed(String namespace, String error) {
        return NamespaceTotals.failed(namespace, error);
    }

    /**
     * 오류 없는 네임스페이스만 더한 클러스터 합계. 실제 사용량은 측정된 네임스페이스만 더한다.
     */
    public NamespaceTotals grandTotal(String label, Collection<NamespaceTotals> namespaces) {
        NamespaceTotals.NamespaceTotalsBuilder total = NamespaceTotals.builder().namespace(label);
        int pods = 0;
        int withoutRequests = 0;
        double cpuRequest = 0.0;
        double cpuLimit = 0.0;
        double memoryRequest = 0.0;
        double memoryLimit = 0.0;
        ActualUsage actual = null;

        for (NamespaceTotals namespace : namespaces) {
            if (namespace.hasError()) {
                continue;
            }
            pods += namespace.getRunningPods();
            withoutRequests += namespace.getPodsWithoutRequests();
            cpuRequest += namespace.getCpuRequestMillis();
            cpuLimit += namespace.getCpuLimitMillis();
            memoryRequest += namespace.getMemoryRequestMib();
            memoryLimit += namespace.getMemoryLimitMib();
            if (namespace.getActualUsage() != null) {
                actual = actual == null ? namespace.getActualUsage() : actual.plus(namespace.getActualUsage());
            }
        }

        return total
                .runningPods(pods)
                .podsWithoutRequests(withoutRequests)
                .cpuRequestMillis(cpuRequest)
                .cpuLimitMillis(cpuLimit)
                .memoryRequestMib(memoryRequest)
                .memoryLimitMib(memoryLimit)
                .actualUsage(actual)
                .build();
    }

    private NamespaceTotals totals(String namespace, PodResourceProfile sum, int podCount, int withoutRequests) {
        return NamespaceTotals.builder()
                .namespace(namespace)
                .runningPods(podCount)
                .cpuRequestMillis(sum.getCpuRequestMillis())
                .cpuLimitMillis(sum.getCpuLimitMillis())
                .memoryRequestMib(sum.getMemoryRequestMib())
                .memoryLimitMib(sum.getMemoryLimitMib())
                .podsWithoutRequests(withoutRequests)
                .build();
    }
}
