package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.model.BareNumberConvention;
import com.vibecoding.k8scapacity.model.ContainerResources;
import com.vibecoding.k8scapacity.model.PodResourceProfile;
import com.vibecoding.k8scapacity.model.WorkloadAccounting;
import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 워크로드 정의에서 컨테이너 requests/limits를 추출하고 레플리카 수만큼 곱한다
 */
@Component
@RequiredArgsConstructor
public class WorkloadResourceExtractor {

    private static final Logger log = LoggerFactory.getLogger(WorkloadResourceExtractor.class);

    private final QuantityParser quantityParser;

    /**
     * 워크로드 하나 집계
     */
    public WorkloadAccounting extract(WorkloadObject workload, BareNumberConvention memoryConvention) {
        PodResourceProfile perReplica = profile(workload.getContainers(), memoryConvention);
        int replicas = declaredReplicas(workload);

        WorkloadAccounting.WorkloadAccountingBuilder accounting = WorkloadAccounting.builder()
                .kind(workload.getKind())
                .name(workload.getName())
                .namespace(workload.getNamespace())
                .declaredReplicas(replicas)
                .perReplicaProfile(perReplica);

        if (workload.getKind().isPerNode()) {
            // 실제 배수는 노드 수라서 replicas=1로 더하면 과소 집계됨
            log.info("Skipping {}/{} in {}: runs one pod per node, sum it separately by node count",
                    workload.getKind().getKindName(), workload.getName(), workload.getNamespace());
            return accounting
                    .totalProfile(perReplica.times(0))
                    .skipped(true)
                    .note("one pod per node; multiply by node count separately")
                    .build();
        }

        if (replicas <= 0) {
            log.debug("{}/{} in {} is scaled to {} replicas, contributes nothing",
                    workload.getKind().getKindName(), workload.getName(), workload.getNamespace(), replicas);
            return accounting
                    .totalProfile(perReplica.times(0))
                    .note("scaled to zero")
                    .build();
        }

        log.debug("{}/{} in {}: {} replicas x {}m CPU / {} MiB requested",
                workload.getKind().getKindName(), workload.getName(), workload.getNamespace(),
                replicas, perReplica.getCpuRequestMillis(), perReplica.getMemoryRequestMib());
        return accounting
                .totalProfile(perReplica.times(replicas))
                .build();
    }

    /**
     * 컨테이너 목록 합산 (Pod 하나 기준). init 컨테이너는 넘겨받지 않는다.
     */
    public PodResourceProfile profile(List<ContainerResources> containers, BareNumberConvention memoryConvention) {
        PodResourceProfile total = PodResourceProfile.ZERO;
        if (containers == null) {
            return total;
        }
        for (ContainerResources container : containers) {
            total = total.plus(new PodResourceProfile(
                    quantityParser.parseCpu(container.getCpuRequest()),
                    quantityParser.parseCpu(container.getCpuLimit()),
                    quantityParser.parseMemory(container.getMemoryRequest(), memoryConvention),
                    quantityParser.parseMemory(container.getMemoryLimit(), memoryConvention),
                    container.hasAnyRequest()));
        }
        return total;
    }

    private int declaredReplicas(WorkloadObject workload) {
        if (workload.getReplicas() != null) {
            return workload.getReplicas();
        }
        // bare Pod은 항상 1개, 나머지는 replicas 미지정 시 0
        return workload.getKind() == WorkloadKind.POD ? 1 : 0;
    }
}
