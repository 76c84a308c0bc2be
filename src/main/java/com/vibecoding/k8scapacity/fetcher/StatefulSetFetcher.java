package com.vibecoding.k8scapacity.fetcher;

import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * StatefulSet 조회기
 */
@Component
public class StatefulSetFetcher implements WorkloadFetcher {

    @Override
    public boolean canFetch(WorkloadKind kind) {
        return kind == WorkloadKind.STATEFUL_SET;
    }

    @Override
    public List<WorkloadObject> fetch(KubernetesClient client, String namespace) {
        return client.apps().statefulSets()
            .inNamespace(namespace)
            .list()
            .getItems()
            .stream()
            .map(StatefulSetFetcher::toWorkload)
            .collect(Collectors.toList());
    }

    static WorkloadObject toWorkload(StatefulSet statefulSet) {
        return WorkloadObject.builder()
                .kind(WorkloadKind.STATEFUL_SET)
                .name(statefulSet.getMetadata().getName())
                .namespace(statefulSet.getMetadata().getNamespace())
                .replicas(statefulSet.getSpec() != null ? statefulSet.getSpec().getReplicas() : null)
                .containers(statefulSet.getSpec() != null
                        ? ContainerResourcesConverter.fromTemplate(statefulSet.getSpec().getTemplate())
                        : List.of())
                .build();
    }

    @Override
    public WorkloadKind getKind() {
        return WorkloadKind.STATEFUL_SET;
    }
}
