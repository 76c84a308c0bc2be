package com.vibecoding.k8scapacity.fetcher;

import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import io.fabric8.kubernetes.api.model.apps.DaemonSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * DaemonSet 조회기. spec.replicas가 없으므로 replicas는 항상 null.
 */
@Component
public class DaemonSetFetcher implements WorkloadFetcher {

    @Override
    public boolean canFetch(WorkloadKind kind) {
        return kind == WorkloadKind.DAEMON_SET;
    }

    @Override
    public List<WorkloadObject> fetch(KubernetesClient client, String namespace) {
        return client.apps().daemonSets()
            .inNamespace(namespace)
            .list()
            .getItems()
            .stream()
            .map(DaemonSetFetcher::toWorkload)
            .collect(Collectors.toList());
    }

    static WorkloadObject toWorkload(DaemonSet daemonSet) {
        return WorkloadObject.builder()
                .kind(WorkloadKind.DAEMON_SET)
                .name(daemonSet.getMetadata().getName())
                .namespace(daemonSet.getMetadata().getNamespace())
                .containers(daemonSet.getSpec() != null
                        ? ContainerResourcesConverter.fromTemplate(daemonSet.getSpec().getTemplate())
                        : List.of())
                .build();
    }

    @Override
    public WorkloadKind getKind() {
        return WorkloadKind.DAEMON_SET;
    }
}
