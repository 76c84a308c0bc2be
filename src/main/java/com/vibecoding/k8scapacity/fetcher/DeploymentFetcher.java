package com.vibecoding.k8scapacity.fetcher;

import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Deployment 조회기
 */
@Component
public class DeploymentFetcher implements WorkloadFetcher {

    @Override
    public boolean canFetch(WorkloadKind kind) {
        return kind == WorkloadKind.DEPLOYMENT;
    }

    @Override
    public List<WorkloadObject> fetch(KubernetesClient client, String namespace) {
        return client.apps().deployments()
            .inNamespace(namespace)
            .list()
            .getItems()
            .stream()
            .map(DeploymentFetcher::toWorkload)
            .collect(Collectors.toList());
    }

    static WorkloadObject toWorkload(Deployment deployment) {
        return WorkloadObject.builder()
                .kind(WorkloadKind.DEPLOYMENT)
                .name(deployment.getMetadata().getName())
                .namespace(deployment.getMetadata().getNamespace())
                .replicas(deployment.getSpec() != null ? deployment.getSpec().getReplicas() : null)
                .containers(deployment.getSpec() != null
                        ? ContainerResourcesConverter.fromTemplate(deployment.getSpec().getTemplate())
                        : List.of())
                .build();
    }

    @Override
    public WorkloadKind getKind() {
        return WorkloadKind.DEPLOYMENT;
    }
}
