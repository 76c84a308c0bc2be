package com.vibecoding.k8scapacity.fetcher;

import com.vibecoding.k8scapacity.model.ContainerResources;
import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.CustomResourceDefinitionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OpenShift DeploymentConfig 조회기 (apps.openshift.io/v1).
 * OpenShift가 아닌 클러스터(404)에서는 빈 목록을 돌려준다.
 */
@Component
public class DeploymentConfigFetcher implements WorkloadFetcher {

    private static final Logger log = LoggerFactory.getLogger(DeploymentConfigFetcher.class);

    static final CustomResourceDefinitionContext CONTEXT = new CustomResourceDefinitionContext.Builder()
            .withGroup("apps.openshift.io")
            .withVersion("v1")
            .withPlural("deploymentconfigs")
            .withKind("DeploymentConfig")
            .withScope("Namespaced")
            .build();

    @Override
    public boolean canFetch(WorkloadKind kind) {
        return kind == WorkloadKind.DEPLOYMENT_CONFIG;
    }

    @Override
    public List<WorkloadObject> fetch(KubernetesClient client, String namespace) {
        try {
            return client.genericKubernetesResources(CONTEXT)
                .inNamespace(namespace)
                .list()
                .getItems()
                .stream()
                .map(DeploymentConfigFetcher::toWorkload)
                .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                log.debug("DeploymentConfig API not available in {}: {}", namespace, e.getMessage());
                return Collections.emptyList();
            }
            throw e;
        }
    }

    static WorkloadObject toWorkload(GenericKubernetesResource resource) {
        Map<String, Object> spec = map(resource.getAdditionalProperties().get("spec"));
        Map<String, Object> podSpec = map(map(spec.get("template")).get("spec"));

        return WorkloadObject.builder()
                .kind(WorkloadKind.DEPLOYMENT_CONFIG)
                .name(resource.getMetadata().getName())
                .namespace(resource.getMetadata().getNamespace())
                .replicas(spec.get("replicas") instanceof Number ? ((Number) spec.get("replicas")).intValue() : null)
                .containers(containers(podSpec.get("containers")))
                .build();
    }

    private static List<ContainerResources> containers(Object value) {
        List<ContainerResources> result = new ArrayList<>();
        if (!(value instanceof List)) {
            return result;
        }
        for (Object item : (List<?>) value) {
            Map<String, Object> container = map(item);
            Map<String, Object> resources = map(container.get("resources"));
            Map<String, Object> requests = map(resources.get("requests"));
            Map<String, Object> limits = map(resources.get("limits"));
            result.add(ContainerResources.builder()
                    .name(text(container.get("name")))
                    .cpuRequest(text(requests.get(ContainerResourcesConverter.CPU)))
                    .memoryRequest(text(requests.get(ContainerResourcesConverter.MEMORY)))
                    .cpuLimit(text(limits.get(ContainerResourcesConverter.CPU)))
                    .memoryLimit(text(limits.get(ContainerResourcesConverter.MEMORY)))
                    .build());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }

    // JSON에서 cpu: 1 처럼 숫자로 올 수 있음
    private static String text(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    @Override
    public WorkloadKind getKind() {
        return WorkloadKind.DEPLOYMENT_CONFIG;
    }
}
