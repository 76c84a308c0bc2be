package com.vibecoding.k8scapacity.datasource;

import com.vibecoding.k8scapacity.exception.ClusterAccessException;
import com.vibecoding.k8scapacity.exception.DataFetchException;
import com.vibecoding.k8scapacity.fetcher.ContainerResourcesConverter;
import com.vibecoding.k8scapacity.fetcher.WorkloadFetcher;
import com.vibecoding.k8scapacity.model.ClusterIdentity;
import com.vibecoding.k8scapacity.model.NodeObject;
import com.vibecoding.k8scapacity.model.NodeUsageSample;
import com.vibecoding.k8scapacity.model.PodObject;
import com.vibecoding.k8scapacity.model.PodUsageSample;
import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.ContainerMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.NodeMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * fabric8 KubernetesClient 기반 클러스터 데이터 조회
 */
@Service
@RequiredArgsConstructor
public class Fabric8ClusterDataSource implements ClusterDataSource {

    private static final Logger log = LoggerFactory.getLogger(Fabric8ClusterDataSource.class);

    private final KubernetesClient client;
    private final List<WorkloadFetcher> fetchers;

    @Override
    public ClusterIdentity verifyAccess() {
        try {
            VersionInfo version = client.getKubernetesVersion();
            String server = client.getMasterUrl() != null ? client.getMasterUrl().toString() : null;
            log.info("Connected to cluster {} (version {})", server, version.getGitVersion());
            return new ClusterIdentity(server, version.getGitVersion());
        } catch (KubernetesClientException e) {
            log.error("Failed to reach cluster", e);
            if (e.getCode() == 401 || e.getCode() == 403) {
                throw new ClusterAccessException("Not authenticated against the cluster: " + e.getMessage(), e);
            }
            throw new ClusterAccessException("Cannot reach the cluster: " + e.getMessage(), e);
        }
    }

    // ========== Namespace ==========

    @Override
    public List<String> listNamespaces() {
        try {
            return client.namespaces().list().getItems()
                .stream()
                .map(ns -> ns.getMetadata().getName())
                .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            log.error("Failed to list namespaces", e);
            throw new ClusterAccessException("Cannot list namespaces: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean namespaceExists(String namespace) {
        try {
            return client.namespaces().withName(namespace).get() != null;
        } catch (KubernetesClientException e) {
            // 권한이 없으면 존재하지 않는 것과 같이 취급
            log.warn("Cannot read namespace {}: {}", namespace, e.getMessage());
            return false;
        }
    }

    // ========== Workload ==========

    @Override
    public List<WorkloadObject> listWorkloads(String namespace, Set<WorkloadKind> kinds) {
        List<WorkloadObject> workloads = new ArrayList<>();
        for (WorkloadFetcher fetcher : fetchers) {
            if (kinds.stream().noneMatch(fetcher::canFetch)) {
                continue;
            }
            try {
                workloads.addAll(fetcher.fetch(client, namespace));
            } catch (KubernetesClientException e) {
                log.error("Failed to list {} in namespace: {}", fetcher.getKind().getKindName(), namespace, e);
                throw new DataFetchException(namespace,
                    "Failed to list " + fetcher.getKind().getKindName() + ": " + describe(e), e);
            }
        }
        return workloads;
    }

    // ========== Pod ==========

    @Override
    public List<PodObject> listPods(String namespace, Set<String> phases) {
        try {
            List<Pod> pods;
            if (phases.size() == 1) {
                String phase = phases.iterator().next();
                pods = namespace != null
                    ? client.pods().inNamespace(namespace).withField("status.phase", phase).list().getItems()
                    : client.pods().inAnyNamespace().withField("status.phase", phase).list().getItems();
            } else {
                pods = namespace != null
                    ? client.pods().inNamespace(namespace).list().getItems()
                    : client.pods().inAnyNamespace().list().getItems();
            }
            return pods.stream()
                .map(Fabric8ClusterDataSource::toPodObject)
                .filter(pod -> phases.isEmpty() || phases.contains(pod.getPhase()))
                .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            String scope = namespace != null ? namespace : "all namespaces";
            log.error("Failed to list pods in {}", scope, e);
            throw new DataFetchException(scope, "Failed to list pods: " + describe(e), e);
        }
    }

    // ========== Node ==========

    @Override
    public List<NodeObject> listNodes() {
        try {
            return client.nodes().list().getItems()
                .stream()
                .map(Fabric8ClusterDataSource::toNodeObject)
                .collect(Collectors.toList());
        } catch (KubernetesClientException e) {
            log.error("Failed to list nodes", e);
            throw new DataFetchException("nodes", "Failed to list nodes: " + describe(e), e);
        }
    }

    // ========== Metrics ==========

    @Override
    public Optional<List<PodUsageSample>> topPods(String namespace) {
        try {
            List<PodMetrics> metrics = client.top().pods().inNamespace(namespace).metrics().getItems();
            List<PodUsageSample> samples = new ArrayList<>();
            for (PodMetrics pod : metrics) {
                samples.addAll(toUsageSamples(pod));
            }
            return Optional.of(samples);
        } catch (KubernetesClientException e) {
            // metrics-server 미설치(404/503) 포함, 실사용량 없이 계속 진행
            log.warn("Metrics not available for {}: {}", namespace, describe(e));
            return Optional.empty();
        }
    }

    @Override
    public Optional<List<NodeUsageSample>> topNodes() {
        try {
            return Optional.of(client.top().nodes().metrics().getItems()
                .stream()
                .map(Fabric8ClusterDataSource::toNodeUsageSample)
                .collect(Collectors.toList()));
        } catch (KubernetesClientException e) {
            log.warn("Node metrics not available: {}", describe(e));
            return Optional.empty();
        }
    }

    static NodeUsageSample toNodeUsageSample(NodeMetrics node) {
        return new NodeUsageSample(
            node.getMetadata().getName(),
            ContainerResourcesConverter.quantity(node.getUsage(), ContainerResourcesConverter.CPU),
            ContainerResourcesConverter.quantity(node.getUsage(), ContainerResourcesConverter.MEMORY));
    }

    static PodObject toPodObject(Pod pod) {
        return PodObject.builder()
            .name(pod.getMetadata().getName())
            .namespace(pod.getMetadata().getNamespace())
            .phase(pod.getStatus() != null ? pod.getStatus().getPhase() : null)
            .nodeName(pod.getSpec() != null ? pod.getSpec().getNodeName() : null)
            .containers(pod.getSpec() != null
                ? ContainerResourcesConverter.fromContainers(pod.getSpec().getContainers())
                : Collections.emptyList())
            .build();
    }

    static NodeObject toNodeObject(Node node) {
        NodeObject.NodeObjectBuilder builder = NodeObject.builder().name(node.getMetadata().getName());
        if (node.getStatus() != null) {
            builder.capacityMemory(ContainerResourcesConverter.quantity(node.getStatus().getCapacity(), ContainerResourcesConverter.MEMORY))
                .capacityCpu(ContainerResourcesConverter.quantity(node.getStatus().getCapacity(), ContainerResourcesConverter.CPU))
                .allocatableMemory(ContainerResourcesConverter.quantity(node.getStatus().getAllocatable(), ContainerResourcesConverter.MEMORY))
                .allocatableCpu(ContainerResourcesConverter.quantity(node.getStatus().getAllocatable(), ContainerResourcesConverter.CPU));
        }
        return builder.build();
    }

    /**
     * 컨테이너마다 한 줄. 병합 시 합산되므로 Pod 단위 합과 같다.
     */
    static List<PodUsageSample> toUsageSamples(PodMetrics pod) {
        List<PodUsageSample> samples = new ArrayList<>();
        if (pod.getContainers() == null) {
            return samples;
        }
        for (ContainerMetrics container : pod.getContainers()) {
            samples.add(new PodUsageSample(
                pod.getMetadata().getName(),
                ContainerResourcesConverter.quantity(container.getUsage(), ContainerResourcesConverter.CPU),
                ContainerResourcesConverter.quantity(container.getUsage(), ContainerResourcesConverter.MEMORY)));
        }
        return samples;
    }

    private static String describe(KubernetesClientException e) {
        return e.getCode() != 0 ? "HTTP " + e.getCode() + " " + e.getMessage() : e.getMessage();
    }
}
