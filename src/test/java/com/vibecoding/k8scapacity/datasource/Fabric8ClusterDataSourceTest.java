package com.vibecoding.k8scapacity.datasource;

import com.vibecoding.k8scapacity.exception.ClusterAccessException;
import com.vibecoding.k8scapacity.exception.DataFetchException;
import com.vibecoding.k8scapacity.fetcher.WorkloadFetcher;
import com.vibecoding.k8scapacity.model.ClusterIdentity;
import com.vibecoding.k8scapacity.model.NodeObject;
import com.vibecoding.k8scapacity.model.NodeUsageSample;
import com.vibecoding.k8scapacity.model.PodObject;
import com.vibecoding.k8scapacity.model.PodUsageSample;
import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.NodeMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.NodeMetricsBuilder;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetricsBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Fabric8ClusterDataSourceTest {

    private KubernetesClient client;
    private WorkloadFetcher deployments;
    private WorkloadFetcher daemonSets;
    private Fabric8ClusterDataSource dataSource;

    @BeforeEach
    void setUp() {
        client = mock(KubernetesClient.class);
        deployments = fetcher(WorkloadKind.DEPLOYMENT);
        daemonSets = fetcher(WorkloadKind.DAEMON_SET);
        dataSource = new Fabric8ClusterDataSource(client, List.of(deployments, daemonSets));
    }

    private static WorkloadFetcher fetcher(WorkloadKind kind) {
        WorkloadFetcher fetcher = mock(WorkloadFetcher.class);
        when(fetcher.getKind()).thenReturn(kind);
        when(fetcher.canFetch(any())).thenAnswer(invocation -> invocation.getArgument(0) == kind);
        return fetcher;
    }

    @Test
    void convertsPod() {
        Pod pod = new PodBuilder()
                .withNewMetadata().withName("web-0").withNamespace("team-a").endMetadata()
                .withNewSpec()
                    .withNodeName("worker-1")
                    .addNewInitContainer().withName("init").endInitContainer()
                    .addNewContainer()
                        .withName("app")
                        .withNewResources().addToRequests("memory", new Quantity("256Mi")).endResources()
                    .endContainer()
                .endSpec()
                .withNewStatus().withPhase("Running").endStatus()
                .build();

        PodObject converted = Fabric8ClusterDataSource.toPodObject(pod);

        assertThat(converted.getPhase()).isEqualTo(PodObject.PHASE_RUNNING);
        assertThat(converted.isScheduled()).isTrue();
        assertThat(converted.getContainers()).hasSize(1);
        assertThat(converted.getContainers().get(0).getMemoryRequest()).isEqualTo("256Mi");
    }

    @Test
    void pendingPodHasNoNode() {
        Pod pod = new PodBuilder()
                .withNewMetadata().withName("waiting").withNamespace("team-a").endMetadata()
                .withNewSpec().addNewContainer().withName("app").endContainer().endSpec()
                .withNewStatus().withPhase("Pending").endStatus()
                .build();

        assertThat(Fabric8ClusterDataSource.toPodObject(pod).isScheduled()).isFalse();
    }

    @Test
    void convertsNodeCapacity() {
        Node node = new NodeBuilder()
                .withNewMetadata().withName("worker-1").endMetadata()
                .withNewStatus()
                    .addToCapacity("memory", new Quantity("16393200Ki"))
                    .addToCapacity("cpu", new Quantity("4"))
                    .addToAllocatable("memory", new Quantity("15241200Ki"))
                    .addToAllocatable("cpu", new Quantity("3500m"))
                .endStatus()
                .build();

        NodeObject converted = Fabric8ClusterDataSource.toNodeObject(node);

        assertThat(converted.getName()).isEqualTo("worker-1");
        assertThat(converted.getCapacityMemory()).isEqualTo("16393200Ki");
        assertThat(converted.getAllocatableMemory()).isEqualTo("15241200Ki");
        assertThat(converted.getAllocatableCpu()).isEqualTo("3500m");
    }

    @Test
    void usageSamplesArePerContainer() {
        PodMetrics metrics = new PodMetricsBuilder()
                .withNewMetadata().withName("web-0").withNamespace("team-a").endMetadata()
                .addNewContainer().withName("app")
                    .addToUsage("cpu", new Quantity("12m")).addToUsage("memory", new Quantity("180Mi"))
                .endContainer()
                .addNewContainer().withName("proxy")
                    .addToUsage("cpu", new Quantity("3m")).addToUsage("memory", new Quantity("20Mi"))
                .endContainer()
                .build();

        List<PodUsageSample> samples = Fabric8ClusterDataSource.toUsageSamples(metrics);

        assertThat(samples).containsExactly(
                new PodUsageSample("web-0", "12m", "180Mi"),
                new PodUsageSample("web-0", "3m", "20Mi"));
    }

    @Test
    void onlyRequestedKindsAreFetched() {
        WorkloadObject api = WorkloadObject.builder().kind(WorkloadKind.DEPLOYMENT).name("api").namespace("team-a").build();
        when(deployments.fetch(client, "team-a")).thenReturn(List.of(api));

        List<WorkloadObject> workloads = dataSource.listWorkloads("team-a", EnumSet.of(WorkloadKind.DEPLOYMENT));

        assertThat(workloads).containsExactly(api);
        verify(daemonSets, never()).fetch(any(), any());
    }

    @Test
    void workloadListingFailureNamesTheNamespace() {
        when(deployments.fetch(client, "locked"))
                .thenThrow(new KubernetesClientException("forbidden", 403, null));

        assertThatThrownBy(() -> dataSource.listWorkloads("locked", EnumSet.of(WorkloadKind.DEPLOYMENT)))
                .isInstanceOf(DataFetchException.class)
                .hasMessageContaining("403")
                .extracting(e -> ((DataFetchException) e).getEntity())
                .isEqualTo("locked");
    }

    @Test
    void verifyAccessReturnsClusterIdentity() throws Exception {
        VersionInfo version = mock(VersionInfo.class);
        when(version.getGitVersion()).thenReturn("v1.28.3");
        when(client.getKubernetesVersion()).thenReturn(version);
        when(client.getMasterUrl()).thenReturn(new URL("https://api.example:6443/"));

        ClusterIdentity identity = dataSource.verifyAccess();

        assertThat(identity.getServerUrl()).isEqualTo("https://api.example:6443/");
        assertThat(identity.getVersion()).isEqualTo("v1.28.3");
    }

    @Test
    void unauthenticatedClusterIsFatal() {
        when(client.getKubernetesVersion()).thenThrow(new KubernetesClientException("Unauthorized", 401, null));

        assertThatThrownBy(() -> dataSource.verifyAccess())
                .isInstanceOf(ClusterAccessException.class)
                .hasMessageContaining("Not authenticated");
    }

    @Test
    void namespaceListingFailureIsFatal() {
        when(client.namespaces()).thenThrow(new KubernetesClientException("connection refused"));

        assertThatThrownBy(() -> dataSource.listNamespaces()).isInstanceOf(ClusterAccessException.class);
        assertThat(dataSource.namespaceExists("team-a")).isFalse();
    }

    @Test
    void podAndNodeListingFailuresAreDataFetchErrors() {
        when(client.pods()).thenThrow(new KubernetesClientException("forbidden", 403, null));
        when(client.nodes()).thenThrow(new KubernetesClientException("forbidden", 403, null));

        assertThatThrownBy(() -> dataSource.listPods(null, Set.of(PodObject.PHASE_RUNNING)))
                .isInstanceOf(DataFetchException.class)
                .extracting(e -> ((DataFetchException) e).getEntity())
                .isEqualTo("all namespaces");
        assertThatThrownBy(() -> dataSource.listNodes()).isInstanceOf(DataFetchException.class);
    }

    @Test
    void missingMetricsApiIsUnavailable() {
        when(client.top()).thenThrow(new KubernetesClientException("the server could not find the requested resource", 404, null));

        assertThat(dataSource.topPods("team-a")).isEmpty();
    }

    @Test
    void convertsNodeMetrics() {
        NodeMetrics metrics = new NodeMetricsBuilder()
                .withNewMetadata().withName("worker-1").endMetadata()
                .addToUsage("cpu", new Quantity("2500m"))
                .addToUsage("memory", new Quantity("4194304Ki"))
                .build();

        assertThat(Fabric8ClusterDataSource.toNodeUsageSample(metrics))
                .isEqualTo(new NodeUsageSample("worker-1", "2500m", "4194304Ki"));
    }

    @Test
    void missingNodeMetricsApiIsUnavailable() {
        when(client.top()).thenThrow(new KubernetesClientException("service unavailable", 503, null));

        assertThat(dataSource.topNodes()).isEmpty();
    }
}
