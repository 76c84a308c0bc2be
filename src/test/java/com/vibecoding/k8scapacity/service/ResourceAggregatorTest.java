package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.model.ActualUsage;
import com.vibecoding.k8scapacity.model.BareNumberConvention;
import com.vibecoding.k8scapacity.model.ContainerResources;
import com.vibecoding.k8scapacity.model.NamespaceTotals;
import com.vibecoding.k8scapacity.model.PodObject;
import com.vibecoding.k8scapacity.model.WorkloadAccounting;
import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceAggregatorTest {

    private final WorkloadResourceExtractor extractor = new WorkloadResourceExtractor(new QuantityParser());
    private final ResourceAggregator aggregator = new ResourceAggregator(extractor);

    private static PodObject pod(String name, ContainerResources... containers) {
        return PodObject.builder()
                .name(name)
                .namespace("team-a")
                .phase(PodObject.PHASE_RUNNING)
                .nodeName("worker-1")
                .containers(List.of(containers))
                .build();
    }

    @Test
    void sumsContainersOfOnePod() {
        PodObject pod = pod("web-0",
                ContainerResources.builder().name("a").cpuRequest("500m").memoryRequest("256Mi").build(),
                ContainerResources.builder().name("b").cpuRequest("0.5").memoryRequest("1Gi").build());

        NamespaceTotals totals = aggregator.aggregatePods("team-a", List.of(pod), BareNumberConvention.BYTES);

        assertThat(totals.getRunningPods()).isEqualTo(1);
        assertThat(totals.getCpuRequestMillis()).isEqualTo(1000.0);
        assertThat(totals.getMemoryRequestMib()).isEqualTo(1280.0);
        assertThat(totals.getPodsWithoutRequests()).isZero();
        assertThat(totals.hasError()).isFalse();
    }

    @Test
    void countsPodsWithoutRequestsOncePerPod() {
        PodObject bare = pod("bare-0",
                ContainerResources.builder().name("a").cpuLimit("1").build(),
                ContainerResources.builder().name("b").build());
        PodObject declared = pod("web-0",
                ContainerResources.builder().name("a").memoryRequest("128Mi").build());

        NamespaceTotals totals = aggregator.aggregatePods("team-a", List.of(bare, declared), BareNumberConvention.BYTES);

        assertThat(totals.getRunningPods()).isEqualTo(2);
        assertThat(totals.getPodsWithoutRequests()).isEqualTo(1);
        assertThat(totals.getCpuLimitMillis()).isEqualTo(1000.0);
    }

    @Test
    void aggregatingTheSameWorkloadsTwiceIsIdempotent() {
        List<WorkloadAccounting> workloads = List.of(
                extractor.extract(workload("api", WorkloadKind.DEPLOYMENT, 2), BareNumberConvention.MEBIBYTES),
                extractor.extract(workload("db", WorkloadKind.STATEFUL_SET, 1), BareNumberConvention.MEBIBYTES));

        NamespaceTotals first = aggregator.aggregateWorkloads("team-a", workloads);
        NamespaceTotals second = aggregator.aggregateWorkloads("team-a", workloads);

        assertThat(first).isEqualTo(second);
        assertThat(first.getRunningPods()).isEqualTo(3);
        assertThat(first.getCpuRequestMillis()).isEqualTo(300.0);
    }

    @Test
    void skippedAndScaledDownWorkloadsAreNotSummed() {
        List<WorkloadAccounting> workloads = List.of(
                extractor.extract(workload("api", WorkloadKind.DEPLOYMENT, 2), BareNumberConvention.MEBIBYTES),
                extractor.extract(workload("idle", WorkloadKind.DEPLOYMENT, 0), BareNumberConvention.MEBIBYTES),
                extractor.extract(workload("agent", WorkloadKind.DAEMON_SET, 10), BareNumberConvention.MEBIBYTES));

        NamespaceTotals totals = aggregator.aggregateWorkloads("team-a", workloads);

        assertThat(totals.getRunningPods()).isEqualTo(2);
        assertThat(totals.getCpuRequestMillis()).isEqualTo(200.0);
        assertThat(totals.getMemoryRequestMib()).isEqualTo(256.0);
    }

    @Test
    void grandTotalSkipsFailedNamespaces() {
        NamespaceTotals ok = NamespaceTotals.builder()
                .namespace("team-a").runningPods(2).cpuRequestMillis(500).memoryRequestMib(1024)
                .actualUsage(new ActualUsage(100, 200))
                .build();
        NamespaceTotals other = NamespaceTotals.builder()
                .namespace("team-b").runningPods(1).cpuRequestMillis(250).memoryRequestMib(512)
                .build();
        NamespaceTotals failed = aggregator.failed("locked", "HTTP 403 Forbidden");

        NamespaceTotals total = aggregator.grandTotal("TOTAL", List.of(ok, other, failed));

        assertThat(failed.getCpuRequestMillis()).isZero();
        assertThat(failed.getRunningPods()).isZero();
        assertThat(total.getNamespace()).isEqualTo("TOTAL");
        assertThat(total.getRunningPods()).isEqualTo(3);
        assertThat(total.getCpuRequestMillis()).isEqualTo(750.0);
        assertThat(total.getMemoryRequestMib()).isEqualTo(1536.0);
        assertThat(total.getActualUsage()).isEqualTo(new ActualUsage(100, 200));
        assertThat(total.hasError()).isFalse();
    }

    @Test
    void grandTotalHasNoActualUsageWhenNothingWasMeasured() {
        NamespaceTotals total = aggregator.grandTotal("TOTAL", List.of(
                NamespaceTotals.builder().namespace("team-a").runningPods(1).build()));

        assertThat(total.findActualUsage()).isEmpty();
    }

    private static WorkloadObject workload(String name, WorkloadKind kind, int replicas) {
        return WorkloadObject.builder()
                .kind(kind)
                .name(name)
                .namespace("team-a")
                .replicas(replicas)
                .container(ContainerResources.builder()
                        .name("main").cpuRequest("100m").memoryRequest("128Mi").build())
                .build();
    }
}
