package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.model.ActualUsage;
import com.vibecoding.k8scapacity.model.BareNumberConvention;
import com.vibecoding.k8scapacity.model.ContainerResources;
import com.vibecoding.k8scapacity.model.NodeAccounting;
import com.vibecoding.k8scapacity.model.NodeAnalysis;
import com.vibecoding.k8scapacity.model.NodeObject;
import com.vibecoding.k8scapacity.model.PodObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NodeCapacityAnalyzerTest {

    private final QuantityParser parser = new QuantityParser();
    private final NodeCapacityAnalyzer analyzer =
            new NodeCapacityAnalyzer(parser, new WorkloadResourceExtractor(parser));

    private static NodeObject node(String name, String allocatable) {
        return NodeObject.builder()
                .name(name)
                .capacityMemory("17Gi")
                .allocatableMemory(allocatable)
                .capacityCpu("4")
                .allocatableCpu("4")
                .build();
    }

    private static PodObject pod(String name, String phase, String nodeName, String memoryRequest) {
        return PodObject.builder()
                .name(name)
                .namespace("team-a")
                .phase(phase)
                .nodeName(nodeName)
                .container(ContainerResources.builder()
                        .name("main")
                        .cpuRequest("500m")
                        .memoryRequest(memoryRequest)
                        .memoryLimit("3Gi")
                        .build())
                .build();
    }

    @Test
    void attributesRequestsOfScheduledPodsToTheirNode() {
        NodeAnalysis analysis = analyzer.analyze(
                List.of(node("worker-1", "16Gi")),
                List.of(pod("a", PodObject.PHASE_RUNNING, "worker-1", "2Gi"),
                        pod("b", PodObject.PHASE_RUNNING, "worker-1", "2Gi")),
                BareNumberConvention.MEBIBYTES);

        NodeAccounting node = analysis.getNodes().get(0);
        assertThat(node.getCommittedMib()).isEqualTo(4096.0);
        assertThat(node.getFreeReserveMib()).isEqualTo(12288.0);
        assertThat(node.getUtilizationPct()).isEqualTo(25.0);
        assertThat(node.getCapacityMib()).isEqualTo(17408.0);
        assertThat(node.getMemoryLimitsMib()).isEqualTo(6144.0);
        assertThat(node.getCommittedCpuMillis()).isEqualTo(1000.0);
        assertThat(node.getCpuUtilizationPct()).isEqualTo(25.0);
        assertThat(node.getPodCount()).isEqualTo(2);
    }

    @Test
    void pendingPodsOnANodeAlsoReserveCapacity() {
        NodeAnalysis analysis = analyzer.analyze(
                List.of(node("worker-1", "8Gi")),
                List.of(pod("a", PodObject.PHASE_PENDING, "worker-1", "1Gi"),
                        pod("done", "Succeeded", "worker-1", "4Gi")),
                BareNumberConvention.MEBIBYTES);

        assertThat(analysis.getNodes().get(0).getCommittedMib()).isEqualTo(1024.0);
    }

    @Test
    void unscheduledAndUnmatchedPodsAreCountedNotAttributed() {
        NodeAnalysis analysis = analyzer.analyze(
                List.of(node("worker-1", "8Gi")),
                List.of(pod("waiting", PodObject.PHASE_PENDING, null, "1Gi"),
                        pod("orphan", PodObject.PHASE_RUNNING, "gone-node", "1Gi")),
                BareNumberConvention.MEBIBYTES);

        assertThat(analysis.getUnscheduledPods()).isEqualTo(1);
        assertThat(analysis.getUnmatchedPods()).isEqualTo(1);
        assertThat(analysis.getNodes().get(0).getCommittedMib()).isZero();
    }

    @Test
    void overcommittedNodeHasNegativeFreeReserve() {
        NodeAnalysis analysis = analyzer.analyze(
                List.of(node("small", "2Gi")),
                List.of(pod("big", PodObject.PHASE_RUNNING, "small", "3Gi")),
                BareNumberConvention.MEBIBYTES);

        NodeAccounting node = analysis.getNodes().get(0);
        assertThat(node.getFreeReserveMib()).isEqualTo(-1024.0);
        assertThat(node.getUtilizationPct()).isEqualTo(150.0);
    }

    @Test
    void zeroAllocatableGivesZeroPercent() {
        NodeAnalysis analysis = analyzer.analyze(List.of(node("broken", "")), List.of(), BareNumberConvention.MEBIBYTES);

        assertThat(analysis.getNodes().get(0).getUtilizationPct()).isZero();
    }

    @Test
    void totalRecomputesPercentagesFromSums() {
        NodeAccounting a = NodeAccounting.builder().nodeName("a").allocatableMib(1000).committedMib(900).podCount(3).build();
        NodeAccounting b = NodeAccounting.builder().nodeName("b").allocatableMib(3000).committedMib(100).podCount(1).build();

        NodeAccounting total = analyzer.total("TOTAL", List.of(a, b));

        assertThat(total.getAllocatableMib()).isEqualTo(4000.0);
        assertThat(total.getCommittedMib()).isEqualTo(1000.0);
        assertThat(total.getUtilizationPct()).isEqualTo(25.0);
        assertThat(total.getPodCount()).isEqualTo(4);
    }

    @Test
    void sumsCpuLimitsPerNodeAndInTotal() {
        PodObject limited = PodObject.builder()
                .name("limited")
                .namespace("team-a")
                .phase(PodObject.PHASE_RUNNING)
                .nodeName("worker-1")
                .container(ContainerResources.builder().name("app").cpuRequest("250m").cpuLimit("1500m").build())
                .container(ContainerResources.builder().name("proxy").cpuLimit("0.5").build())
                .build();

        NodeAnalysis analysis = analyzer.analyze(
                List.of(node("worker-1", "8Gi"), node("worker-2", "8Gi")),
                List.of(limited, pod("other", PodObject.PHASE_RUNNING, "worker-2", "1Gi")),
                BareNumberConvention.MEBIBYTES);

        assertThat(analysis.getNodes().get(0).getCpuLimitsMillis()).isEqualTo(2000.0);
        assertThat(analysis.getNodes().get(0).getCommittedCpuMillis()).isEqualTo(250.0);
        assertThat(analysis.getNodes().get(1).getCpuLimitsMillis()).isZero();
        assertThat(analyzer.total("TOTAL", analysis.getNodes()).getCpuLimitsMillis()).isEqualTo(2000.0);
    }

    @Test
    void totalSumsActualUsageOnlyWhereMeasured() {
        NodeAccounting measured = NodeAccounting.builder().nodeName("a").actualUsage(new ActualUsage(300, 2048)).build();
        NodeAccounting unmeasured = NodeAccounting.builder().nodeName("b").build();

        assertThat(analyzer.total("TOTAL", List.of(measured, unmeasured)).getActualUsage())
                .isEqualTo(new ActualUsage(300, 2048));
        assertThat(analyzer.total("TOTAL", List.of(unmeasured)).getActualUsage()).isNull();
    }
}
