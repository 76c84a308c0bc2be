package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.model.ActualUsage;
import com.vibecoding.k8scapacity.model.BareNumberConvention;
import com.vibecoding.k8scapacity.model.NodeAccounting;
import com.vibecoding.k8scapacity.model.NodeAnalysis;
import com.vibecoding.k8scapacity.model.NodeObject;
import com.vibecoding.k8scapacity.model.PodObject;
import com.vibecoding.k8scapacity.model.PodResourceProfile;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 노드별 allocatable 대비 예약된(requests) 메모리/CPU 계산
 */
@Component
@RequiredArgsConstructor
public class NodeCapacityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(NodeCapacityAnalyzer.class);

    private final QuantityParser quantityParser;
    private final WorkloadResourceExtractor extractor;

    /**
     * Running/Pending 상태이면서 노드가 배정된 Pod의 requests를 해당 노드에 더한다.
     */
    public NodeAnalysis analyze(List<NodeObject> nodes, List<PodObject> pods, BareNumberConvention memoryConvention) {
        Map<String, NodeAccounting> byName = new LinkedHashMap<>();
        for (NodeObject node : nodes) {
            byName.put(node.getName(), NodeAccounting.builder()
                    .nodeName(node.getName())
                    .capacityMib(quantityParser.parseMemory(node.getCapacityMemory(), memoryConvention))
                    .allocatableMib(quantityParser.parseMemory(node.getAllocatableMemory(), memoryConvention))
                    .allocatableCpuMillis(quantityParser.parseCpu(node.getAllocatableCpu()))
                    .build());
        }

        int unmatched = 0;
        int unscheduled = 0;
        for (PodObject pod : pods) {
            if (!pod.isRunningOrPending()) {
                continue;
            }
            if (!pod.isScheduled()) {
                // 아직 스케줄되지 않은 Pod은 노드 자원을 예약하지 않는다
                unscheduled++;
                continue;
            }
            NodeAccounting node = byName.get(pod.getNodeName());
            if (node == null) {
                unmatched++;
                continue;
            }
            PodResourceProfile profile = extractor.profile(pod.getContainers(), memoryConvention);
            byName.put(pod.getNodeName(), node.toBuilder()
                    .committedMib(node.getCommittedMib() + profile.getMemoryRequestMib())
                    .memoryLimitsMib(node.getMemoryLimitsMib() + profile.getMemoryLimitMib())
                    .committedCpuMillis(node.getCommittedCpuMillis() + profile.getCpuRequestMillis())
                    .cpuLimitsMillis(node.getCpuLimitsMillis() + profile.getCpuLimitMillis())
                    .podCount(node.getPodCount() + 1)
                    .build());
        }

        if (unmatched > 0) {
            log.info("Skipped {} pods assigned to unknown or deleted nodes", unmatched);
        }
        return new NodeAnalysis(new ArrayList<>(byName.values()), unmatched, unscheduled);
    }

    /**
     * 모든 노드 합계 (퍼센트는 합계 기준으로 다시 계산됨). 실사용량은 측정된 노드만 더한다.
     */
    public NodeAccounting total(String label, Collection<NodeAccounting> nodes) {
        NodeAccounting.NodeAccountingBuilder total = NodeAccounting.builder().nodeName(label);
        double capacity = 0.0;
        double allocatable = 0.0;
        double committed = 0.0;
        double limits = 0.0;
        double allocatableCpu = 0.0;
        double committedCpu = 0.0;
        double cpuLimits = 0.0;
        int podCount = 0;
        ActualUsage actual = null;
        for (NodeAccounting node : nodes) {
            capacity += node.getCapacityMib();
            allocatable += node.getAllocatableMib();
            committed += node.getCommittedMib();
            limits += node.getMemoryLimitsMib();
            allocatableCpu += node.getAllocatableCpuMillis();
            committedCpu += node.getCommittedCpuMillis();
            cpuLimits += node.getCpuLimitsMillis();
            podCount += node.getPodCount();
            if (node.getActualUsage() != null) {
                actual = actual == null ? node.getActualUsage() : actual.plus(node.getActualUsage());
            }
        }
        return total
                .capacityMib(capacity)
                .allocatableMib(allocatable)
                .committedMib(committed)
                .memoryLimitsMib(limits)
                .allocatableCpuMillis(allocatableCpu)
                .committedCpuMillis(committedCpu)
                .cpuLimitsMillis(cpuLimits)
                .podCount(podCount)
                .actualUsage(actual)
                .build();
    }
}
