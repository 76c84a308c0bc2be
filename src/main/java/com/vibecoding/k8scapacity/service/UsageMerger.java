package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.model.ActualUsage;
import com.vibecoding.k8scapacity.model.BareNumberConvention;
import com.vibecoding.k8scapacity.model.NamespaceTotals;
import com.vibecoding.k8scapacity.model.NodeAccounting;
import com.vibecoding.k8scapacity.model.NodeUsageSample;
import com.vibecoding.k8scapacity.model.PodUsageSample;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * metrics-server 실사용 스냅샷을 선언된 리소스 합계에 병합
 */
@Component
@RequiredArgsConstructor
public class UsageMerger {

    private static final Logger log = LoggerFactory.getLogger(UsageMerger.class);

    private final QuantityParser quantityParser;

    /**
     * 스냅샷이 없거나 유효한 줄이 하나도 없으면 "측정 불가"(actualUsage == null)로 남긴다.
     */
    public NamespaceTotals merge(NamespaceTotals totals, Optional<List<PodUsageSample>> snapshot,
                                 BareNumberConvention memoryConvention) {
        if (totals.hasError()) {
            return totals;
        }
        Optional<ActualUsage> usage = summarize(totals.getNamespace(), snapshot, memoryConvention);
        return totals.withActualUsage(usage.orElse(null));
    }

    /**
     * 샘플 합산. 파싱할 수 없는 줄은 건너뛴다.
     */
    public Optional<ActualUsage> summarize(String namespace, Optional<List<PodUsageSample>> snapshot,
                                           BareNumberConvention memoryConvention) {
        if (snapshot.isEmpty()) {
            log.debug("No usage snapshot for {}", namespace);
            return Optional.empty();
        }

        double cpu = 0.0;
        double memory = 0.0;
        int parsed = 0;
        for (PodUsageSample sample : snapshot.get()) {
            OptionalDouble sampleCpu = quantityParser.tryParseCpu(sample.getCpu());
            OptionalDouble sampleMemory = quantityParser.tryParseMemory(sample.getMemory(), memoryConvention);
            if (sampleCpu.isEmpty() || sampleMemory.isEmpty()) {
                log.debug("Skipping unparseable usage sample for pod {} in {}: cpu='{}', memory='{}'",
                        sample.getPodName(), namespace, sample.getCpu(), sample.getMemory());
                continue;
            }
            cpu += sampleCpu.getAsDouble();
            memory += sampleMemory.getAsDouble();
            parsed++;
        }

        if (parsed == 0) {
            log.debug("Usage snapshot for {} has no valid samples, treating as unavailable", namespace);
            return Optional.empty();
        }
        return Optional.of(new ActualUsage(cpu, memory));
    }

    /**
     * 노드 메트릭 병합. 스냅샷이 없거나 해당 노드 샘플이 없거나 파싱할 수 없으면 그 노드는 측정 불가로 남는다.
     */
    public List<NodeAccounting> mergeNodes(List<NodeAccounting> nodes, Optional<List<NodeUsageSample>> snapshot,
                                           BareNumberConvention memoryConvention) {
        if (snapshot.isEmpty()) {
            log.debug("No node usage snapshot");
            return nodes;
        }

        Map<String, ActualUsage> byNode = new HashMap<>();
        for (NodeUsageSample sample : snapshot.get()) {
            OptionalDouble cpu = quantityParser.tryParseCpu(sample.getCpu());
            OptionalDouble memory = quantityParser.tryParseMemory(sample.getMemory(), memoryConvention);
            if (cpu.isEmpty() || memory.isEmpty()) {
                log.debug("Skipping unparseable usage sample for node {}: cpu='{}', memory='{}'",
                        sample.getNodeName(), sample.getCpu(), sample.getMemory());
                continue;
            }
            byNode.put(sample.getNodeName(), new ActualUsage(cpu.getAsDouble(), memory.getAsDouble()));
        }

        List<NodeAccounting> merged = new ArrayList<>();
        for (NodeAccounting node : nodes) {
            merged.add(node.withActualUsage(byNode.get(node.getNodeName())));
        }
        return merged;
    }

    /**
     * "top pods --no-headers" 출력(NAME CPU MEMORY)을 샘플로 변환. 컬럼이 부족한 줄은 버린다.
     */
    public static List<PodUsageSample> parseTopLines(String output) {
        List<PodUsageSample> samples = new ArrayList<>();
        if (output == null) {
            return samples;
        }
        for (String line : output.strip().split("\\R")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 3) {
                continue;
            }
            samples.add(new PodUsageSample(parts[0], parts[1], parts[2]));
        }
        return samples;
    }
}
