package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.config.CapacityReportProperties;
import com.vibecoding.k8scapacity.model.MemoryUnit;
import com.vibecoding.k8scapacity.model.NamespaceRow;
import com.vibecoding.k8scapacity.model.NamespaceTotals;
import com.vibecoding.k8scapacity.model.NodeAccounting;
import com.vibecoding.k8scapacity.model.NodeRow;
import com.vibecoding.k8scapacity.model.ReportWarning;
import com.vibecoding.k8scapacity.model.UtilizationLevel;
import com.vibecoding.k8scapacity.model.WarningType;
import com.vibecoding.k8scapacity.model.WorkloadAccounting;
import com.vibecoding.k8scapacity.model.WorkloadRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 전체 정밀도 집계 결과를 표시 단위 리포트 행과 경고로 변환
 */
@Component
@RequiredArgsConstructor
public class ReportAssembler {

    private final CapacityReportProperties properties;

    public NamespaceRow namespaceRow(NamespaceTotals totals, MemoryUnit unit) {
        boolean actualAvailable = totals.getActualUsage() != null;
        return NamespaceRow.builder()
                .namespace(totals.getNamespace())
                .runningPods(totals.getRunningPods())
                .cpuRequestMillis(round2(totals.getCpuRequestMillis()))
                .cpuLimitMillis(round2(totals.getCpuLimitMillis()))
                .memoryRequest(toUnit(totals.getMemoryRequestMib(), unit))
                .memoryLimit(toUnit(totals.getMemoryLimitMib(), unit))
                .actualAvailable(actualAvailable)
                .actualCpuMillis(actualAvailable ? round2(totals.getActualUsage().getCpuMillis()) : null)
                .actualMemory(actualAvailable ? toUnit(totals.getActualUsage().getMemoryMib(), unit) : null)
                .podsWithoutRequests(totals.getPodsWithoutRequests())
                .error(totals.getError())
                .build();
    }

    public WorkloadRow workloadRow(WorkloadAccounting workload, MemoryUnit unit) {
        return WorkloadRow.builder()
                .namespace(workload.getNamespace())
                .kind(workload.getKind().getKindName())
                .name(workload.getName())
                .replicas(workload.getDeclaredReplicas())
                .podCpuRequestMillis(round2(workload.getPerReplicaProfile().getCpuRequestMillis()))
                .podCpuLimitMillis(round2(workload.getPerReplicaProfile().getCpuLimitMillis()))
                .podMemoryRequest(toUnit(workload.getPerReplicaProfile().getMemoryRequestMib(), unit))
                .podMemoryLimit(toUnit(workload.getPerReplicaProfile().getMemoryLimitMib(), unit))
                .totalCpuRequestMillis(round2(workload.getTotalProfile().getCpuRequestMillis()))
                .totalCpuLimitMillis(round2(workload.getTotalProfile().getCpuLimitMillis()))
                .totalMemoryRequest(toUnit(workload.getTotalProfile().getMemoryRequestMib(), unit))
                .totalMemoryLimit(toUnit(workload.getTotalProfile().getMemoryLimitMib(), unit))
                .counted(workload.isCounted())
                .note(workload.getNote())
                .build();
    }

    public NodeRow nodeRow(NodeAccounting node, MemoryUnit unit) {
        double warn = properties.getReport().getWarnThresholdPct();
        double critical = properties.getReport().getCriticalThresholdPct();
        boolean actualAvailable = node.getActualUsage() != null;
        return NodeRow.builder()
                .nodeName(node.getNodeName())
                .podCount(node.getPodCount())
                .capacity(toUnit(node.getCapacityMib(), unit))
                .allocatable(toUnit(node.getAllocatableMib(), unit))
                .committed(toUnit(node.getCommittedMib(), unit))
                .freeReserve(toUnit(node.getFreeReserveMib(), unit))
                .utilizationPct(round2(node.getUtilizationPct()))
                .utilizationLevel(UtilizationLevel.classify(node.getUtilizationPct(), warn, critical))
                .memoryLimits(toUnit(node.getMemoryLimitsMib(), unit))
                .overcommitPct(round2(node.getOvercommitPct()))
                .overcommitLevel(UtilizationLevel.classify(node.getOvercommitPct(), warn, critical))
                .allocatableCpuMillis(round2(node.getAllocatableCpuMillis()))
                .committedCpuMillis(round2(node.getCommittedCpuMillis()))
                .cpuUtilizationPct(round2(node.getCpuUtilizationPct()))
                .cpuUtilizationLevel(UtilizationLevel.classify(node.getCpuUtilizationPct(), warn, critical))
                .cpuLimitsMillis(round2(node.getCpuLimitsMillis()))
                .actualAvailable(actualAvailable)
                .actualCpuMillis(actualAvailable ? round2(node.getActualUsage().getCpuMillis()) : null)
                .actualMemory(actualAvailable ? toUnit(node.getActualUsage().getMemoryMib(), unit) : null)
                .actualMemoryPct(actualAvailable ? round2(node.getActualMemoryPct()) : null)
                .actualCpuPct(actualAvailable ? round2(node.getActualCpuPct()) : null)
                .build();
    }

    /**
     * 실패한 네임스페이스, request 없는 Pod, 측정 불가 네임스페이스 경고
     */
    public List<ReportWarning> namespaceWarnings(List<NamespaceTotals> namespaces, boolean metricsRequested) {
        List<ReportWarning> warnings = new ArrayList<>();
        for (NamespaceTotals namespace : namespaces) {
            if (namespace.hasError()) {
                warnings.add(warning(WarningType.FETCH_FAILED, namespace.getNamespace(), namespace.getError()));
                continue;
            }
            if (namespace.getPodsWithoutRequests() > 0) {
                warnings.add(warning(WarningType.PODS_WITHOUT_REQUESTS, namespace.getNamespace(),
                        namespace.getPodsWithoutRequests() + " pod(s) declare no requests, totals are underestimated"));
            }
            if (metricsRequested && namespace.getActualUsage() == null) {
                warnings.add(warning(WarningType.METRICS_UNAVAILABLE, namespace.getNamespace(),
                        "no usable metrics snapshot"));
            }
        }
        return warnings;
    }

    public List<ReportWarning> workloadWarnings(List<WorkloadAccounting> workloads) {
        List<ReportWarning> warnings = new ArrayList<>();
        for (WorkloadAccounting workload : workloads) {
            if (workload.isSkipped()) {
                warnings.add(warning(WarningType.SKIPPED_WORKLOAD,
                        workload.getNamespace() + "/" + workload.getIdentity(), workload.getNote()));
            }
        }
        return warnings;
    }

    /**
     * 메트릭을 요청했는데 실사용량이 없는 노드 경고
     */
    public List<ReportWarning> nodeWarnings(List<NodeAccounting> nodes, boolean metricsRequested) {
        List<ReportWarning> warnings = new ArrayList<>();
        if (!metricsRequested) {
            return warnings;
        }
        for (NodeAccounting node : nodes) {
            if (node.getActualUsage() == null) {
                warnings.add(warning(WarningType.METRICS_UNAVAILABLE, node.getNodeName(),
                        "no usable node metrics"));
            }
        }
        return warnings;
    }

    public Optional<ReportWarning> parseFailureWarning(long failures) {
        if (failures <= 0) {
            return Optional.empty();
        }
        return Optional.of(warning(WarningType.UNPARSEABLE_QUANTITIES, "quantities",
                failures + " value(s) could not be parsed and were counted as 0"));
    }

    public ReportWarning warning(WarningType type, String subject, String message) {
        return ReportWarning.builder()
                .type(type)
                .subject(subject)
                .message(message)
                .build();
    }

    static double toUnit(double mib, MemoryUnit unit) {
        return round2(mib / unit.getDivisor());
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
