package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.config.CapacityReportProperties;
import com.vibecoding.k8scapacity.datasource.ClusterDataSource;
import com.vibecoding.k8scapacity.exception.DataFetchException;
import com.vibecoding.k8scapacity.model.ClusterIdentity;
import com.vibecoding.k8scapacity.model.MemoryUnit;
import com.vibecoding.k8scapacity.model.NamespaceReport;
import com.vibecoding.k8scapacity.model.NamespaceTotals;
import com.vibecoding.k8scapacity.model.NodeAccounting;
import com.vibecoding.k8scapacity.model.NodeAnalysis;
import com.vibecoding.k8scapacity.model.NodeReport;
import com.vibecoding.k8scapacity.model.NodeObject;
import com.vibecoding.k8scapacity.model.PodObject;
import com.vibecoding.k8scapacity.model.ReportMetadata;
import com.vibecoding.k8scapacity.model.SortKey;
import com.vibecoding.k8scapacity.model.WarningType;
import com.vibecoding.k8scapacity.model.WorkloadAccounting;
import com.vibecoding.k8scapacity.model.WorkloadKind;
import com.vibecoding.k8scapacity.model.WorkloadObject;
import com.vibecoding.k8scapacity.model.WorkloadReport;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * 리소스 리포트 생성 서비스 (네임스페이스 / 워크로드 / 노드)
 */
@Service
@RequiredArgsConstructor
public class CapacityReportService {

    private static final Logger log = LoggerFactory.getLogger(CapacityReportService.class);

    static final String TOTAL = "TOTAL";

    private static final Set<WorkloadKind> DECLARED_KINDS = EnumSet.of(
            WorkloadKind.DEPLOYMENT, WorkloadKind.STATEFUL_SET,
            WorkloadKind.DEPLOYMENT_CONFIG, WorkloadKind.DAEMON_SET);

    private final ClusterDataSource dataSource;
    private final NamespaceSelector namespaceSelector;
    private final QuantityParser quantityParser;
    private final WorkloadResourceExtractor extractor;
    private final ResourceAggregator aggregator;
    private final NodeCapacityAnalyzer nodeAnalyzer;
    private final UsageMerger usageMerger;
    private final ReportAssembler assembler;
    private final CapacityReportProperties properties;
    private final ThreadPoolTaskExecutor reportExecutor;

    // ========== Namespace Report ==========

    /**
     * 실행 중인 Pod 기준 네임스페이스별 requests/limits 리포트.
     * null 파라미터는 설정값으로 대체된다.
     */
    public NamespaceReport namespaceReport(String namespace, Boolean skipSystem, List<String> excludes,
                                           String sort, Boolean metrics, String unit) {
        CapacityReportProperties.Report defaults = properties.getReport();
        SortKey sortKey = SortKey.fromKey(sort != null ? sort : defaults.getSortBy());
        MemoryUnit memoryUnit = unit != null ? MemoryUnit.of(unit) : MemoryUnit.fromString(defaults.getMemoryUnit());
        boolean includeMetrics = metrics != null ? metrics : defaults.isIncludeMetrics();
        boolean skip = skipSystem != null ? skipSystem : defaults.isSkipSystem();
        List<String> excluded = new ArrayList<>(defaults.getExcludedNamespaces());
        if (excludes != null) {
            excluded.addAll(excludes);
        }

        ClusterIdentity cluster = dataSource.verifyAccess();
        long failuresBefore = quantityParser.failureCount();

        List<String> namespaces = namespaceSelector.select(namespace, skip, excluded);
        log.info("Starting namespace report for {} namespace(s), sort={}, metrics={}",
                namespaces.size(), sortKey.getKey(), includeMetrics);

        List<NamespaceTotals> results = new ArrayList<>(forEachNamespace(namespaces,
                (ns, position) -> accountNamespace(ns, position, namespaces.size(), includeMetrics)));
        results.sort(sortKey.comparator());

        NamespaceTotals grandTotal = aggregator.grandTotal(TOTAL, results);

        NamespaceReport.NamespaceReportBuilder report = NamespaceReport.builder()
                .metadata(metadata(cluster, memoryUnit, sortKey.getKey(), includeMetrics, "running pods"))
                .grandTotal(assembler.namespaceRow(grandTotal, memoryUnit))
                .warnings(assembler.namespaceWarnings(results, includeMetrics));
        results.forEach(totals -> report.row(assembler.namespaceRow(totals, memoryUnit)));
        assembler.parseFailureWarning(quantityParser.failureCount() - failuresBefore).ifPresent(report::warning);

        log.info("Namespace report completed: {} namespace(s), {} running pods",
                results.size(), grandTotal.getRunningPods());
        return report.build();
    }

    private NamespaceTotals accountNamespace(String namespace, int position, int count, boolean includeMetrics) {
        try {
            List<PodObject> pods = dataSource.listPods(namespace, Collections.singleton(PodObject.PHASE_RUNNING));
            NamespaceTotals totals = aggregator.aggregatePods(namespace, pods, properties.getQuantity().getPodMemory());
            if (includeMetrics) {
                totals = usageMerger.merge(totals, dataSource.topPods(namespace), properties.getQuantity().getUsageMemory());
            }
            log.info("[{}/{}] {}: {} pods, cpu req {}m, mem req {} MiB", position, count, namespace,
                    totals.getRunningPods(), totals.getCpuRequestMillis(), totals.getMemoryRequestMib());
            return totals;
        } catch (DataFetchException e) {
            log.warn("[{}/{}] {}: fetch failed - {}", position, count, namespace, e.getMessage());
            return aggregator.failed(namespace, e.getMessage());
        }
    }

    // ========== Workload Report ==========

    /**
     * 선언된 워크로드(Deployment, StatefulSet, DeploymentConfig, DaemonSet) 기준 리포트
     */
    public WorkloadReport workloadReport(String namespace, String unit) {
        CapacityReportProperties.Report defaults = properties.getReport();
        MemoryUnit memoryUnit = unit != null ? MemoryUnit.of(unit) : MemoryUnit.fromString(defaults.getMemoryUnit());

        ClusterIdentity cluster = dataSource.verifyAccess();
        long failuresBefore = quantityParser.failureCount();

        List<String> namespaces = namespaceSelector.select(namespace, defaults.isSkipSystem(),
                defaults.getExcludedNamespaces());
        log.info("Starting workload report for {} namespace(s)", namespaces.size());

        List<WorkloadAccounting> workloads = new ArrayList<>();
        List<NamespaceTotals> totals = new ArrayList<>();
        int position = 0;
        for (String ns : namespaces) {
            position++;
            try {
                List<WorkloadAccounting> accounted = new ArrayList<>();
                for (WorkloadObject workload : dataSource.listWorkloads(ns, DECLARED_KINDS)) {
                    accounted.add(extractor.extract(workload, properties.getQuantity().getWorkloadMemory()));
                }
                NamespaceTotals namespaceTotals = aggregator.aggregateWorkloads(ns, accounted);
                log.info("[{}/{}] {}: {} workload(s), {} pods declared", position, namespaces.size(), ns,
                        accounted.size(), namespaceTotals.getRunningPods());
                workloads.addAll(accounted);
                totals.add(namespaceTotals);
            } catch (DataFetchException e) {
                log.warn("[{}/{}] {}: fetch failed - {}", position, namespaces.size(), ns, e.getMessage());
                totals.add(aggregator.failed(ns, e.getMessage()));
            }
        }

        NamespaceTotals grandTotal = aggregator.grandTotal(TOTAL, totals);

        WorkloadReport.WorkloadReportBuilder report = WorkloadReport.builder()
                .metadata(metadata(cluster, memoryUnit, null, false, "declared workloads"))
                .grandTotal(assembler.namespaceRow(grandTotal, memoryUnit))
                .warnings(assembler.namespaceWarnings(totals, false))
                .warnings(assembler.workloadWarnings(workloads));
        workloads.forEach(workload -> report.row(assembler.workloadRow(workload, memoryUnit)));
        totals.forEach(namespaceTotals -> report.namespaceTotal(assembler.namespaceRow(namespaceTotals, memoryUnit)));
        assembler.parseFailureWarning(quantityParser.failureCount() - failuresBefore).ifPresent(report::warning);

        log.info("Workload report completed: {} workload(s) in {} namespace(s)", workloads.size(), totals.size());
        return report.build();
    }

    // ========== Node Report ==========

    /**
     * 노드별 allocatable 대비 예약 메모리/CPU 리포트. metrics가 켜지면 노드 실사용량을 함께 싣는다.
     * 노드 목록 조회 실패는 그대로 전파된다 (부분 결과가 없음).
     */
    public NodeReport nodeReport(String unit, Boolean metrics) {
        MemoryUnit memoryUnit = unit != null
                ? MemoryUnit.of(unit)
                : MemoryUnit.fromString(properties.getReport().getMemoryUnit());
        boolean includeMetrics = metrics != null ? metrics : properties.getReport().isIncludeMetrics();

        ClusterIdentity cluster = dataSource.verifyAccess();
        long failuresBefore = quantityParser.failureCount();

        List<NodeObject> nodes = dataSource.listNodes();
        log.info("Starting node report for {} node(s)", nodes.size());

        NodeReport.NodeReportBuilder report = NodeReport.builder()
                .metadata(metadata(cluster, memoryUnit, null, includeMetrics, "pod requests on nodes"));

        List<PodObject> pods;
        try {
            pods = dataSource.listPods(null, Set.of(PodObject.PHASE_RUNNING, PodObject.PHASE_PENDING));
        } catch (DataFetchException e) {
            log.warn("Pod listing failed, committed values will be 0: {}", e.getMessage());
            report.warning(assembler.warning(WarningType.FETCH_FAILED, e.getEntity(), e.getMessage()));
            pods = Collections.emptyList();
        }

        NodeAnalysis analysis = nodeAnalyzer.analyze(nodes, pods, properties.getQuantity().getNodeMemory());
        List<NodeAccounting> accounted = analysis.getNodes();
        if (includeMetrics) {
            accounted = usageMerger.mergeNodes(accounted, dataSource.topNodes(), properties.getQuantity().getUsageMemory());
        }
        NodeAccounting total = nodeAnalyzer.total(TOTAL, accounted);

        accounted.forEach(node -> report.row(assembler.nodeRow(node, memoryUnit)));
        report.grandTotal(assembler.nodeRow(total, memoryUnit))
                .unmatchedPods(analysis.getUnmatchedPods())
                .unscheduledPods(analysis.getUnscheduledPods());
        if (analysis.getUnmatchedPods() > 0) {
            report.warning(assembler.warning(WarningType.UNMATCHED_PODS, "nodes",
                    analysis.getUnmatchedPods() + " pod(s) are assigned to nodes that were not listed"));
        }
        report.warnings(assembler.nodeWarnings(accounted, includeMetrics));
        assembler.parseFailureWarning(quantityParser.failureCount() - failuresBefore).ifPresent(report::warning);

        log.info("Node report completed: {} node(s), committed {} of {} MiB allocatable",
                analysis.getNodes().size(), total.getCommittedMib(), total.getAllocatableMib());
        return report.build();
    }

    // ========== Helper ==========

    @FunctionalInterface
    interface NamespaceTask {
        NamespaceTotals run(String namespace, int position);
    }

    /**
     * parallelism이 1이면 순차 실행, 그 이상이면 reportExecutor에 분배한다.
     * 결과 순서는 호출 측에서 정렬한다.
     */
    private Collection<NamespaceTotals> forEachNamespace(List<String> namespaces, NamespaceTask task) {
        if (properties.getReport().getParallelism() <= 1 || namespaces.size() <= 1) {
            List<NamespaceTotals> results = new ArrayList<>();
            for (int i = 0; i < namespaces.size(); i++) {
                results.add(task.run(namespaces.get(i), i + 1));
            }
            return results;
        }

        List<CompletableFuture<NamespaceTotals>> futures = new ArrayList<>();
        for (int i = 0; i < namespaces.size(); i++) {
            String ns = namespaces.get(i);
            int position = i + 1;
            futures.add(CompletableFuture.supplyAsync(() -> task.run(ns, position), reportExecutor));
        }
        try {
            return futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private ReportMetadata metadata(ClusterIdentity cluster, MemoryUnit unit, String sortBy,
                                    boolean metricsRequested, String basis) {
        return ReportMetadata.builder()
                .generatedAt(LocalDateTime.now())
                .clusterServer(cluster.getServerUrl())
                .clusterVersion(cluster.getVersion())
                .memoryUnit(unit.getDisplayName())
                .sortBy(sortBy)
                .metricsRequested(metricsRequested)
                .basis(basis)
                .build();
    }
}
