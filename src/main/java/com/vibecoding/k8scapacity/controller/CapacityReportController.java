package com.vibecoding.k8scapacity.controller;

import com.vibecoding.k8scapacity.model.NamespaceReport;
import com.vibecoding.k8scapacity.model.NodeReport;
import com.vibecoding.k8scapacity.model.WorkloadReport;
import com.vibecoding.k8scapacity.service.CapacityReportService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 리소스 리포트 REST API
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class CapacityReportController {

    private static final Logger log = LoggerFactory.getLogger(CapacityReportController.class);

    private final CapacityReportService reportService;

    /**
     * 네임스페이스별 리포트
     */
    @GetMapping("/namespaces")
    public NamespaceReport namespaces(
        @RequestParam(required = false) String namespace,
        @RequestParam(required = false) Boolean skipSystem,
        @RequestParam(required = false) List<String> exclude,
        @RequestParam(required = false) String sort,
        @RequestParam(required = false) Boolean metrics,
        @RequestParam(required = false) String unit
    ) {
        log.info("Namespace report requested (namespace={}, sort={}, unit={})", namespace, sort, unit);
        return reportService.namespaceReport(namespace, skipSystem, exclude, sort, metrics, unit);
    }

    /**
     * 워크로드별 리포트
     */
    @GetMapping("/workloads")
    public WorkloadReport workloads(
        @RequestParam(required = false) String namespace,
        @RequestParam(required = false) String unit
    ) {
        log.info("Workload report requested (namespace={}, unit={})", namespace, unit);
        return reportService.workloadReport(namespace, unit);
    }

    /**
     * 노드별 리포트
     */
    @GetMapping("/nodes")
    public NodeReport nodes(
        @RequestParam(required = false) String unit,
        @RequestParam(required = false) Boolean metrics
    ) {
        log.info("Node report requested (unit={}, metrics={})", unit, metrics);
        return reportService.nodeReport(unit, metrics);
    }
}
