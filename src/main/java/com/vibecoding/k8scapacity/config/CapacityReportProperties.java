package com.vibecoding.k8scapacity.config;

import com.vibecoding.k8scapacity.model.BareNumberConvention;
import com.vibecoding.k8scapacity.model.MemoryUnit;
import com.vibecoding.k8scapacity.model.SortKey;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 리소스 리포트 설정 (application.yml의 capacity.*)
 */
@Configuration
@ConfigurationProperties(prefix = "capacity")
@Data
public class CapacityReportProperties {

    private static final Logger log = LoggerFactory.getLogger(CapacityReportProperties.class);

    private Cluster cluster = new Cluster();
    private Report report = new Report();
    private Quantity quantity = new Quantity();

    @Data
    public static class Cluster {
        private String apiServerUrl;
        private String token;
        private boolean trustCerts = true;
        private Integer requestTimeoutMs = 30000;
        private Integer connectionTimeoutMs = 10000;
    }

    @Data
    public static class Report {
        private int parallelism = 1;
        private String memoryUnit = "GiB";
        private String sortBy = "cpu-req";
        private boolean includeMetrics = true;
        private boolean skipSystem = false;
        private List<String> systemPrefixes = new ArrayList<>(List.of(
                "openshift-", "kube-", "default", "kube-public", "kube-node-lease"));
        private List<String> excludedNamespaces = new ArrayList<>();
        private double warnThresholdPct = 70.0;
        private double criticalThresholdPct = 90.0;
    }

    /**
     * 단위 없는 메모리 값 해석 방식 (호출 지점별)
     */
    @Data
    public static class Quantity {
        private BareNumberConvention podMemory = BareNumberConvention.BYTES;
        private BareNumberConvention usageMemory = BareNumberConvention.BYTES;
        private BareNumberConvention workloadMemory = BareNumberConvention.MEBIBYTES;
        private BareNumberConvention nodeMemory = BareNumberConvention.MEBIBYTES;
    }

    @PostConstruct
    public void init() {
        // .env에서 토큰 로드 (시스템 프로퍼티 우선, 환경변수 대체)
        if (cluster.getToken() == null || cluster.getToken().isBlank()) {
            cluster.setToken(System.getProperty("K8S_TOKEN"));
        }
        if (cluster.getToken() == null || cluster.getToken().isBlank()) {
            cluster.setToken(System.getenv("K8S_TOKEN"));
        }

        validateConfig();
    }

    public void validateConfig() {
        if (report.getParallelism() < 1) {
            throw new IllegalStateException("capacity.report.parallelism must be >= 1, got " + report.getParallelism());
        }
        if (report.getWarnThresholdPct() > report.getCriticalThresholdPct()) {
            throw new IllegalStateException("capacity.report.warn-threshold-pct must not exceed critical-threshold-pct");
        }
        // 잘못된 정렬 키는 기동 시점에 실패
        SortKey.fromKey(report.getSortBy());

        boolean hasUrl = cluster.getApiServerUrl() != null && !cluster.getApiServerUrl().isBlank();
        log.info("Capacity report configuration validated successfully");
        log.info("  - API server: {}", hasUrl ? cluster.getApiServerUrl() : "(kubeconfig auto-configuration)");
        log.info("  - Parallelism: {}", report.getParallelism());
        log.info("  - Memory unit: {}", MemoryUnit.fromString(report.getMemoryUnit()).getDisplayName());
        log.info("  - Sort by: {}", report.getSortBy());
        log.info("  - Bare memory numbers: pods={}, usage={}, workloads={}, nodes={}",
                quantity.getPodMemory(), quantity.getUsageMemory(),
                quantity.getWorkloadMemory(), quantity.getNodeMemory());
    }
}
