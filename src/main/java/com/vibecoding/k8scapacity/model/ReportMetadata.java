package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 리포트 생성 정보
 */
@Value
@Builder
public class ReportMetadata {
    LocalDateTime generatedAt;
    String clusterServer;
    String clusterVersion;
    String memoryUnit;           // "MiB" 또는 "GiB"
    String sortBy;
    boolean metricsRequested;
    String basis;
}
