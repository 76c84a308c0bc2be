package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 노드별 메모리/CPU 예약 리포트
 */
@Value
@Builder
public class NodeReport {
    ReportMetadata metadata;
    @Singular
    List<NodeRow> rows;
    NodeRow grandTotal;
    int unmatchedPods;
    int unscheduledPods;
    @Singular
    List<ReportWarning> warnings;
}
