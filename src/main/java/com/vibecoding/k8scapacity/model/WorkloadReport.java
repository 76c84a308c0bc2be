package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 워크로드(Deployment 등) 단위 리포트
 */
@Value
@Builder
public class WorkloadReport {
    ReportMetadata metadata;
    @Singular
    List<WorkloadRow> rows;
    @Singular("namespaceTotal")
    List<NamespaceRow> namespaceTotals;
    NamespaceRow grandTotal;
    @Singular
    List<ReportWarning> warnings;
}
