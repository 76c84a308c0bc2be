package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 네임스페이스별 리소스 리포트
 */
@Value
@Builder
public class NamespaceReport {
    ReportMetadata metadata;
    @Singular
    List<NamespaceRow> rows;
    NamespaceRow grandTotal;
    @Singular
    List<ReportWarning> warnings;
}
