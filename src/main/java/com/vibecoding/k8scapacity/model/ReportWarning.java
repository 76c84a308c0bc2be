package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 리포트 경고 항목 (실패한 네임스페이스, request 없는 Pod 등)
 */
@Value
@Builder
public class ReportWarning {
    WarningType type;
    String subject;              // 네임스페이스, 노드 또는 워크로드 이름
    String message;
}
