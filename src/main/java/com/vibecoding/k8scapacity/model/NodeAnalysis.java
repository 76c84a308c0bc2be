package com.vibecoding.k8scapacity.model;

import lombok.Value;

import java.util.List;

/**
 * 노드 분석 결과와 진단 카운터
 */
@Value
public class NodeAnalysis {
    List<NodeAccounting> nodes;
    int unmatchedPods;           // 목록에 없는 노드에 배치된 Pod
    int unscheduledPods;         // 아직 노드가 없는 Pod
}
