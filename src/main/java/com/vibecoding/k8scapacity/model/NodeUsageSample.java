package com.vibecoding.k8scapacity.model;

import lombok.Value;

/**
 * 노드 메트릭 스냅샷의 한 줄 (노드 이름, CPU, 메모리 원본 문자열)
 */
@Value
public class NodeUsageSample {
    String nodeName;
    String cpu;
    String memory;
}
