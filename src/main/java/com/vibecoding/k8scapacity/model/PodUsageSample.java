package com.vibecoding.k8scapacity.model;

import lombok.Value;

/**
 * metrics-server 스냅샷의 한 줄 (pod 이름, CPU, 메모리 원본 문자열)
 */
@Value
public class PodUsageSample {
    String podName;
    String cpu;
    String memory;
}
