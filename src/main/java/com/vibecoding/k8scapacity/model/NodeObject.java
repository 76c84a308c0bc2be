package com.vibecoding.k8scapacity.model;

import lombok.Builder;
import lombok.Value;

/**
 * 정규화된 Node 용량 정보 (status.capacity / status.allocatable 원본 값)
 */
@Value
@Builder
public class NodeObject {
    String name;
    String capacityMemory;
    String allocatableMemory;
    String capacityCpu;
    String allocatableCpu;
}
