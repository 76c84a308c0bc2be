package com.vibecoding.k8scapacity.model;

import lombok.Value;

/**
 * Pod 하나(또는 합산된 Pod 그룹)의 requests/limits 합계. CPU는 millicore, 메모리는 MiB.
 */
@Value
public class PodResourceProfile {
    public static final PodResourceProfile ZERO = new PodResourceProfile(0.0, 0.0, 0.0, 0.0, false);

    double cpuRequestMillis;
    double cpuLimitMillis;
    double memoryRequestMib;
    double memoryLimitMib;
    boolean requestsDeclared;    // 컨테이너 중 하나라도 request 선언

    public PodResourceProfile plus(PodResourceProfile other) {
        return new PodResourceProfile(
                cpuRequestMillis + other.cpuRequestMillis,
                cpuLimitMillis + other.cpuLimitMillis,
                memoryRequestMib + other.memoryRequestMib,
                memoryLimitMib + other.memoryLimitMib,
                requestsDeclared || other.requestsDeclared);
    }

    /**
     * Scalar multiplication of all four amounts. A count of zero or less yields zero amounts.
     */
    public PodResourceProfile times(int replicas) {
        if (replicas <= 0) {
            return new PodResourceProfile(0.0, 0.0, 0.0, 0.0, requestsDeclared);
        }
        return new PodResourceProfile(
                cpuRequestMillis * replicas,
                cpuLimitMillis * replicas,
                memoryRequestMib * replicas,
                memoryLimitMib * replicas,
                requestsDeclared);
    }
}
