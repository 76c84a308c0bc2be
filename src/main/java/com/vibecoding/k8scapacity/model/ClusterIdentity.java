package com.vibecoding.k8scapacity.model;

import lombok.Value;

/**
 * 접속한 클러스터 정보
 */
@Value
public class ClusterIdentity {
    String serverUrl;
    String version;
}
