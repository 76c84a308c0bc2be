package com.vibecoding.k8scapacity.config;

import com.vibecoding.k8scapacity.exception.ClusterAccessException;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kubernetes 클라이언트 생성
 */
@Configuration
@RequiredArgsConstructor
public class KubernetesClientConfig {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientConfig.class);

    private final CapacityReportProperties properties;

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        CapacityReportProperties.Cluster cluster = properties.getCluster();
        try {
            if (cluster.getApiServerUrl() == null || cluster.getApiServerUrl().isBlank()) {
                // URL이 없으면 ~/.kube/config 또는 in-cluster 서비스 계정 사용
                log.info("No API server URL configured, using kubeconfig auto-configuration");
                return new KubernetesClientBuilder().build();
            }

            Config k8sConfig = new ConfigBuilder()
                .withAutoConfigure(false)
                .withMasterUrl(cluster.getApiServerUrl())
                .withOauthToken(cluster.getToken())
                .withTrustCerts(cluster.isTrustCerts())
                .withRequestTimeout(cluster.getRequestTimeoutMs())
                .withConnectionTimeout(cluster.getConnectionTimeoutMs())
                .build();

            log.info("Creating Kubernetes client for {}", cluster.getApiServerUrl());
            return new KubernetesClientBuilder()
                .withConfig(k8sConfig)
                .build();

        } catch (Exception e) {
            log.error("Failed to create Kubernetes client", e);
            throw new ClusterAccessException("Invalid cluster configuration: " + e.getMessage(), e);
        }
    }
}
