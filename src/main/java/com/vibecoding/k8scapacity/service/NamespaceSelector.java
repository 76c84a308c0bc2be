package com.vibecoding.k8scapacity.service;

import com.vibecoding.k8scapacity.config.CapacityReportProperties;
import com.vibecoding.k8scapacity.datasource.ClusterDataSource;
import com.vibecoding.k8scapacity.exception.NamespaceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 리포트 대상 네임스페이스 선택
 */
@Component
@RequiredArgsConstructor
public class NamespaceSelector {

    private static final Logger log = LoggerFactory.getLogger(NamespaceSelector.class);

    private final ClusterDataSource dataSource;
    private final CapacityReportProperties properties;

    /**
     * 단일 네임스페이스를 지정하면 존재 여부만 확인하고, 아니면 전체 목록에서 시스템/제외 대상을 거른다.
     */
    public List<String> select(String namespace, boolean skipSystem, Collection<String> excludes) {
        if (namespace != null && !namespace.isBlank()) {
            if (!dataSource.namespaceExists(namespace)) {
                throw new NamespaceNotFoundException("Namespace '" + namespace + "' not found or not accessible");
            }
            return Collections.singletonList(namespace);
        }

        Set<String> excluded = excludes != null ? Set.copyOf(excludes) : Collections.emptySet();
        List<String> selected = dataSource.listNamespaces()
                .stream()
                .filter(ns -> !(skipSystem && isSystem(ns)))
                .filter(ns -> !excluded.contains(ns))
                .collect(Collectors.toList());

        log.info("Selected {} namespace(s) (skipSystem={}, excluded={})", selected.size(), skipSystem, excluded.size());
        return selected;
    }

    boolean isSystem(String namespace) {
        return properties.getReport().getSystemPrefixes()
                .stream()
                .anyMatch(namespace::startsWith);
    }
}
