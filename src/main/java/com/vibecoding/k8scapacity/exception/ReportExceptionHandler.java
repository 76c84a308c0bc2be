package com.vibecoding.k8scapacity.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 리포트 API 예외 처리 핸들러
 */
@RestControllerAdvice
public class ReportExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReportExceptionHandler.class);

    @ExceptionHandler(ClusterAccessException.class)
    public ResponseEntity<Map<String, Object>> handleClusterAccess(ClusterAccessException ex) {
        log.error("Cluster not reachable: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "클러스터 연결 실패", ex.getMessage());
    }

    @ExceptionHandler(DataFetchException.class)
    public ResponseEntity<Map<String, Object>> handleDataFetch(DataFetchException ex) {
        log.error("Data fetch failed for {}: {}", ex.getEntity(), ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "데이터 조회 실패", ex.getEntity() + ": " + ex.getMessage());
    }

    @ExceptionHandler(NamespaceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNamespaceNotFound(NamespaceNotFoundException ex) {
        log.warn("Namespace not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "네임스페이스를 찾을 수 없습니다", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Invalid report request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "잘못된 요청", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String title, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("title", title);
        body.put("error", message);
        body.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
