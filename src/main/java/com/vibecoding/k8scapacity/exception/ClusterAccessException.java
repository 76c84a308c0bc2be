package com.vibecoding.k8scapacity.exception;

/**
 * 클러스터에 접속/인증할 수 없을 때 발생하는 예외 (전체 리포트 중단)
 */
public class ClusterAccessException extends RuntimeException {

    public ClusterAccessException(String message) {
        super(message);
    }

    public ClusterAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
