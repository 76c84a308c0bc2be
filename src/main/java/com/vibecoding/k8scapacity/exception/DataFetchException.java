package com.vibecoding.k8scapacity.exception;

/**
 * 특정 네임스페이스/리소스 조회 실패. 해당 엔티티에만 기록되고 리포트는 계속된다.
 */
public class DataFetchException extends RuntimeException {

    private final String entity;

    public DataFetchException(String entity, String message) {
        super(message);
        this.entity = entity;
    }

    public DataFetchException(String entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    public String getEntity() {
        return entity;
    }
}
