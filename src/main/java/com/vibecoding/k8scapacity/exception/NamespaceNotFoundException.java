package com.vibecoding.k8scapacity.exception;

/**
 * 지정한 네임스페이스가 없거나 볼 권한이 없을 때 발생하는 예외
 */
public class NamespaceNotFoundException extends RuntimeException {

    public NamespaceNotFoundException(String message) {
        super(message);
    }
}
