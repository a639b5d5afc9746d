package com.radiochat.service;

/**
 * 문서 저장소 또는 블롭 스토어 호출 실패를 표현하는 런타임 예외.
 */
public class PersistenceException extends ChatException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
