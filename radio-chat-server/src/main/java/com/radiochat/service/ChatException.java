package com.radiochat.service;

/**
 * 요청 단위로 처리되는 채팅 서버 예외의 공통 부모. 프로세스를 종료시키지 않는다.
 */
public abstract class ChatException extends RuntimeException {

    protected ChatException(String message) {
        super(message);
    }

    protected ChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
