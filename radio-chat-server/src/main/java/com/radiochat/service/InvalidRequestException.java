package com.radiochat.service;

/**
 * 필수 필드가 없거나 형식이 잘못된 요청. 상태는 변경되지 않는다.
 */
public class InvalidRequestException extends ChatException {

    public InvalidRequestException(String message) {
        super(message);
    }

    /**
     * 값이 null이거나 공백이면 예외를 던지고, 아니면 그대로 반환한다.
     */
    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
        return value;
    }
}
