package com.radiochat.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요청 이벤트에 대한 응답(ack). {success, message, ...payload} 형태로 직렬화된다.
 */
public final class CommandResult {

    private final boolean success;
    private final String message;
    private final Map<String, Object> payload = new LinkedHashMap<>();

    private CommandResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static CommandResult ok() {
        return new CommandResult(true, null);
    }

    public static CommandResult failure(String message) {
        return new CommandResult(false, message);
    }

    public CommandResult with(String name, Object value) {
        payload.put(name, value);
        return this;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public Object get(String name) {
        return payload.get(name);
    }
}
