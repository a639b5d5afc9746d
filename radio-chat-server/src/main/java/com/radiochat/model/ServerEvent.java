package com.radiochat.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 단일 연결 또는 방 전체로 전달되는 이벤트. 전송 계층에서 {"type": ..., ...fields} 형태로 직렬화된다.
 */
public final class ServerEvent {

    private final ServerEventType type;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private ServerEvent(ServerEventType type) {
        this.type = Objects.requireNonNull(type, "event type must not be null");
    }

    public static ServerEvent of(ServerEventType type) {
        return new ServerEvent(type);
    }

    /**
     * 필드를 추가한다. null 값도 그대로 전달된다(예: speaker=null).
     */
    public ServerEvent with(String name, Object value) {
        fields.put(name, value);
        return this;
    }

    public ServerEventType getType() {
        return type;
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Object get(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return type.wireName() + fields;
    }
}
