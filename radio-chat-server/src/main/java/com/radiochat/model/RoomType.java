package com.radiochat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 방의 용도(로비/일반/무전)를 구분한다.
 */
public enum RoomType {
    LOBBY("lobby"),
    GENERAL("general"),
    PTT_RADIO("ptt-radio"),
    OTHER("other");

    private final String value;

    RoomType(String value) {
        this.value = value;
    }

    /**
     * 직렬화된 문자열을 열거형으로 변환한다.
     */
    @JsonCreator
    public static RoomType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RoomType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown room type: " + value);
    }

    /**
     * 열거형을 문자열로 직렬화할 때 사용된다.
     */
    @JsonValue
    public String toValue() {
        return value;
    }
}
