package com.radiochat.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 서버가 클라이언트로 보내는 이벤트 종류.
 */
public enum ServerEventType {
    CONNECTED_USERS("connected-users"),
    ROOM_LIST("room-list"),
    JOIN_SUCCESS("join-success"),
    JOIN_ERROR("join-error"),
    USER_JOINED("user-joined"),
    USER_LEFT("user-left"),
    NEW_MESSAGE("new-message"),
    MESSAGE_SENT("message-sent"),
    TOKEN_GRANTED("token-granted"),
    TOKEN_DENIED("token-denied"),
    CURRENT_SPEAKER_UPDATE("current-speaker-update"),
    TOKEN_RELEASED("token-released"),
    USER_UPDATED("user-updated"),
    ERROR("error");

    private final String wireName;

    ServerEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
