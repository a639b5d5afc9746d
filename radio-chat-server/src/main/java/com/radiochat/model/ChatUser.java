package com.radiochat.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 현재 접속 중인 사용자와 그 연결 핸들. 연결이 끊기면 레지스트리에서 삭제된다.
 */
public class ChatUser {

    private final String id;
    private String displayName;
    private String connectionId;
    private final Instant connectedAt;

    public ChatUser(String id, String displayName, String connectionId, Instant connectedAt) {
        this.id = Objects.requireNonNull(id, "user id must not be null");
        this.displayName = displayName;
        this.connectionId = connectionId;
        this.connectedAt = connectedAt == null ? Instant.now() : connectedAt;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public void setConnectionId(String connectionId) {
        this.connectionId = connectionId;
    }

    public boolean isOnline() {
        return connectionId != null;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }
}
