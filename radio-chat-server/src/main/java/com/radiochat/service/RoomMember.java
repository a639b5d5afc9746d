package com.radiochat.service;

/**
 * 방 구독자 한 명. 팬아웃 대상 연결 핸들을 함께 보관한다.
 */
final class RoomMember {

    private final String userId;
    private String displayName;
    private String connectionId;

    RoomMember(String userId, String displayName, String connectionId) {
        this.userId = userId;
        this.displayName = displayName;
        this.connectionId = connectionId;
    }

    String getUserId() {
        return userId;
    }

    String getDisplayName() {
        return displayName;
    }

    String getConnectionId() {
        return connectionId;
    }

    void rebind(String displayName, String connectionId) {
        if (displayName != null && !displayName.isBlank()) {
            this.displayName = displayName;
        }
        if (connectionId != null) {
            this.connectionId = connectionId;
        }
    }
}
