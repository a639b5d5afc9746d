package com.radiochat.model;

/**
 * 접속자 목록과 방 멤버 목록에 사용되는 DTO.
 */
public class UserResponse {

    private String id;
    private String username;
    private boolean online;
    private String roomId;

    public UserResponse() {
    }

    public UserResponse(String id, String username, boolean online, String roomId) {
        this.id = id;
        this.username = username;
        this.online = online;
        this.roomId = roomId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public boolean isOnline() {
        return online;
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }
}
