package com.radiochat.service;

public class RoomNotFoundException extends ChatException {

    private final String roomId;

    public RoomNotFoundException(String roomId) {
        super("Room not found: " + roomId);
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
