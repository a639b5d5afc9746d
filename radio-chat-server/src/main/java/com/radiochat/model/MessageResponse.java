package com.radiochat.model;

/**
 * new-message / message-sent 이벤트로 전달되는 메시지 표현.
 */
public class MessageResponse {

    private String id;
    private String userId;
    private String username;
    private String roomId;
    private MessageKind type;
    private String text;
    private String audioUrl;
    private long timestamp;

    public static MessageResponse from(ChatMessage message) {
        MessageResponse response = new MessageResponse();
        response.setId(message.getId());
        response.setUserId(message.getSenderId());
        response.setUsername(message.getSenderName());
        response.setRoomId(message.getRoomId());
        response.setType(message.getKind());
        response.setText(message.getText());
        response.setAudioUrl(message.getAudioUrl());
        response.setTimestamp(message.getCreatedAt().toEpochMilli());
        return response;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public MessageKind getType() {
        return type;
    }

    public void setType(MessageKind type) {
        this.type = type;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getAudioUrl() {
        return audioUrl;
    }

    public void setAudioUrl(String audioUrl) {
        this.audioUrl = audioUrl;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }
}
