package com.radiochat.model;

/**
 * 현재 송신권 보유자 정보.
 */
public class SpeakerResponse {

    private String userId;
    private String username;
    private long since;

    public static SpeakerResponse from(TalkState.Held held) {
        SpeakerResponse response = new SpeakerResponse();
        response.setUserId(held.getHolderId());
        response.setUsername(held.getHolderName());
        response.setSince(held.getSince().toEpochMilli());
        return response;
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

    public long getSince() {
        return since;
    }

    public void setSince(long since) {
        this.since = since;
    }
}
