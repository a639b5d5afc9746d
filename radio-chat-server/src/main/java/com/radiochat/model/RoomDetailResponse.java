package com.radiochat.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 방 단건 조회 API 응답에 사용되는 DTO.
 */
public class RoomDetailResponse {

    private RoomResponse room;
    private List<UserResponse> members = new ArrayList<>();
    private SpeakerResponse currentSpeaker;
    private long messageCount;
    private long audioMessageCount;

    public RoomResponse getRoom() {
        return room;
    }

    public void setRoom(RoomResponse room) {
        this.room = room;
    }

    public List<UserResponse> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public void setMembers(List<UserResponse> members) {
        this.members = members == null ? new ArrayList<>() : new ArrayList<>(members);
    }

    public SpeakerResponse getCurrentSpeaker() {
        return currentSpeaker;
    }

    public void setCurrentSpeaker(SpeakerResponse currentSpeaker) {
        this.currentSpeaker = currentSpeaker;
    }

    public long getMessageCount() {
        return messageCount;
    }

    public void setMessageCount(long messageCount) {
        this.messageCount = messageCount;
    }

    public long getAudioMessageCount() {
        return audioMessageCount;
    }

    public void setAudioMessageCount(long audioMessageCount) {
        this.audioMessageCount = audioMessageCount;
    }
}
