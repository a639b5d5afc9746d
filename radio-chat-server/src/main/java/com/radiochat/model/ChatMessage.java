package com.radiochat.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;

/**
 * 방으로 전송된 텍스트/오디오 메시지. 생성 후에는 변경되지 않는 append-only 레코드다.
 */
@Entity
@Table(name = "chat_messages", indexes = @Index(name = "idx_chat_messages_room", columnList = "room_id"))
public class ChatMessage {

    public static final int MAX_TEXT_LENGTH = 4000;

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "sender_id", nullable = false, length = 100)
    private String senderId;

    @Column(name = "sender_name", length = 200)
    private String senderName;

    @Column(name = "room_id", nullable = false, length = 100)
    private String roomId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 10)
    private MessageKind kind;

    @Column(name = "text", length = MAX_TEXT_LENGTH)
    private String text;

    @Column(name = "audio_url", length = 1024)
    private String audioUrl;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected ChatMessage() {
    }

    private ChatMessage(String id, String senderId, String senderName, String roomId, MessageKind kind,
            String text, String audioUrl, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "message id must not be null");
        this.senderId = Objects.requireNonNull(senderId, "senderId must not be null");
        this.senderName = senderName;
        this.roomId = Objects.requireNonNull(roomId, "roomId must not be null");
        this.kind = kind;
        this.text = text;
        this.audioUrl = audioUrl;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public static ChatMessage text(String id, String senderId, String senderName, String roomId, String text,
            Instant createdAt) {
        return new ChatMessage(id, senderId, senderName, roomId, MessageKind.TEXT, text, null, createdAt);
    }

    public static ChatMessage audio(String id, String senderId, String senderName, String roomId, String audioUrl,
            Instant createdAt) {
        return new ChatMessage(id, senderId, senderName, roomId, MessageKind.AUDIO, null, audioUrl, createdAt);
    }

    public String getId() {
        return id;
    }

    public String getSenderId() {
        return senderId;
    }

    public String getSenderName() {
        return senderName;
    }

    public String getRoomId() {
        return roomId;
    }

    public MessageKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public String getAudioUrl() {
        return audioUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
