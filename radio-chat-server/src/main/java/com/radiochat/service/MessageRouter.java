package com.radiochat.service;

import com.radiochat.model.ChatMessage;
import com.radiochat.model.MessageResponse;
import com.radiochat.model.Room;
import com.radiochat.model.ServerEvent;
import com.radiochat.model.ServerEventType;
import com.radiochat.repository.ChatMessageRepository;
import com.radiochat.storage.BlobStore;
import com.radiochat.storage.MediaPayload;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 텍스트/오디오 메시지를 검증하고 저장한 뒤 방 구독자에게 팬아웃한다.
 * 저장에 성공한 메시지만 브로드캐스트된다. 발신자 간 순서는 보장하지 않는다.
 */
@Service
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final RoomRegistry roomRegistry;
    private final ClientNotifier notifier;
    private final ChatMessageRepository messageRepository;
    private final BlobStore blobStore;
    private final Clock clock;

    public MessageRouter(RoomRegistry roomRegistry, ClientNotifier notifier,
            ChatMessageRepository messageRepository, BlobStore blobStore, Clock clock) {
        this.roomRegistry = roomRegistry;
        this.notifier = notifier;
        this.messageRepository = messageRepository;
        this.blobStore = blobStore;
        this.clock = clock;
    }

    /**
     * 텍스트 메시지를 저장하고 방 전체에 new-message, 발신자에게 message-sent를 보낸다.
     */
    public ChatMessage sendText(String connectionId, String userId, String displayName, String roomId, String text) {
        InvalidRequestException.requireText(userId, "userId");
        InvalidRequestException.requireText(displayName, "username");
        InvalidRequestException.requireText(roomId, "roomId");
        InvalidRequestException.requireText(text, "text");
        if (text.length() > ChatMessage.MAX_TEXT_LENGTH) {
            throw new InvalidRequestException("text exceeds " + ChatMessage.MAX_TEXT_LENGTH + " characters");
        }
        Room room = roomRegistry.lookup(roomId);

        ChatMessage message = ChatMessage.text(UUID.randomUUID().toString(), userId, displayName, room.getId(), text,
                clock.instant());
        persist(message);
        deliver(connectionId, message);
        log.info("Text message {} from {} to room {}", message.getId(), userId, room.getId());
        return message;
    }

    /**
     * 오디오 페이로드를 블롭 스토어에 올리고, 그 URL을 담은 메시지를 저장한 뒤 팬아웃한다.
     * 업로드나 저장 중 하나라도 실패하면 브로드캐스트하지 않는다.
     */
    public ChatMessage sendAudio(String connectionId, String userId, String displayName, String roomId,
            String audioPayload) {
        InvalidRequestException.requireText(userId, "userId");
        InvalidRequestException.requireText(roomId, "roomId");
        InvalidRequestException.requireText(audioPayload, "audio");
        Room room = roomRegistry.lookup(roomId);
        String senderName = displayName == null || displayName.isBlank() ? userId : displayName;

        MediaPayload media;
        try {
            media = MediaPayload.decode(audioPayload, MediaPayload.DEFAULT_AUDIO_TYPE);
        } catch (IllegalArgumentException ex) {
            throw new InvalidRequestException("audio payload is not valid base64: " + ex.getMessage());
        }

        String messageId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        String path = "audio/" + room.getId() + "/" + userId + "/" + now.toEpochMilli() + "_" + messageId + "."
                + media.getExtension();
        String url = blobStore.store(path, media.getContent(), media.getContentType());

        ChatMessage message = ChatMessage.audio(messageId, userId, senderName, room.getId(), url, now);
        persist(message);
        deliver(connectionId, message);
        log.info("Audio message {} from {} to room {} ({} bytes)", messageId, userId, room.getId(),
                media.getContent().length);
        return message;
    }

    private void persist(ChatMessage message) {
        try {
            messageRepository.save(message);
        } catch (DataAccessException ex) {
            log.error("Failed to persist message {} for room {}: {}", message.getId(), message.getRoomId(),
                    ex.getMessage(), ex);
            throw new PersistenceException("Failed to save message: " + ex.getMessage(), ex);
        }
    }

    private void deliver(String connectionId, ChatMessage message) {
        MessageResponse payload = MessageResponse.from(message);
        List<String> subscribers = roomRegistry.subscriberConnections(message.getRoomId());
        notifier.sendAll(subscribers, ServerEvent.of(ServerEventType.NEW_MESSAGE).with("message", payload));
        notifier.send(connectionId, ServerEvent.of(ServerEventType.MESSAGE_SENT).with("message", payload));
    }
}
