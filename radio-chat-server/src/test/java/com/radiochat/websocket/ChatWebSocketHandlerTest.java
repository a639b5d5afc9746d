package com.radiochat.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.radiochat.config.ChatProperties;
import com.radiochat.model.ChatMessage;
import com.radiochat.model.UserProfile;
import com.radiochat.repository.ChatMessageRepository;
import com.radiochat.repository.UserProfileRepository;
import com.radiochat.service.ChatStateLock;
import com.radiochat.service.ConnectionRegistry;
import com.radiochat.service.MembershipCoordinator;
import com.radiochat.service.MessageRouter;
import com.radiochat.service.ProfileService;
import com.radiochat.service.PttArbiter;
import com.radiochat.service.RoomRegistry;
import com.radiochat.storage.BlobStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class ChatWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ChatWebSocketHandler handler;
    private ChatMessageRepository messageRepository;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
        ChatProperties chatProperties = new ChatProperties();
        ChatStateLock lock = new ChatStateLock();
        WebSocketClientNotifier notifier = new WebSocketClientNotifier(objectMapper, chatProperties);

        UserProfileRepository profileRepository = mock(UserProfileRepository.class);
        when(profileRepository.findById(anyString())).thenReturn(Optional.empty());
        when(profileRepository.save(any(UserProfile.class))).thenAnswer(invocation -> invocation.getArgument(0));
        messageRepository = mock(ChatMessageRepository.class);
        when(messageRepository.save(any(ChatMessage.class))).thenAnswer(invocation -> invocation.getArgument(0));
        BlobStore blobStore = mock(BlobStore.class);

        RoomRegistry roomRegistry = new RoomRegistry(chatProperties, lock);
        MembershipCoordinator coordinator = new MembershipCoordinator(roomRegistry, lock, notifier);
        PttArbiter arbiter = new PttArbiter(roomRegistry, lock, notifier, clock);
        ConnectionRegistry connectionRegistry = new ConnectionRegistry(lock, roomRegistry, coordinator, arbiter,
                notifier, profileRepository, clock);
        MessageRouter router = new MessageRouter(roomRegistry, notifier, messageRepository, blobStore, clock);
        ProfileService profileService = new ProfileService(profileRepository, blobStore, connectionRegistry,
                notifier, clock);
        handler = new ChatWebSocketHandler(objectMapper, notifier, connectionRegistry, roomRegistry, coordinator,
                arbiter, router, profileService, chatProperties);
    }

    @Test
    void registerAndJoinAreAcknowledged() throws Exception {
        WebSocketSession ana = open("s1");
        WebSocketSession luis = open("s2");

        frame(ana, "{\"action\":\"register-connection\",\"ackId\":\"1\",\"userId\":\"u1\",\"username\":\"Ana\"}");
        frame(ana, "{\"action\":\"join-room\",\"ackId\":\"2\",\"roomId\":\"general\",\"userId\":\"u1\",\"username\":\"Ana\"}");
        frame(luis, "{\"action\":\"join-room\",\"ackId\":\"3\",\"room\":\"general\",\"userId\":\"u2\",\"displayName\":\"Luis\"}");

        JsonNode registered = ack(ana, "1");
        assertThat(registered.get("success").asBoolean()).isTrue();
        assertThat(registered.get("users").size()).isEqualTo(1);
        assertThat(typesSentTo(ana)).contains("connected-users", "room-list", "join-success", "user-joined");

        JsonNode joined = ack(luis, "3");
        assertThat(joined.get("roomId").asText()).isEqualTo("general");
        assertThat(joined.get("userCount").asInt()).isEqualTo(2);
        JsonNode lastJoinSeenByAna = last(ana, "user-joined");
        assertThat(lastJoinSeenByAna.get("userId").asText()).isEqualTo("u2");
        assertThat(lastJoinSeenByAna.get("userCount").asInt()).isEqualTo(2);
    }

    @Test
    void unknownRoomYieldsJoinErrorAndFailureAck() throws Exception {
        WebSocketSession ana = open("s1");

        frame(ana, "{\"action\":\"join-room\",\"ackId\":\"9\",\"roomId\":\"mars\",\"userId\":\"u1\",\"username\":\"Ana\"}");

        assertThat(typesSentTo(ana)).contains("join-error");
        JsonNode ack = ack(ana, "9");
        assertThat(ack.get("success").asBoolean()).isFalse();
        assertThat(ack.get("message").asText()).contains("mars");
    }

    @Test
    void talkTokenIsReclaimedWhenHolderDisconnects() throws Exception {
        WebSocketSession ana = open("s1");
        WebSocketSession luis = open("s2");
        frame(ana, "{\"action\":\"join-room\",\"roomId\":\"handy\",\"userId\":\"u1\",\"username\":\"Ana\"}");
        frame(luis, "{\"action\":\"join-room\",\"roomId\":\"handy\",\"userId\":\"u2\",\"username\":\"Luis\"}");

        frame(ana, "{\"action\":\"request-talk-token\",\"ackId\":\"a\",\"roomId\":\"handy\",\"userId\":\"u1\",\"username\":\"Ana\"}");
        frame(luis, "{\"action\":\"request-talk-token\",\"ackId\":\"b\",\"roomId\":\"handy\",\"userId\":\"u2\",\"username\":\"Luis\"}");

        assertThat(ack(ana, "a").get("granted").asBoolean()).isTrue();
        JsonNode denied = last(luis, "token-denied");
        assertThat(denied.get("currentSpeaker").get("userId").asText()).isEqualTo("u1");

        handler.afterConnectionClosed(ana, CloseStatus.NORMAL);

        assertThat(last(luis, "token-released").get("userId").asText()).isEqualTo("u1");
        assertThat(last(luis, "current-speaker-update").get("speaker").isNull()).isTrue();
        assertThat(last(luis, "user-left").get("userCount").asInt()).isEqualTo(1);

        frame(luis, "{\"action\":\"request-talk-token\",\"ackId\":\"c\",\"roomId\":\"handy\",\"userId\":\"u2\",\"username\":\"Luis\"}");
        assertThat(ack(luis, "c").get("granted").asBoolean()).isTrue();
    }

    @Test
    void emptyTextFailsWithoutBroadcast() throws Exception {
        WebSocketSession ana = open("s1");
        WebSocketSession luis = open("s2");
        frame(ana, "{\"action\":\"join-room\",\"roomId\":\"general\",\"userId\":\"u1\",\"username\":\"Ana\"}");
        frame(luis, "{\"action\":\"join-room\",\"roomId\":\"general\",\"userId\":\"u2\",\"username\":\"Luis\"}");

        frame(ana, "{\"action\":\"send-text\",\"ackId\":\"t\",\"roomId\":\"general\",\"userId\":\"u1\",\"username\":\"Ana\",\"text\":\"\"}");

        assertThat(ack(ana, "t").get("success").asBoolean()).isFalse();
        assertThat(typesSentTo(luis)).doesNotContain("new-message");
    }

    @Test
    void textIsDeliveredToRoom() throws Exception {
        WebSocketSession ana = open("s1");
        WebSocketSession luis = open("s2");
        frame(ana, "{\"action\":\"join-room\",\"roomId\":\"general\",\"userId\":\"u1\",\"username\":\"Ana\"}");
        frame(luis, "{\"action\":\"join-room\",\"roomId\":\"general\",\"userId\":\"u2\",\"username\":\"Luis\"}");

        frame(ana, "{\"action\":\"send-text\",\"ackId\":\"t\",\"roomId\":\"general\",\"userId\":\"u1\",\"username\":\"Ana\",\"text\":\"hola\"}");

        JsonNode ack = ack(ana, "t");
        assertThat(ack.get("success").asBoolean()).isTrue();
        JsonNode delivered = last(luis, "new-message").get("message");
        assertThat(delivered.get("id").asText()).isEqualTo(ack.get("id").asText());
        assertThat(delivered.get("text").asText()).isEqualTo("hola");
        assertThat(typesSentTo(ana)).contains("message-sent");
        verify(messageRepository, atLeastOnce()).save(any(ChatMessage.class));
    }

    @Test
    void getUsersDefaultsToGeneralRoom() throws Exception {
        WebSocketSession ana = open("s1");
        frame(ana, "{\"action\":\"join-room\",\"roomId\":\"general\",\"userId\":\"u1\",\"username\":\"Ana\"}");

        frame(ana, "{\"action\":\"get-users\",\"ackId\":\"u\"}");

        JsonNode ack = ack(ana, "u");
        assertThat(ack.get("roomId").asText()).isEqualTo("general");
        assertThat(ack.get("count").asInt()).isEqualTo(1);
    }

    @Test
    void malformedOrUnknownFramesYieldErrorEvent() throws Exception {
        WebSocketSession ana = open("s1");

        frame(ana, "{not json");
        frame(ana, "{\"action\":\"teleport\"}");

        List<JsonNode> errors = framesSentTo(ana).stream()
                .filter(node -> node.get("type").asText().equals("error"))
                .collect(Collectors.toList());
        assertThat(errors).hasSize(2);
        assertThat(errors.get(1).get("message").asText()).contains("teleport");
    }

    private WebSocketSession open(String id) throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        handler.afterConnectionEstablished(session);
        return session;
    }

    private void frame(WebSocketSession session, String json) throws Exception {
        handler.handleTextMessage(session, new TextMessage(json));
    }

    private List<JsonNode> framesSentTo(WebSocketSession session) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        List<JsonNode> frames = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            frames.add(objectMapper.readTree(message.getPayload()));
        }
        return frames;
    }

    private List<String> typesSentTo(WebSocketSession session) throws Exception {
        return framesSentTo(session).stream()
                .map(node -> node.get("type").asText())
                .collect(Collectors.toList());
    }

    private JsonNode ack(WebSocketSession session, String ackId) throws Exception {
        return framesSentTo(session).stream()
                .filter(node -> node.get("type").asText().equals("ack"))
                .filter(node -> node.get("ackId").asText().equals(ackId))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no ack " + ackId));
    }

    private JsonNode last(WebSocketSession session, String type) throws Exception {
        List<JsonNode> matching = framesSentTo(session).stream()
                .filter(node -> node.get("type").asText().equals(type))
                .collect(Collectors.toList());
        assertThat(matching).as("frames of type %s", type).isNotEmpty();
        return matching.get(matching.size() - 1);
    }
}
