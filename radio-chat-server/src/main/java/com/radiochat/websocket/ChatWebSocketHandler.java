package com.radiochat.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.radiochat.config.ChatProperties;
import com.radiochat.model.ChatMessage;
import com.radiochat.model.CommandResult;
import com.radiochat.model.MessageResponse;
import com.radiochat.model.ProfileResponse;
import com.radiochat.model.ProfileUpdateRequest;
import com.radiochat.model.ServerEvent;
import com.radiochat.model.ServerEventType;
import com.radiochat.model.SpeakerResponse;
import com.radiochat.model.UserResponse;
import com.radiochat.service.ChatException;
import com.radiochat.service.ConnectionRegistry;
import com.radiochat.service.InvalidRequestException;
import com.radiochat.service.MembershipCoordinator;
import com.radiochat.service.MessageRouter;
import com.radiochat.service.ProfileService;
import com.radiochat.service.PttArbiter;
import com.radiochat.service.RoomNotFoundException;
import com.radiochat.service.RoomRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 클라이언트의 채팅/PTT 요청 프레임을 받아 각 서비스로 라우팅한다.
 * 프레임에 ackId가 있으면 처리 결과를 ack 프레임으로 돌려준다.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final WebSocketClientNotifier notifier;
    private final ConnectionRegistry connectionRegistry;
    private final RoomRegistry roomRegistry;
    private final MembershipCoordinator membershipCoordinator;
    private final PttArbiter pttArbiter;
    private final MessageRouter messageRouter;
    private final ProfileService profileService;
    private final String defaultRoom;

    // 세션 ID -> 세션 컨텍스트
    private final Map<String, SessionContext> contexts = new ConcurrentHashMap<>();

    public ChatWebSocketHandler(ObjectMapper objectMapper, WebSocketClientNotifier notifier,
            ConnectionRegistry connectionRegistry, RoomRegistry roomRegistry,
            MembershipCoordinator membershipCoordinator, PttArbiter pttArbiter, MessageRouter messageRouter,
            ProfileService profileService, ChatProperties chatProperties) {
        this.objectMapper = objectMapper;
        this.notifier = notifier;
        this.connectionRegistry = connectionRegistry;
        this.roomRegistry = roomRegistry;
        this.membershipCoordinator = membershipCoordinator;
        this.pttArbiter = pttArbiter;
        this.messageRouter = messageRouter;
        this.profileService = profileService;
        this.defaultRoom = chatProperties.getDefaultRoom();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        notifier.register(session);
        contexts.put(session.getId(), new SessionContext());
        log.debug("WebSocket connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            log.warn("Malformed frame from session {}: {}", session.getId(), ex.getOriginalMessage());
            sendError(session.getId(), null, "Malformed JSON frame");
            return;
        }
        String action = optionalText(payload, "action");
        if (action == null || action.isBlank()) {
            sendError(session.getId(), null, "action is required");
            return;
        }
        String ackId = optionalText(payload, "ackId");
        log.debug("Incoming action {} from session {}", action, session.getId());

        CommandResult result;
        try {
            result = switch (action) {
                case "register-connection" -> handleRegister(session, payload);
                case "join-room" -> handleJoinRoom(session, payload);
                case "leave-room" -> handleLeaveRoom(session, payload);
                case "send-text" -> handleSendText(session, payload);
                case "send-audio" -> handleSendAudio(session, payload);
                case "request-talk-token" -> handleRequestToken(session, payload);
                case "release-talk-token" -> handleReleaseToken(session, payload);
                case "get-rooms" -> CommandResult.ok().with("rooms", roomRegistry.list());
                case "get-users" -> handleGetUsers(payload);
                case "get-profile" -> handleGetProfile(session, payload);
                case "update-profile" -> handleUpdateProfile(session, payload);
                default -> null;
            };
        } catch (ChatException | IllegalArgumentException ex) {
            log.warn("Action {} failed for session {}: {}", action, session.getId(), ex.getMessage());
            result = CommandResult.failure(ex.getMessage());
        }

        if (result == null) {
            sendError(session.getId(), action, "Unknown action: " + action);
            return;
        }
        if (ackId != null) {
            sendAck(session.getId(), action, ackId, result);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        // 방 퇴장과 송신권 회수 알림이 나간 뒤에 세션을 전송 대상에서 뺀다.
        contexts.remove(session.getId());
        try {
            connectionRegistry.disconnect(session.getId());
        } finally {
            notifier.unregister(session.getId());
        }
        log.debug("WebSocket closed: {} ({})", session.getId(), status);
    }

    private CommandResult handleRegister(WebSocketSession session, JsonNode payload) {
        String userId = optionalText(payload, "userId");
        String username = displayName(session, payload);
        List<UserResponse> users = connectionRegistry.connect(session.getId(), userId, username);
        remember(session, userId, username);
        return CommandResult.ok().with("users", users);
    }

    private CommandResult handleJoinRoom(WebSocketSession session, JsonNode payload) {
        // 구버전 클라이언트는 room 필드로 방을 지정한다.
        String roomId = Optional.ofNullable(optionalText(payload, "roomId")).orElse(optionalText(payload, "room"));
        String userId = optionalText(payload, "userId");
        String username = displayName(session, payload);
        try {
            MembershipCoordinator.JoinResult joined = membershipCoordinator.join(session.getId(), userId, username,
                    roomId);
            remember(session, userId, username);
            return CommandResult.ok()
                    .with("roomId", joined.getRoomId())
                    .with("userCount", joined.getUserCount());
        } catch (RoomNotFoundException ex) {
            notifier.send(session.getId(), ServerEvent.of(ServerEventType.JOIN_ERROR)
                    .with("roomId", roomId)
                    .with("message", ex.getMessage()));
            throw ex;
        }
    }

    private CommandResult handleLeaveRoom(WebSocketSession session, JsonNode payload) {
        SessionContext context = contexts.get(session.getId());
        String userId = Optional.ofNullable(optionalText(payload, "userId"))
                .orElse(context == null ? null : context.userId);
        InvalidRequestException.requireText(userId, "userId");
        Optional<String> left = membershipCoordinator.leave(userId);
        return CommandResult.ok().with("roomId", left.orElse(null));
    }

    private CommandResult handleSendText(WebSocketSession session, JsonNode payload) {
        ChatMessage sent = messageRouter.sendText(session.getId(), optionalText(payload, "userId"),
                displayName(session, payload), optionalText(payload, "roomId"), optionalText(payload, "text"));
        return CommandResult.ok()
                .with("id", sent.getId())
                .with("message", MessageResponse.from(sent));
    }

    private CommandResult handleSendAudio(WebSocketSession session, JsonNode payload) {
        String audio = Optional.ofNullable(optionalText(payload, "audio")).orElse(optionalText(payload, "audioData"));
        ChatMessage sent = messageRouter.sendAudio(session.getId(), optionalText(payload, "userId"),
                displayName(session, payload), optionalText(payload, "roomId"), audio);
        return CommandResult.ok()
                .with("id", sent.getId())
                .with("audioUrl", sent.getAudioUrl())
                .with("message", MessageResponse.from(sent));
    }

    private CommandResult handleRequestToken(WebSocketSession session, JsonNode payload) {
        PttArbiter.TalkOutcome outcome = pttArbiter.requestToken(session.getId(), optionalText(payload, "roomId"),
                optionalText(payload, "userId"), displayName(session, payload));
        return switch (outcome.getResult()) {
            case GRANTED -> CommandResult.ok()
                    .with("granted", true)
                    .with("speaker", outcome.getHolder().map(SpeakerResponse::from).orElse(null));
            case DENIED -> CommandResult.ok()
                    .with("granted", false)
                    .with("currentSpeaker", outcome.getHolder().map(SpeakerResponse::from).orElse(null));
            case IGNORED -> CommandResult.failure("Talk token request ignored");
        };
    }

    private CommandResult handleReleaseToken(WebSocketSession session, JsonNode payload) {
        boolean released = pttArbiter.releaseToken(optionalText(payload, "roomId"), optionalText(payload, "userId"));
        return CommandResult.ok().with("released", released);
    }

    private CommandResult handleGetUsers(JsonNode payload) {
        String roomId = Optional.ofNullable(optionalText(payload, "roomId")).orElse(defaultRoom);
        List<UserResponse> members = roomRegistry.members(roomId);
        return CommandResult.ok()
                .with("roomId", roomRegistry.lookup(roomId).getId())
                .with("count", members.size())
                .with("users", members);
    }

    private CommandResult handleGetProfile(WebSocketSession session, JsonNode payload) {
        String userId = Optional.ofNullable(optionalText(payload, "userId")).orElse(contextUserId(session));
        ProfileResponse profile = profileService.getProfile(userId);
        return CommandResult.ok().with("user", profile);
    }

    private CommandResult handleUpdateProfile(WebSocketSession session, JsonNode payload) {
        ProfileUpdateRequest request;
        try {
            request = objectMapper.treeToValue(payload, ProfileUpdateRequest.class);
        } catch (JsonProcessingException ex) {
            throw new InvalidRequestException("Malformed profile payload: " + ex.getOriginalMessage());
        }
        if (request.getUserId() == null) {
            request.setUserId(contextUserId(session));
        }
        ProfileResponse profile = profileService.updateProfile(request);
        return CommandResult.ok()
                .with("message", "Profile updated")
                .with("user", profile);
    }

    private void remember(WebSocketSession session, String userId, String username) {
        SessionContext context = contexts.get(session.getId());
        if (context != null) {
            context.userId = userId;
            context.username = username;
        }
    }

    private String contextUserId(WebSocketSession session) {
        SessionContext context = contexts.get(session.getId());
        return context == null ? null : context.userId;
    }

    private String displayName(WebSocketSession session, JsonNode payload) {
        // 클라이언트마다 username 또는 displayName을 보낸다. 둘 다 없으면 등록 시 이름을 쓴다.
        String name = Optional.ofNullable(optionalText(payload, "username"))
                .orElse(optionalText(payload, "displayName"));
        if (name != null) {
            return name;
        }
        SessionContext context = contexts.get(session.getId());
        return context == null ? null : context.username;
    }

    private String optionalText(JsonNode node, String field) {
        JsonNode valueNode = node.get(field);
        if (valueNode == null || valueNode.isNull()) {
            return null;
        }
        return valueNode.asText();
    }

    private void sendAck(String connectionId, String action, String ackId, CommandResult result) {
        ObjectNode ack = objectMapper.createObjectNode();
        ack.put("type", "ack");
        ack.put("action", action);
        ack.put("ackId", ackId);
        ack.put("success", result.isSuccess());
        if (result.getMessage() != null) {
            ack.put("message", result.getMessage());
        }
        for (Map.Entry<String, Object> entry : result.getPayload().entrySet()) {
            ack.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
        }
        notifier.sendFrame(connectionId, ack);
    }

    private void sendError(String connectionId, String action, String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("type", ServerEventType.ERROR.wireName());
        error.put("action", action);
        error.put("message", message);
        notifier.sendFrame(connectionId, error);
    }

    private static class SessionContext {
        // 세션이 마지막으로 등록/입장한 사용자 정보
        private String userId;
        private String username;
    }
}
