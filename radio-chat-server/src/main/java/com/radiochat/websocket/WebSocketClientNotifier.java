package com.radiochat.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.radiochat.config.ChatProperties;
import com.radiochat.model.ServerEvent;
import com.radiochat.service.ClientNotifier;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * 연결 핸들(WebSocket 세션 ID)로 JSON 프레임을 전송한다.
 * 여러 스레드가 같은 세션으로 동시에 팬아웃할 수 있으므로 세션은 데코레이터로 감싸 둔다.
 */
@Component
public class WebSocketClientNotifier implements ClientNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientNotifier.class);

    private final ObjectMapper objectMapper;
    private final ChatProperties.Session sessionProperties;

    // 세션 ID -> 동시 전송 안전한 세션
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public WebSocketClientNotifier(ObjectMapper objectMapper, ChatProperties chatProperties) {
        this.objectMapper = objectMapper;
        this.sessionProperties = chatProperties.getSession();
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session,
                sessionProperties.getSendTimeLimitMillis(), sessionProperties.getSendBufferSizeLimit()));
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
    }

    public int openConnections() {
        return sessions.size();
    }

    @Override
    public void send(String connectionId, ServerEvent event) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null || !session.isOpen()) {
            log.debug("Dropping {} for closed connection {}", event.getType().wireName(), connectionId);
            return;
        }
        send(session, toFrame(event));
    }

    @Override
    public void broadcast(ServerEvent event) {
        ObjectNode frame = toFrame(event);
        for (WebSocketSession session : sessions.values()) {
            if (session.isOpen()) {
                send(session, frame);
            }
        }
    }

    /**
     * 이벤트와 무관한 응답 프레임(ack, error)을 단일 연결로 보낸다.
     */
    void sendFrame(String connectionId, ObjectNode frame) {
        WebSocketSession session = sessions.get(connectionId);
        if (session != null && session.isOpen()) {
            send(session, frame);
        }
    }

    ObjectNode toFrame(ServerEvent event) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", event.getType().wireName());
        for (Map.Entry<String, Object> field : event.getFields().entrySet()) {
            JsonNode value = objectMapper.valueToTree(field.getValue());
            frame.set(field.getKey(), value);
        }
        return frame;
    }

    private void send(WebSocketSession session, ObjectNode frame) {
        try {
            session.sendMessage(new TextMessage(frame.toString()));
        } catch (IOException | SessionLimitExceededException ex) {
            log.error("Failed to send message to session {}", session.getId(), ex);
        }
    }
}
