package com.radiochat.service;

import com.radiochat.model.ServerEvent;
import java.util.Collection;

/**
 * 연결 핸들 단위로 이벤트를 전달하는 출력 포트. 전송 계층(WebSocket)이 구현한다.
 */
public interface ClientNotifier {

    /**
     * 단일 연결로 이벤트를 보낸다. 닫힌 연결은 무시된다.
     */
    void send(String connectionId, ServerEvent event);

    /**
     * 주어진 연결 목록(방 구독자)으로 이벤트를 보낸다.
     */
    default void sendAll(Collection<String> connectionIds, ServerEvent event) {
        for (String connectionId : connectionIds) {
            send(connectionId, event);
        }
    }

    /**
     * 현재 열린 모든 연결로 이벤트를 보낸다.
     */
    void broadcast(ServerEvent event);
}
