package com.radiochat.repository;

import com.radiochat.model.MessageKind;

public interface ChatMessageRepositoryCustom {

    long countByRoomId(String roomId);

    long countByRoomIdAndKind(String roomId, MessageKind kind);
}
