package com.radiochat.repository;

import com.querydsl.jpa.impl.JPAQueryFactory;
import com.radiochat.model.MessageKind;
import com.radiochat.model.QChatMessage;
import org.springframework.stereotype.Repository;

@Repository
public class ChatMessageRepositoryImpl implements ChatMessageRepositoryCustom {

    private final JPAQueryFactory queryFactory;

    public ChatMessageRepositoryImpl(JPAQueryFactory queryFactory) {
        this.queryFactory = queryFactory;
    }

    @Override
    public long countByRoomId(String roomId) {
        QChatMessage message = QChatMessage.chatMessage;
        Long count = queryFactory.select(message.id.count())
                .from(message)
                .where(message.roomId.eq(roomId))
                .fetchOne();
        return count == null ? 0L : count;
    }

    @Override
    public long countByRoomIdAndKind(String roomId, MessageKind kind) {
        QChatMessage message = QChatMessage.chatMessage;
        Long count = queryFactory.select(message.id.count())
                .from(message)
                .where(message.roomId.eq(roomId), message.kind.eq(kind))
                .fetchOne();
        return count == null ? 0L : count;
    }
}
