package com.radiochat.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 방 하나의 송신권(talk token) 상태. Idle 또는 Held(보유자) 둘 중 하나다.
 */
public sealed interface TalkState permits TalkState.Idle, TalkState.Held {

    Idle IDLE = new Idle();

    static Held held(String holderId, String holderName, String connectionId, Instant since) {
        return new Held(holderId, holderName, connectionId, since);
    }

    /**
     * 아무도 송신권을 갖지 않은 상태.
     */
    final class Idle implements TalkState {

        private Idle() {
        }

        @Override
        public String toString() {
            return "Idle";
        }
    }

    /**
     * 한 사용자가 송신권을 보유한 상태. connectionId는 송신권을 받은 연결이며, 그 연결이 닫히면 송신권도 회수된다.
     */
    final class Held implements TalkState {

        private final String holderId;
        private final String holderName;
        private final String connectionId;
        private final Instant since;

        private Held(String holderId, String holderName, String connectionId, Instant since) {
            this.holderId = Objects.requireNonNull(holderId, "holderId must not be null");
            this.holderName = holderName;
            this.connectionId = Objects.requireNonNull(connectionId, "connectionId must not be null");
            this.since = Objects.requireNonNull(since, "since must not be null");
        }

        public String getHolderId() {
            return holderId;
        }

        public String getHolderName() {
            return holderName;
        }

        public String getConnectionId() {
            return connectionId;
        }

        public Instant getSince() {
            return since;
        }

        public boolean isHeldBy(String userId) {
            return holderId.equals(userId);
        }

        public boolean isGrantedThrough(String connectionId) {
            return this.connectionId.equals(connectionId);
        }

        /**
         * 보유자가 새 연결로 재접속했을 때 사용한다. 보유 시작 시각은 유지된다.
         */
        public Held movedTo(String connectionId) {
            return new Held(holderId, holderName, connectionId, since);
        }

        @Override
        public String toString() {
            return "Held(" + holderId + ")";
        }
    }
}
