package com.radiochat.service;

import com.radiochat.model.Room;
import com.radiochat.model.ServerEvent;
import com.radiochat.model.ServerEventType;
import com.radiochat.model.SpeakerResponse;
import com.radiochat.model.TalkState;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 방별 송신권(talk token)을 중재한다. 방마다 Idle/Held 두 상태만 존재하며
 * 요청은 대기열 없이 즉시 허용 또는 거절된다. 보유 시간 제한은 없다.
 */
@Service
public class PttArbiter {

    private static final Logger log = LoggerFactory.getLogger(PttArbiter.class);

    private final RoomRegistry roomRegistry;
    private final ChatStateLock stateLock;
    private final ClientNotifier notifier;
    private final Clock clock;

    private final Map<String, TalkState> states = new HashMap<>();

    public PttArbiter(RoomRegistry roomRegistry, ChatStateLock stateLock, ClientNotifier notifier, Clock clock) {
        this.roomRegistry = roomRegistry;
        this.stateLock = stateLock;
        this.notifier = notifier;
        this.clock = clock;
        roomRegistry.list().forEach(room -> states.put(room.getId(), TalkState.IDLE));
    }

    /**
     * 송신권을 요청한다. Idle이면 요청자에게 부여하고 방 전체에 현재 화자를 알린다.
     * Held이면 상태를 바꾸지 않고 요청자에게 현재 보유자를 담아 거절한다.
     */
    public TalkOutcome requestToken(String connectionId, String roomId, String userId, String displayName) {
        Optional<Room> room = roomRegistry.find(roomId);
        if (room.isEmpty() || userId == null || userId.isBlank()) {
            log.debug("Ignoring talk token request room={} user={}", roomId, userId);
            return TalkOutcome.ignored();
        }
        String id = room.get().getId();
        String name = displayName == null || displayName.isBlank() ? userId : displayName;

        return stateLock.call(() -> {
            TalkState state = states.get(id);
            if (state instanceof TalkState.Held held) {
                notifier.send(connectionId, ServerEvent.of(ServerEventType.TOKEN_DENIED)
                        .with("roomId", id)
                        .with("currentSpeaker", SpeakerResponse.from(held)));
                log.info("Talk token denied room={} requester={} holder={}", id, userId, held.getHolderId());
                return TalkOutcome.denied(held);
            }

            TalkState.Held granted = TalkState.held(userId, name, connectionId, clock.instant());
            states.put(id, granted);
            SpeakerResponse speaker = SpeakerResponse.from(granted);
            notifier.send(connectionId, ServerEvent.of(ServerEventType.TOKEN_GRANTED)
                    .with("roomId", id)
                    .with("speaker", speaker));
            notifier.sendAll(roomRegistry.subscriberConnections(id), ServerEvent.of(ServerEventType.CURRENT_SPEAKER_UPDATE)
                    .with("roomId", id)
                    .with("speaker", speaker));
            log.info("Talk token granted room={} holder={}", id, userId);
            return TalkOutcome.granted(granted);
        });
    }

    /**
     * 현재 보유자만 송신권을 반납할 수 있다. 그 외에는 조용히 무시한다.
     *
     * @return 실제로 반납되었는지 여부
     */
    public boolean releaseToken(String roomId, String userId) {
        Optional<Room> room = roomRegistry.find(roomId);
        if (room.isEmpty() || userId == null) {
            return false;
        }
        String id = room.get().getId();
        return stateLock.call(() -> {
            TalkState state = states.get(id);
            if (state instanceof TalkState.Held held && held.isHeldBy(userId)) {
                releaseLocked(id, held);
                return true;
            }
            log.debug("Ignoring talk token release room={} user={} state={}", id, userId, state);
            return false;
        });
    }

    /**
     * 연결이 끊긴 사용자가 보유한 모든 송신권을 회수한다.
     *
     * @return 송신권이 회수된 방 ID 목록
     */
    public List<String> forceRelease(String userId) {
        if (userId == null) {
            return List.of();
        }
        return stateLock.call(() -> {
            List<String> released = new ArrayList<>();
            for (Map.Entry<String, TalkState> entry : states.entrySet()) {
                if (entry.getValue() instanceof TalkState.Held held && held.isHeldBy(userId)) {
                    released.add(entry.getKey());
                }
            }
            for (String roomId : released) {
                TalkState.Held held = (TalkState.Held) states.get(roomId);
                releaseLocked(roomId, held);
                log.info("Talk token reclaimed on disconnect room={} holder={}", roomId, userId);
            }
            return released;
        });
    }

    /**
     * 닫힌 연결을 통해 부여된 모든 송신권을 회수한다. 보유자가 등록하지 않았거나 방에 없던 경우도 포함된다.
     *
     * @return 송신권이 회수된 방 ID 목록
     */
    public List<String> releaseGrantedThrough(String connectionId) {
        if (connectionId == null) {
            return List.of();
        }
        return stateLock.call(() -> {
            List<String> released = new ArrayList<>();
            for (Map.Entry<String, TalkState> entry : states.entrySet()) {
                if (entry.getValue() instanceof TalkState.Held held && held.isGrantedThrough(connectionId)) {
                    released.add(entry.getKey());
                }
            }
            for (String roomId : released) {
                TalkState.Held held = (TalkState.Held) states.get(roomId);
                releaseLocked(roomId, held);
                log.info("Talk token reclaimed on connection close room={} holder={} connection={}", roomId,
                        held.getHolderId(), connectionId);
            }
            return released;
        });
    }

    /**
     * 보유자가 새 연결로 재접속하면 송신권도 새 연결에 묶는다.
     * 이후 이전 연결이 닫혀도 송신권은 유지된다.
     */
    public void moveHolder(String userId, String connectionId) {
        if (userId == null || connectionId == null) {
            return;
        }
        stateLock.run(() -> {
            for (Map.Entry<String, TalkState> entry : states.entrySet()) {
                if (entry.getValue() instanceof TalkState.Held held && held.isHeldBy(userId)
                        && !held.isGrantedThrough(connectionId)) {
                    entry.setValue(held.movedTo(connectionId));
                    log.debug("Talk token of {} in room {} moved to connection {}", userId, entry.getKey(),
                            connectionId);
                }
            }
        });
    }

    public TalkState stateOf(String roomId) {
        Room room = roomRegistry.lookup(roomId);
        return stateLock.call(() -> states.get(room.getId()));
    }

    public Optional<TalkState.Held> currentSpeaker(String roomId) {
        TalkState state = stateOf(roomId);
        if (state instanceof TalkState.Held held) {
            return Optional.of(held);
        }
        return Optional.empty();
    }

    private void releaseLocked(String roomId, TalkState.Held held) {
        states.put(roomId, TalkState.IDLE);
        List<String> subscribers = roomRegistry.subscriberConnections(roomId);
        notifier.sendAll(subscribers, ServerEvent.of(ServerEventType.TOKEN_RELEASED)
                .with("roomId", roomId)
                .with("userId", held.getHolderId())
                .with("username", held.getHolderName()));
        notifier.sendAll(subscribers, ServerEvent.of(ServerEventType.CURRENT_SPEAKER_UPDATE)
                .with("roomId", roomId)
                .with("speaker", null));
        log.info("Talk token released room={} holder={}", roomId, held.getHolderId());
    }

    /**
     * 송신권 요청 결과. DENIED일 때 holder는 현재 보유자, GRANTED일 때는 요청자다.
     */
    public static final class TalkOutcome {

        public enum Result {
            GRANTED,
            DENIED,
            IGNORED
        }

        private final Result result;
        private final TalkState.Held holder;

        private TalkOutcome(Result result, TalkState.Held holder) {
            this.result = result;
            this.holder = holder;
        }

        static TalkOutcome granted(TalkState.Held holder) {
            return new TalkOutcome(Result.GRANTED, holder);
        }

        static TalkOutcome denied(TalkState.Held holder) {
            return new TalkOutcome(Result.DENIED, holder);
        }

        static TalkOutcome ignored() {
            return new TalkOutcome(Result.IGNORED, null);
        }

        public Result getResult() {
            return result;
        }

        public Optional<TalkState.Held> getHolder() {
            return Optional.ofNullable(holder);
        }

        public boolean isGranted() {
            return result == Result.GRANTED;
        }
    }
}
