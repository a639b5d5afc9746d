package com.radiochat.service;

import com.radiochat.model.Room;
import com.radiochat.model.ServerEvent;
import com.radiochat.model.ServerEventType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 사용자당 활성 방은 최대 하나라는 규칙을 지키며 입장/이동/퇴장을 처리한다.
 * 멤버십 인덱스(사용자 -> 방)와 RoomRegistry의 멤버 목록은 항상 함께 변경된다.
 */
@Service
public class MembershipCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MembershipCoordinator.class);

    private final RoomRegistry roomRegistry;
    private final ChatStateLock stateLock;
    private final ClientNotifier notifier;

    private final Map<String, String> roomByUser = new HashMap<>();

    public MembershipCoordinator(RoomRegistry roomRegistry, ChatStateLock stateLock, ClientNotifier notifier) {
        this.roomRegistry = roomRegistry;
        this.stateLock = stateLock;
        this.notifier = notifier;
    }

    /**
     * 사용자를 방에 입장시킨다. 다른 방에 있으면 먼저 그 방에서 빼고 남은 멤버에게 알린다.
     * 퇴장과 입장은 하나의 락 구간에서 수행되어 중간 상태가 관찰되지 않는다.
     */
    public JoinResult join(String connectionId, String userId, String displayName, String roomId) {
        InvalidRequestException.requireText(roomId, "roomId");
        InvalidRequestException.requireText(userId, "userId");
        InvalidRequestException.requireText(displayName, "username");
        Room room = roomRegistry.lookup(roomId);

        return stateLock.call(() -> {
            String previousRoomId = roomByUser.get(userId);
            if (room.getId().equals(previousRoomId)) {
                // 같은 방 재입장은 연결만 갱신한다.
                roomRegistry.rebindMember(room.getId(), userId, displayName, connectionId);
                int count = roomRegistry.memberCount(room.getId());
                notifier.send(connectionId, joinSuccess(room, count));
                return new JoinResult(room.getId(), count, previousRoomId);
            }

            if (previousRoomId != null) {
                int remaining = roomRegistry.removeMember(previousRoomId, userId);
                roomByUser.remove(userId);
                notifier.sendAll(roomRegistry.subscriberConnections(previousRoomId),
                        userLeft(previousRoomId, userId, displayName, remaining));
                log.info("User {} left room {} (transfer), remaining={}", userId, previousRoomId, remaining);
            }

            int count = roomRegistry.addMember(room.getId(), userId, displayName, connectionId);
            roomByUser.put(userId, room.getId());

            notifier.send(connectionId, joinSuccess(room, count));
            notifier.sendAll(roomRegistry.subscriberConnections(room.getId()), ServerEvent.of(ServerEventType.USER_JOINED)
                    .with("roomId", room.getId())
                    .with("userId", userId)
                    .with("username", displayName)
                    .with("userCount", count));
            log.info("User {} joined room {}, total={}", userId, room.getId(), count);
            return new JoinResult(room.getId(), count, previousRoomId);
        });
    }

    /**
     * 사용자를 현재 방에서 뺀다. 방이 없으면 아무 일도 하지 않는다.
     *
     * @return 사용자가 떠난 방 ID
     */
    public Optional<String> leave(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return stateLock.call(() -> {
            String roomId = roomByUser.remove(userId);
            if (roomId == null) {
                return Optional.empty();
            }
            String displayName = roomRegistry.displayNameOf(roomId, userId);
            int remaining = roomRegistry.removeMember(roomId, userId);
            notifier.sendAll(roomRegistry.subscriberConnections(roomId),
                    userLeft(roomId, userId, displayName, remaining));
            log.info("User {} left room {}, remaining={}", userId, roomId, remaining);
            return Optional.of(roomId);
        });
    }

    public Optional<String> currentRoom(String userId) {
        return stateLock.call(() -> Optional.ofNullable(roomByUser.get(userId)));
    }

    /**
     * 재접속으로 연결 핸들이 바뀌면 방 구독 정보도 새 연결로 옮긴다.
     */
    public void rebind(String userId, String displayName, String connectionId) {
        stateLock.run(() -> {
            String roomId = roomByUser.get(userId);
            if (roomId != null) {
                roomRegistry.rebindMember(roomId, userId, displayName, connectionId);
            }
        });
    }

    /**
     * 이 연결로 방에 들어와 있는 모든 사용자 ID를 찾는다.
     */
    public List<String> usersForConnection(String connectionId) {
        return stateLock.call(() -> roomRegistry.membersByConnection(connectionId).stream()
                .map(RoomMember::getUserId)
                .toList());
    }

    private ServerEvent joinSuccess(Room room, int count) {
        return ServerEvent.of(ServerEventType.JOIN_SUCCESS)
                .with("roomId", room.getId())
                .with("roomName", room.getName())
                .with("userCount", count);
    }

    private ServerEvent userLeft(String roomId, String userId, String displayName, int remaining) {
        return ServerEvent.of(ServerEventType.USER_LEFT)
                .with("roomId", roomId)
                .with("userId", userId)
                .with("username", displayName)
                .with("userCount", remaining);
    }

    /**
     * 입장 결과. previousRoomId는 이동 전 방(없으면 null).
     */
    public static class JoinResult {
        private final String roomId;
        private final int userCount;
        private final String previousRoomId;

        public JoinResult(String roomId, int userCount, String previousRoomId) {
            this.roomId = roomId;
            this.userCount = userCount;
            this.previousRoomId = previousRoomId;
        }

        public String getRoomId() {
            return roomId;
        }

        public int getUserCount() {
            return userCount;
        }

        public String getPreviousRoomId() {
            return previousRoomId;
        }
    }
}
