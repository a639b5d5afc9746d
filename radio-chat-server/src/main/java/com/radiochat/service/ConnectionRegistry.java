package com.radiochat.service;

import com.radiochat.model.ChatUser;
import com.radiochat.model.ServerEvent;
import com.radiochat.model.ServerEventType;
import com.radiochat.model.UserProfile;
import com.radiochat.model.UserResponse;
import com.radiochat.repository.UserProfileRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 연결 핸들과 사용자 식별자를 매핑하고 온라인 사용자 목록을 관리한다.
 * 실시간 접속 상태가 기준이며, 문서 저장소의 프로필은 최선 노력으로 맞춰 두는 사본이다.
 */
@Service
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ChatStateLock stateLock;
    private final RoomRegistry roomRegistry;
    private final MembershipCoordinator membershipCoordinator;
    private final PttArbiter pttArbiter;
    private final ClientNotifier notifier;
    private final UserProfileRepository profileRepository;
    private final Clock clock;

    private final Map<String, ChatUser> usersById = new LinkedHashMap<>();
    private final Map<String, String> userIdByConnection = new HashMap<>();

    public ConnectionRegistry(ChatStateLock stateLock, RoomRegistry roomRegistry,
            MembershipCoordinator membershipCoordinator, PttArbiter pttArbiter, ClientNotifier notifier,
            UserProfileRepository profileRepository, Clock clock) {
        this.stateLock = stateLock;
        this.roomRegistry = roomRegistry;
        this.membershipCoordinator = membershipCoordinator;
        this.pttArbiter = pttArbiter;
        this.notifier = notifier;
        this.profileRepository = profileRepository;
        this.clock = clock;
    }

    /**
     * 사용자를 온라인으로 등록하고 연결 핸들을 연결한다.
     * 접속자 목록은 모든 연결에, 방 카탈로그는 요청한 연결에만 보낸다.
     *
     * @return 등록 후 온라인 사용자 스냅샷
     */
    public List<UserResponse> connect(String connectionId, String userId, String displayName) {
        InvalidRequestException.requireText(userId, "userId");
        InvalidRequestException.requireText(displayName, "username");
        Instant now = clock.instant();

        Optional<String> replaced = stateLock.call(() -> {
            // 같은 연결이 다른 사용자 ID로 다시 등록하면 이전 사용자는 연결이 끊긴 것으로 처리한다.
            String previousUserId = userIdByConnection.get(connectionId);
            Optional<String> dropped = Optional.empty();
            if (previousUserId != null && !previousUserId.equals(userId)) {
                dropUserLocked(previousUserId);
                dropped = Optional.of(previousUserId);
                log.info("Connection {} re-registered from {} to {}", connectionId, previousUserId, userId);
            }

            ChatUser existing = usersById.get(userId);
            if (existing != null) {
                // 같은 사용자가 새 연결로 들어오면 이전 연결 매핑을 끊고 새 연결로 옮긴다.
                if (existing.getConnectionId() != null && !existing.getConnectionId().equals(connectionId)) {
                    userIdByConnection.remove(existing.getConnectionId());
                    log.info("User {} rebound from connection {} to {}", userId, existing.getConnectionId(),
                            connectionId);
                }
                existing.setConnectionId(connectionId);
                existing.setDisplayName(displayName);
            } else {
                usersById.put(userId, new ChatUser(userId, displayName, connectionId, now));
            }
            userIdByConnection.put(connectionId, userId);
            membershipCoordinator.rebind(userId, displayName, connectionId);
            pttArbiter.moveHolder(userId, connectionId);
            return dropped;
        });
        log.info("ONLINE  ⇢ {}@{} name={}", userId, connectionId, displayName);

        replaced.ifPresent(this::mirrorOffline);
        mirrorOnline(userId, displayName, now);

        List<UserResponse> snapshot = onlineUsers();
        notifier.broadcast(ServerEvent.of(ServerEventType.CONNECTED_USERS).with("users", snapshot));
        notifier.send(connectionId, ServerEvent.of(ServerEventType.ROOM_LIST).with("rooms", roomRegistry.list()));
        return snapshot;
    }

    /**
     * 연결 종료를 처리한다. 이 연결에 묶인 모든 사용자(등록된 사용자와 이 연결로 입장한 사용자)를
     * 방에서 빼고, 이 연결로 부여된 송신권을 회수한 뒤 접속자 목록을 다시 알린다.
     *
     * @return 정리된 사용자 ID 목록(연결에 묶인 사용자가 없으면 비어 있음)
     */
    public List<String> disconnect(String connectionId) {
        List<String> removed = stateLock.call(() -> {
            List<String> userIds = new ArrayList<>();
            String registered = userIdByConnection.remove(connectionId);
            if (registered != null) {
                userIds.add(registered);
            }
            for (String memberId : membershipCoordinator.usersForConnection(connectionId)) {
                ChatUser live = usersById.get(memberId);
                if (live != null && !connectionId.equals(live.getConnectionId())) {
                    // 다른 연결로 등록된 사용자는 살아 있는 연결로 구독을 옮긴다.
                    membershipCoordinator.rebind(memberId, live.getDisplayName(), live.getConnectionId());
                } else if (!userIds.contains(memberId)) {
                    userIds.add(memberId);
                }
            }
            userIds.forEach(this::dropUserLocked);
            pttArbiter.releaseGrantedThrough(connectionId);
            return userIds;
        });

        if (removed.isEmpty()) {
            log.debug("Connection {} closed without a bound user", connectionId);
            return removed;
        }
        log.info("OFFLINE ⇢ {}@{}", removed, connectionId);
        removed.forEach(this::mirrorOffline);
        notifier.broadcast(ServerEvent.of(ServerEventType.CONNECTED_USERS).with("users", onlineUsers()));
        return removed;
    }

    /**
     * 온라인 사용자 스냅샷. 각 항목에는 현재 방 ID가 포함된다.
     */
    public List<UserResponse> onlineUsers() {
        return stateLock.call(() -> usersById.values().stream()
                .map(user -> new UserResponse(user.getId(), user.getDisplayName(), user.isOnline(),
                        membershipCoordinator.currentRoom(user.getId()).orElse(null)))
                .toList());
    }

    public Optional<ChatUser> findUser(String userId) {
        return stateLock.call(() -> Optional.ofNullable(usersById.get(userId)));
    }

    public Optional<String> userIdFor(String connectionId) {
        return stateLock.call(() -> Optional.ofNullable(userIdByConnection.get(connectionId)));
    }

    /**
     * 프로필 수정으로 표시 이름이 바뀌면 실시간 상태에도 반영한다.
     */
    public void rename(String userId, String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return;
        }
        stateLock.run(() -> {
            ChatUser user = usersById.get(userId);
            if (user != null) {
                user.setDisplayName(displayName);
                membershipCoordinator.rebind(userId, displayName, user.getConnectionId());
            }
        });
    }

    private void dropUserLocked(String userId) {
        ChatUser user = usersById.remove(userId);
        if (user != null && user.getConnectionId() != null) {
            userIdByConnection.remove(user.getConnectionId(), userId);
        }
        membershipCoordinator.leave(userId);
        pttArbiter.forceRelease(userId);
    }

    private void mirrorOnline(String userId, String displayName, Instant now) {
        try {
            UserProfile profile = profileRepository.findById(userId)
                    .orElseGet(() -> new UserProfile(userId, displayName, now));
            profile.markOnline(displayName, now);
            profileRepository.save(profile);
        } catch (DataAccessException ex) {
            // 접속 상태는 이미 반영되었으므로 되돌리지 않는다.
            log.warn("Failed to mirror profile of {} as online: {}", userId, ex.getMessage());
        }
    }

    private void mirrorOffline(String userId) {
        try {
            profileRepository.findById(userId).ifPresent(profile -> {
                profile.markOffline(clock.instant());
                profileRepository.save(profile);
            });
        } catch (DataAccessException ex) {
            log.warn("Failed to mirror profile of {} as offline: {}", userId, ex.getMessage());
        }
    }
}
