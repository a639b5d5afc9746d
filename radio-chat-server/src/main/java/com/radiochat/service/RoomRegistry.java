package com.radiochat.service;

import com.radiochat.config.ChatProperties;
import com.radiochat.model.Room;
import com.radiochat.model.RoomResponse;
import com.radiochat.model.UserResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 고정 방 카탈로그와 방별 멤버(구독자) 목록을 인메모리로 관리한다.
 * 카탈로그는 기동 시 한 번 만들어지며, 멤버 목록은 MembershipCoordinator만 변경한다.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ChatStateLock stateLock;
    private final int maxRoomCapacity;

    private final Map<String, Room> rooms;
    private final Map<String, String> aliases;
    // 방 ID -> (사용자 ID -> 멤버), 입장 순서를 유지한다.
    private final Map<String, Map<String, RoomMember>> members = new HashMap<>();

    public RoomRegistry(ChatProperties properties, ChatStateLock stateLock) {
        this.stateLock = stateLock;
        this.maxRoomCapacity = properties.getMaxRoomCapacity();

        Map<String, Room> catalog = new LinkedHashMap<>();
        Map<String, String> aliasIndex = new HashMap<>();
        for (ChatProperties.RoomDefinition definition : properties.getRooms()) {
            String id = InvalidRequestException.requireText(definition.getId(), "chat.rooms[].id");
            if (catalog.containsKey(id)) {
                throw new IllegalStateException("Duplicate room id in catalog: " + id);
            }
            Room room = new Room(id, definition.getName(), definition.getDescription(), definition.getType(),
                    definition.isPrivateRoom(), definition.getAliases());
            catalog.put(id, room);
            members.put(id, new LinkedHashMap<>());
            for (String alias : room.getAliases()) {
                aliasIndex.putIfAbsent(alias, id);
            }
        }
        this.rooms = Collections.unmodifiableMap(catalog);
        this.aliases = Collections.unmodifiableMap(aliasIndex);
        log.info("Room catalog initialized: {}", rooms.keySet());
    }

    /**
     * 실시간 멤버 수를 포함한 방 카탈로그 스냅샷을 반환한다.
     */
    public List<RoomResponse> list() {
        return stateLock.call(() -> rooms.values().stream()
                .map(this::toResponse)
                .toList());
    }

    /**
     * 방 ID 또는 별칭으로 방을 조회한다. 없으면 RoomNotFoundException.
     */
    public Room lookup(String roomId) {
        return find(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    public Optional<Room> find(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        Room room = rooms.get(roomId);
        if (room == null && aliases.containsKey(roomId)) {
            room = rooms.get(aliases.get(roomId));
        }
        return Optional.ofNullable(room);
    }

    public RoomResponse describe(String roomId) {
        Room room = lookup(roomId);
        return stateLock.call(() -> toResponse(room));
    }

    /**
     * 방에 참여 중인 멤버 스냅샷을 입장 순서대로 반환한다.
     */
    public List<UserResponse> members(String roomId) {
        Room room = lookup(roomId);
        return stateLock.call(() -> members.get(room.getId()).values().stream()
                .map(member -> new UserResponse(member.getUserId(), member.getDisplayName(), true, room.getId()))
                .toList());
    }

    public int memberCount(String roomId) {
        Room room = lookup(roomId);
        return stateLock.call(() -> members.get(room.getId()).size());
    }

    /**
     * 방 구독자의 연결 핸들 목록. 팬아웃 대상이다.
     */
    public List<String> subscriberConnections(String roomId) {
        Room room = lookup(roomId);
        return stateLock.call(() -> {
            List<String> connections = new ArrayList<>();
            for (RoomMember member : members.get(room.getId()).values()) {
                if (member.getConnectionId() != null) {
                    connections.add(member.getConnectionId());
                }
            }
            return connections;
        });
    }

    public int getMaxRoomCapacity() {
        return maxRoomCapacity;
    }

    // 아래 변경 메서드는 ChatStateLock을 잡은 MembershipCoordinator에서만 호출된다.

    int addMember(String roomId, String userId, String displayName, String connectionId) {
        Map<String, RoomMember> roomMembers = members.get(roomId);
        RoomMember existing = roomMembers.get(userId);
        if (existing != null) {
            existing.rebind(displayName, connectionId);
        } else {
            roomMembers.put(userId, new RoomMember(userId, displayName, connectionId));
        }
        return roomMembers.size();
    }

    int removeMember(String roomId, String userId) {
        Map<String, RoomMember> roomMembers = members.get(roomId);
        roomMembers.remove(userId);
        return roomMembers.size();
    }

    String displayNameOf(String roomId, String userId) {
        RoomMember member = members.get(roomId).get(userId);
        return member == null ? userId : member.getDisplayName();
    }

    void rebindMember(String roomId, String userId, String displayName, String connectionId) {
        RoomMember member = members.get(roomId).get(userId);
        if (member != null) {
            member.rebind(displayName, connectionId);
        }
    }

    /**
     * 한 연결이 여러 사용자 ID로 입장했을 수 있으므로 일치하는 멤버를 모두 돌려준다.
     */
    List<RoomMember> membersByConnection(String connectionId) {
        List<RoomMember> matched = new ArrayList<>();
        for (Map<String, RoomMember> roomMembers : members.values()) {
            for (RoomMember member : roomMembers.values()) {
                if (connectionId.equals(member.getConnectionId())) {
                    matched.add(member);
                }
            }
        }
        return matched;
    }

    private RoomResponse toResponse(Room room) {
        RoomResponse response = new RoomResponse();
        response.setId(room.getId());
        response.setName(room.getName());
        response.setDescription(room.getDescription());
        response.setType(room.getType());
        response.setPrivateRoom(room.isPrivateRoom());
        response.setUserCount(members.get(room.getId()).size());
        response.setMaxUsers(maxRoomCapacity);
        return response;
    }
}
