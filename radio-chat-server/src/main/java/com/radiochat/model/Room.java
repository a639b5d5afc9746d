package com.radiochat.model;

import java.util.List;
import java.util.Objects;

/**
 * 고정 방 카탈로그의 한 항목. 서버 기동 후에는 변경되지 않는다.
 */
public final class Room {

    private final String id;
    private final String name;
    private final String description;
    private final RoomType type;
    private final boolean privateRoom;
    private final List<String> aliases;

    public Room(String id, String name, String description, RoomType type, boolean privateRoom,
            List<String> aliases) {
        this.id = Objects.requireNonNull(id, "room id must not be null");
        this.name = name == null ? id : name;
        this.description = description == null ? "" : description;
        this.type = type == null ? RoomType.OTHER : type;
        this.privateRoom = privateRoom;
        this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public RoomType getType() {
        return type;
    }

    public boolean isPrivateRoom() {
        return privateRoom;
    }

    public List<String> getAliases() {
        return aliases;
    }
}
