package com.radiochat.config;

import com.radiochat.model.RoomType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * application.yml의 chat 설정 값을 바인딩하기 위한 POJO.
 * 서버 기동 시 고정으로 생성될 방 목록과 세션 전송 제한을 담는다.
 */
@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    @Min(1)
    private int maxRoomCapacity = 50;
    @NotBlank
    private String defaultRoom = "general";
    @Valid
    @NotEmpty
    private List<RoomDefinition> rooms = defaultRooms();
    @Valid
    private Session session = new Session();

    public int getMaxRoomCapacity() {
        return maxRoomCapacity;
    }

    public void setMaxRoomCapacity(int maxRoomCapacity) {
        this.maxRoomCapacity = maxRoomCapacity;
    }

    public String getDefaultRoom() {
        return defaultRoom;
    }

    public void setDefaultRoom(String defaultRoom) {
        this.defaultRoom = defaultRoom;
    }

    public List<RoomDefinition> getRooms() {
        return rooms;
    }

    public void setRooms(List<RoomDefinition> rooms) {
        this.rooms = rooms == null || rooms.isEmpty() ? defaultRooms() : new ArrayList<>(rooms);
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    /**
     * 설정이 비어 있을 때 사용하는 기본 방 목록(로비, 일반, 무전).
     */
    public static List<RoomDefinition> defaultRooms() {
        List<RoomDefinition> defaults = new ArrayList<>();
        defaults.add(new RoomDefinition("lobby", "Lobby", "Waiting area for newly connected users", RoomType.LOBBY));
        defaults.add(new RoomDefinition("general", "General", "Open text and voice chat", RoomType.GENERAL));
        defaults.add(new RoomDefinition("handy", "Handy", "Push-to-talk radio channel", RoomType.PTT_RADIO));
        return defaults;
    }

    /**
     * 고정 방 하나의 정의.
     */
    public static class RoomDefinition {
        @NotBlank
        private String id;
        private String name;
        private String description;
        private RoomType type = RoomType.OTHER;
        private boolean privateRoom;
        private List<String> aliases = new ArrayList<>();

        public RoomDefinition() {
        }

        public RoomDefinition(String id, String name, String description, RoomType type) {
            this.id = id;
            this.name = name;
            this.description = description;
            this.type = type;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public RoomType getType() {
            return type;
        }

        public void setType(RoomType type) {
            this.type = type;
        }

        public boolean isPrivateRoom() {
            return privateRoom;
        }

        public void setPrivateRoom(boolean privateRoom) {
            this.privateRoom = privateRoom;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases == null ? new ArrayList<>() : new ArrayList<>(aliases);
        }
    }

    /**
     * WebSocket 세션 전송 제한. 느린 클라이언트가 팬아웃 전체를 막지 않도록 한다.
     */
    public static class Session {
        @Min(1)
        private int sendTimeLimitMillis = 10_000;
        @Min(1024)
        private int sendBufferSizeLimit = 512 * 1024;

        public int getSendTimeLimitMillis() {
            return sendTimeLimitMillis;
        }

        public void setSendTimeLimitMillis(int sendTimeLimitMillis) {
            this.sendTimeLimitMillis = sendTimeLimitMillis;
        }

        public int getSendBufferSizeLimit() {
            return sendBufferSizeLimit;
        }

        public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
            this.sendBufferSizeLimit = sendBufferSizeLimit;
        }
    }
}
