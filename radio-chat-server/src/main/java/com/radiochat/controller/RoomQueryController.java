package com.radiochat.controller;

import com.radiochat.model.MessageKind;
import com.radiochat.model.Room;
import com.radiochat.model.RoomDetailResponse;
import com.radiochat.model.RoomResponse;
import com.radiochat.model.SpeakerResponse;
import com.radiochat.repository.ChatMessageRepository;
import com.radiochat.service.PersistenceException;
import com.radiochat.service.PttArbiter;
import com.radiochat.service.RoomRegistry;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
public class RoomQueryController {

    private final RoomRegistry roomRegistry;
    private final PttArbiter pttArbiter;
    private final ChatMessageRepository messageRepository;

    public RoomQueryController(RoomRegistry roomRegistry, PttArbiter pttArbiter,
            ChatMessageRepository messageRepository) {
        this.roomRegistry = roomRegistry;
        this.pttArbiter = pttArbiter;
        this.messageRepository = messageRepository;
    }

    @GetMapping
    public ResponseEntity<List<RoomResponse>> listRooms() {
        return ResponseEntity.ok(roomRegistry.list());
    }

    /**
     * 방 상세: 카탈로그 항목, 현재 멤버, 현재 화자, 저장된 메시지 수.
     */
    @GetMapping("/{roomId}")
    public ResponseEntity<RoomDetailResponse> getRoom(@PathVariable String roomId) {
        Room room = roomRegistry.lookup(roomId);
        RoomDetailResponse response = new RoomDetailResponse();
        response.setRoom(roomRegistry.describe(room.getId()));
        response.setMembers(roomRegistry.members(room.getId()));
        response.setCurrentSpeaker(pttArbiter.currentSpeaker(room.getId()).map(SpeakerResponse::from).orElse(null));
        try {
            response.setMessageCount(messageRepository.countByRoomId(room.getId()));
            response.setAudioMessageCount(messageRepository.countByRoomIdAndKind(room.getId(), MessageKind.AUDIO));
        } catch (DataAccessException ex) {
            throw new PersistenceException("Failed to count messages of room " + room.getId(), ex);
        }
        return ResponseEntity.ok(response);
    }
}
