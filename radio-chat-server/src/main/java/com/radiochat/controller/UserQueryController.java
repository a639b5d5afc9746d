package com.radiochat.controller;

import com.radiochat.model.ProfileResponse;
import com.radiochat.model.UserResponse;
import com.radiochat.service.ConnectionRegistry;
import com.radiochat.service.ProfileService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 온라인 사용자와 저장된 프로필을 조회하는 읽기 전용 REST 컨트롤러.
 */
@RestController
@RequestMapping("/api/users")
public class UserQueryController {

    private final ConnectionRegistry connectionRegistry;
    private final ProfileService profileService;

    public UserQueryController(ConnectionRegistry connectionRegistry, ProfileService profileService) {
        this.connectionRegistry = connectionRegistry;
        this.profileService = profileService;
    }

    @GetMapping
    public ResponseEntity<List<UserResponse>> listOnlineUsers() {
        return ResponseEntity.ok(connectionRegistry.onlineUsers());
    }

    @GetMapping("/{userId}/profile")
    public ResponseEntity<ProfileResponse> getProfile(@PathVariable String userId) {
        return ResponseEntity.ok(profileService.getProfile(userId));
    }
}
