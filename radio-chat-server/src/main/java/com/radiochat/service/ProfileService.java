package com.radiochat.service;

import com.radiochat.model.ProfileResponse;
import com.radiochat.model.ProfileUpdateRequest;
import com.radiochat.model.ServerEvent;
import com.radiochat.model.ServerEventType;
import com.radiochat.model.UserProfile;
import com.radiochat.repository.UserProfileRepository;
import com.radiochat.storage.BlobStore;
import com.radiochat.storage.MediaPayload;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 문서 저장소의 사용자 프로필을 조회/수정한다.
 */
@Service
public class ProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final UserProfileRepository profileRepository;
    private final BlobStore blobStore;
    private final ConnectionRegistry connectionRegistry;
    private final ClientNotifier notifier;
    private final Clock clock;

    public ProfileService(UserProfileRepository profileRepository, BlobStore blobStore,
            ConnectionRegistry connectionRegistry, ClientNotifier notifier, Clock clock) {
        this.profileRepository = profileRepository;
        this.blobStore = blobStore;
        this.connectionRegistry = connectionRegistry;
        this.notifier = notifier;
        this.clock = clock;
    }

    public ProfileResponse getProfile(String userId) {
        InvalidRequestException.requireText(userId, "userId");
        try {
            return profileRepository.findById(userId)
                    .map(ProfileResponse::from)
                    .orElseThrow(() -> new ProfileNotFoundException(userId));
        } catch (DataAccessException ex) {
            throw new PersistenceException("Failed to load profile " + userId + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * 프로필을 수정한다. 아바타는 data URL이면 업로드하고, http(s) URL이면 그대로 쓰며,
     * 그 외(로컬 content:// 경로 등)는 무시하고 이전 값을 유지한다.
     * 수정 결과는 모든 접속자에게 user-updated로 알린다.
     */
    public ProfileResponse updateProfile(ProfileUpdateRequest request) {
        String userId = InvalidRequestException.requireText(request.getUserId(), "userId");
        Instant now = clock.instant();

        UserProfile profile;
        try {
            profile = profileRepository.findById(userId).orElseGet(() -> new UserProfile(userId, request.getUsername(), now));
        } catch (DataAccessException ex) {
            throw new PersistenceException("Failed to load profile " + userId + ": " + ex.getMessage(), ex);
        }

        String avatar = resolveAvatar(userId, request.getAvatarUri(), profile.getAvatarUrl(), now);
        profile.updateDetails(request.getUsername(), blankToEmpty(request.getFullName()),
                blankToEmpty(request.getEmail()), blankToEmpty(request.getPhone()), avatar, now);

        UserProfile saved;
        try {
            saved = profileRepository.save(profile);
        } catch (DataAccessException ex) {
            log.error("Failed to save profile {}: {}", userId, ex.getMessage(), ex);
            throw new PersistenceException("Failed to save profile " + userId + ": " + ex.getMessage(), ex);
        }

        connectionRegistry.rename(userId, saved.getDisplayName());
        ProfileResponse response = ProfileResponse.from(saved);
        notifier.broadcast(ServerEvent.of(ServerEventType.USER_UPDATED).with("user", response));
        log.info("Profile updated for {}", userId);
        return response;
    }

    private String resolveAvatar(String userId, String requested, String previous, Instant now) {
        if (requested == null || requested.isBlank()) {
            return previous;
        }
        if (MediaPayload.isImageDataUrl(requested)) {
            MediaPayload image;
            try {
                image = MediaPayload.decode(requested, "image/jpeg");
            } catch (IllegalArgumentException ex) {
                throw new InvalidRequestException("avatar is not a valid data URL: " + ex.getMessage());
            }
            String path = "avatars/" + userId + "/" + now.toEpochMilli() + "_" + UUID.randomUUID() + "."
                    + image.getExtension();
            return blobStore.store(path, image.getContent(), image.getContentType());
        }
        if (MediaPayload.isHttpUrl(requested)) {
            return requested;
        }
        log.debug("Ignoring local avatar uri for {}: {}", userId, requested);
        return previous;
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value;
    }
}
