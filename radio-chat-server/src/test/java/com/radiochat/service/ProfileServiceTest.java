package com.radiochat.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.radiochat.model.ProfileResponse;
import com.radiochat.model.ProfileUpdateRequest;
import com.radiochat.model.ServerEventType;
import com.radiochat.model.UserProfile;
import com.radiochat.repository.UserProfileRepository;
import com.radiochat.storage.BlobStore;
import java.util.Base64;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class ProfileServiceTest {

    private RecordingNotifier notifier;
    private UserProfileRepository profileRepository;
    private BlobStore blobStore;
    private ConnectionRegistry connectionRegistry;
    private ProfileService profileService;

    @BeforeEach
    void setUp() {
        ChatStateLock lock = new ChatStateLock();
        notifier = new RecordingNotifier();
        profileRepository = mock(UserProfileRepository.class);
        blobStore = mock(BlobStore.class);
        when(profileRepository.findById(anyString())).thenReturn(Optional.empty());
        when(profileRepository.save(any(UserProfile.class))).thenAnswer(invocation -> invocation.getArgument(0));
        RoomRegistry roomRegistry = new RoomRegistry(ChatFixtures.properties(), lock);
        MembershipCoordinator coordinator = new MembershipCoordinator(roomRegistry, lock, notifier);
        PttArbiter arbiter = new PttArbiter(roomRegistry, lock, notifier, ChatFixtures.clock());
        connectionRegistry = new ConnectionRegistry(lock, roomRegistry, coordinator, arbiter, notifier,
                profileRepository, ChatFixtures.clock());
        profileService = new ProfileService(profileRepository, blobStore, connectionRegistry, notifier,
                ChatFixtures.clock());
    }

    @Test
    void getProfileRequiresExistingProfile() {
        assertThatThrownBy(() -> profileService.getProfile(""))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> profileService.getProfile("u1"))
                .isInstanceOf(ProfileNotFoundException.class);
    }

    @Test
    void getProfileReturnsStoredFields() {
        UserProfile stored = new UserProfile("u1", "Ana", ChatFixtures.NOW);
        stored.updateDetails("Ana", "Ana Perez", "ana@example.com", "555", "http://cdn/ana.jpg", ChatFixtures.NOW);
        when(profileRepository.findById("u1")).thenReturn(Optional.of(stored));

        ProfileResponse profile = profileService.getProfile("u1");

        assertThat(profile.getFullName()).isEqualTo("Ana Perez");
        assertThat(profile.getAvatarUri()).isEqualTo("http://cdn/ana.jpg");
    }

    @Test
    void dataUrlAvatarIsUploaded() {
        when(blobStore.store(anyString(), any(byte[].class), anyString())).thenReturn("http://media/avatars/u1/a.png");
        ProfileUpdateRequest request = request("data:image/png;base64,"
                + Base64.getEncoder().encodeToString(new byte[] {9, 8, 7}));

        ProfileResponse updated = profileService.updateProfile(request);

        verify(blobStore).store(startsWith("avatars/u1/" + ChatFixtures.NOW.toEpochMilli() + "_"), any(byte[].class),
                eq("image/png"));
        assertThat(updated.getAvatarUri()).isEqualTo("http://media/avatars/u1/a.png");
        assertThat(notifier.eventsTo(RecordingNotifier.BROADCAST, ServerEventType.USER_UPDATED)).hasSize(1);
    }

    @Test
    void httpAvatarIsKeptAsIs() {
        ProfileResponse updated = profileService.updateProfile(request("https://cdn.example.com/ana.jpg"));

        assertThat(updated.getAvatarUri()).isEqualTo("https://cdn.example.com/ana.jpg");
        verify(blobStore, never()).store(anyString(), any(byte[].class), anyString());
    }

    @Test
    void localAvatarUriKeepsPreviousAvatar() {
        UserProfile stored = new UserProfile("u1", "Ana", ChatFixtures.NOW);
        stored.updateDetails("Ana", "", "", "", "http://cdn/old.jpg", ChatFixtures.NOW);
        when(profileRepository.findById("u1")).thenReturn(Optional.of(stored));

        ProfileResponse updated = profileService.updateProfile(request("content://media/external/images/1"));

        assertThat(updated.getAvatarUri()).isEqualTo("http://cdn/old.jpg");
    }

    @Test
    void updateRenamesOnlineUser() {
        connectionRegistry.connect("c1", "u1", "Ana");
        ProfileUpdateRequest request = request(null);
        request.setUsername("Ana Maria");

        profileService.updateProfile(request);

        assertThat(connectionRegistry.findUser("u1"))
                .hasValueSatisfying(user -> assertThat(user.getDisplayName()).isEqualTo("Ana Maria"));
    }

    @Test
    void saveFailureIsReportedWithoutBroadcast() {
        when(profileRepository.save(any(UserProfile.class)))
                .thenThrow(new DataAccessResourceFailureException("store down"));

        assertThatThrownBy(() -> profileService.updateProfile(request(null)))
                .isInstanceOf(PersistenceException.class);
        assertThat(notifier.eventsOfType(ServerEventType.USER_UPDATED)).isEmpty();
    }

    private static ProfileUpdateRequest request(String avatarUri) {
        ProfileUpdateRequest request = new ProfileUpdateRequest();
        request.setUserId("u1");
        request.setUsername("Ana");
        request.setFullName("Ana Perez");
        request.setEmail("ana@example.com");
        request.setPhone("555");
        request.setAvatarUri(avatarUri);
        return request;
    }
}
