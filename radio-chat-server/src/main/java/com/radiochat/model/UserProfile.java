package com.radiochat.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;

/**
 * 문서 저장소에 미러링되는 사용자 프로필. 실시간 접속 상태의 기준은 ConnectionRegistry다.
 */
@Entity
@Table(name = "user_profiles")
public class UserProfile {

    @Id
    @Column(name = "id", nullable = false, length = 100)
    private String id;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Column(name = "full_name", length = 200)
    private String fullName;

    @Column(name = "email", length = 200)
    private String email;

    @Column(name = "phone", length = 50)
    private String phone;

    @Column(name = "avatar_url", length = 1024)
    private String avatarUrl;

    @Column(name = "online", nullable = false)
    private boolean online;

    @Column(name = "last_login_at")
    private Instant lastLoginAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected UserProfile() {
    }

    public UserProfile(String id, String displayName, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "profile id must not be null");
        this.displayName = displayName;
        this.updatedAt = createdAt == null ? Instant.now() : createdAt;
    }

    /**
     * 접속 시 온라인 상태와 마지막 로그인 시각을 갱신한다.
     */
    public void markOnline(String displayName, Instant at) {
        if (displayName != null && !displayName.isBlank()) {
            this.displayName = displayName;
        }
        this.online = true;
        this.lastLoginAt = at;
        this.updatedAt = at;
    }

    public void markOffline(Instant at) {
        this.online = false;
        this.updatedAt = at;
    }

    public void updateDetails(String displayName, String fullName, String email, String phone, String avatarUrl,
            Instant at) {
        if (displayName != null && !displayName.isBlank()) {
            this.displayName = displayName;
        }
        this.fullName = fullName;
        this.email = email;
        this.phone = phone;
        this.avatarUrl = avatarUrl;
        this.updatedAt = at;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getFullName() {
        return fullName;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public boolean isOnline() {
        return online;
    }

    public Instant getLastLoginAt() {
        return lastLoginAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
