package com.radiochat.model;

/**
 * 사용자 프로필 조회/수정 응답 DTO.
 */
public class ProfileResponse {

    private String id;
    private String username;
    private String fullName;
    private String email;
    private String phone;
    private String avatarUri;
    private boolean online;
    private Long lastLogin;
    private long updatedAt;

    public static ProfileResponse from(UserProfile profile) {
        ProfileResponse response = new ProfileResponse();
        response.setId(profile.getId());
        response.setUsername(profile.getDisplayName());
        response.setFullName(profile.getFullName());
        response.setEmail(profile.getEmail());
        response.setPhone(profile.getPhone());
        response.setAvatarUri(profile.getAvatarUrl());
        response.setOnline(profile.isOnline());
        response.setLastLogin(profile.getLastLoginAt() == null ? null : profile.getLastLoginAt().toEpochMilli());
        response.setUpdatedAt(profile.getUpdatedAt().toEpochMilli());
        return response;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getAvatarUri() {
        return avatarUri;
    }

    public void setAvatarUri(String avatarUri) {
        this.avatarUri = avatarUri;
    }

    public boolean isOnline() {
        return online;
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    public Long getLastLogin() {
        return lastLogin;
    }

    public void setLastLogin(Long lastLogin) {
        this.lastLogin = lastLogin;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
