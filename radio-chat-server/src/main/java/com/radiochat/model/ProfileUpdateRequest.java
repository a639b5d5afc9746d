package com.radiochat.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * update-profile 요청 본문. avatarUri는 data URL, http(s) URL, 또는 무시되는 로컬 경로일 수 있다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileUpdateRequest {

    private String userId;
    private String username;
    private String fullName;
    private String email;
    private String phone;
    private String avatarUri;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
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
}
