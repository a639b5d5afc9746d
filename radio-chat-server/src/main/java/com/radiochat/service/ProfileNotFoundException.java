package com.radiochat.service;

public class ProfileNotFoundException extends ChatException {

    public ProfileNotFoundException(String userId) {
        super("Profile not found: " + userId);
    }
}
