package com.radiochat.model;

public enum MessageKind {
    TEXT,
    AUDIO
}
