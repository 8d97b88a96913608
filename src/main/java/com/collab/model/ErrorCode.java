package com.collab.model;

public enum ErrorCode {
    SESSION_NOT_FOUND,
    SESSION_FULL,
    GUEST_NOT_ALLOWED,
    READ_ONLY_VIOLATION,
    INVALID_MESSAGE
}
