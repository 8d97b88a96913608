package com.collab.model;

public enum SessionEventType {
    JOIN,
    LEAVE,
    CURSOR_MOVED,
    SELECTION_CHANGED,
    EDIT_APPLIED,
    CHAT_MESSAGE,
    SYNC_REQUEST,
    ERROR
}
