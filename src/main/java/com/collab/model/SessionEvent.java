package com.collab.model;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Wire-level unit handed to the transport. The payload depends on the type:
 * the joining {@link User} for JOIN, the transformed {@link Edit} for EDIT_APPLIED,
 * a {@link ChatMessage} for CHAT_MESSAGE, a {@link SyncRequest} for SYNC_REQUEST.
 */
@Value
public class SessionEvent {
    SessionEventType type;
    String authorId;
    String sessionId;
    Object payload;
    LocalDateTime timestamp;

    public static SessionEvent of(SessionEventType type, String authorId, String sessionId, Object payload) {
        return new SessionEvent(type, authorId, sessionId, payload, LocalDateTime.now());
    }

    public static SessionEvent join(String sessionId, User user) {
        return of(SessionEventType.JOIN, user.getId(), sessionId, user);
    }

    public static SessionEvent leave(String sessionId, String userId) {
        return of(SessionEventType.LEAVE, userId, sessionId, Map.of("userId", userId));
    }

    public static SessionEvent cursorMoved(String sessionId, String userId, User.CursorPosition cursor) {
        return of(SessionEventType.CURSOR_MOVED, userId, sessionId, cursor);
    }

    public static SessionEvent selectionChanged(String sessionId, String userId, User.SelectionRange selection) {
        return of(SessionEventType.SELECTION_CHANGED, userId, sessionId, selection);
    }

    public static SessionEvent editApplied(String sessionId, Edit edit) {
        return of(SessionEventType.EDIT_APPLIED, edit.getAuthorId(), sessionId, edit);
    }

    public static SessionEvent chat(String sessionId, ChatMessage message) {
        return of(SessionEventType.CHAT_MESSAGE, message.getAuthorId(), sessionId, message);
    }

    public static SessionEvent syncRequest(SyncRequest request) {
        return of(SessionEventType.SYNC_REQUEST, request.getUserId(), request.getSessionId(), request);
    }

    public static SessionEvent error(String sessionId, String userId, ErrorCode code, String message) {
        String text = message == null ? code.name() : message;
        return of(SessionEventType.ERROR, userId, sessionId, Map.of("code", code.name(), "message", text));
    }
}
