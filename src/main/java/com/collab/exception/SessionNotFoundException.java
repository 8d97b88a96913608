package com.collab.exception;

import com.collab.model.ErrorCode;

public class SessionNotFoundException extends CollaborationException {
    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, sessionId, "Session not found: " + sessionId);
    }
}
