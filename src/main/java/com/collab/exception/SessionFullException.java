package com.collab.exception;

import com.collab.model.ErrorCode;

public class SessionFullException extends CollaborationException {
    public SessionFullException(String sessionId, int maxMembers) {
        super(ErrorCode.SESSION_FULL, sessionId,
                "Session " + sessionId + " is full (" + maxMembers + " members)");
    }
}
