package com.collab.exception;

import com.collab.model.ErrorCode;

public class ReadOnlyViolationException extends CollaborationException {
    public ReadOnlyViolationException(String sessionId, String userId) {
        super(ErrorCode.READ_ONLY_VIOLATION, sessionId,
                "Session " + sessionId + " is read-only for " + userId);
    }
}
