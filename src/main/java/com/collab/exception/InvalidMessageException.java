package com.collab.exception;

import com.collab.model.ErrorCode;

public class InvalidMessageException extends CollaborationException {
    public InvalidMessageException(String message) {
        super(ErrorCode.INVALID_MESSAGE, null, message);
    }

    public InvalidMessageException(String sessionId, String message) {
        super(ErrorCode.INVALID_MESSAGE, sessionId, message);
    }
}
