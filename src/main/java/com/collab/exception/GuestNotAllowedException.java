package com.collab.exception;

import com.collab.model.ErrorCode;

public class GuestNotAllowedException extends CollaborationException {
    public GuestNotAllowedException(String sessionId, String userId) {
        super(ErrorCode.GUEST_NOT_ALLOWED, sessionId,
                "Guests not allowed in session " + sessionId + ": " + userId);
    }
}
