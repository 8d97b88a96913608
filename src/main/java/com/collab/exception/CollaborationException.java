package com.collab.exception;

import com.collab.model.ErrorCode;
import lombok.Getter;

/**
 * Base class for failures a caller can recover from. The embedding layer turns
 * these into protocol responses; none of them is fatal to the process.
 */
@Getter
public abstract class CollaborationException extends RuntimeException {
    private final ErrorCode code;
    private final String sessionId;

    protected CollaborationException(ErrorCode code, String sessionId, String message) {
        super(message);
        this.code = code;
        this.sessionId = sessionId;
    }
}
