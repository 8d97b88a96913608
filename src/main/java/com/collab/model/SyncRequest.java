package com.collab.model;

import lombok.Value;

/**
 * Sent to a joining user so it can fetch the document state matching {@code version}.
 * {@code version} is the last applied edit; edits built on that state are submitted
 * with base version {@code version + 1}.
 */
@Value
public class SyncRequest {
    String sessionId;
    String userId;
    long version;
}
