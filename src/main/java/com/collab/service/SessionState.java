package com.collab.service;

import com.collab.model.Session;
import com.collab.model.SessionSettings;
import com.collab.model.User;
import com.collab.model.ot.PendingOperationLog;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live, mutable state of one session. Only touched while {@link #lock} is held;
 * everything outside the service package sees {@link Session} snapshots.
 */
@Getter
class SessionState {
    private final String id;
    private final String documentId;
    private final String ownerId;
    private final LocalDateTime createdAt;
    private final SessionSettings settings;
    private final Map<String, User> members = new LinkedHashMap<>();
    private final PendingOperationLog log;
    private final ReentrantLock lock = new ReentrantLock();
    private long currentVersion;
    private boolean destroyed;

    SessionState(String id, String documentId, String ownerId, SessionSettings settings,
                 PendingOperationLog log) {
        this.id = id;
        this.documentId = documentId;
        this.ownerId = ownerId;
        this.settings = settings;
        this.log = log;
        this.createdAt = LocalDateTime.now();
    }

    User member(String userId) {
        return members.get(userId);
    }

    List<String> memberIds() {
        return new ArrayList<>(members.keySet());
    }

    long nextVersion() {
        return ++currentVersion;
    }

    void markDestroyed() {
        destroyed = true;
    }

    Session snapshot() {
        List<User> copies = new ArrayList<>(members.size());
        for (User member : members.values()) {
            copies.add(member.copy());
        }
        return new Session(id, documentId, ownerId, createdAt, settings, List.copyOf(copies), currentVersion);
    }
}
