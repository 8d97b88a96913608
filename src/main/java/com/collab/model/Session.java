package com.collab.model;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a collaboration session taken at one point in time.
 * Members are copies, so mutating them never reaches the live session.
 */
@Value
public class Session {
    String id;
    String documentId;
    String ownerId;
    LocalDateTime createdAt;
    SessionSettings settings;
    List<User> members;
    long version;

    public int getMemberCount() {
        return members.size();
    }

    public boolean hasMember(String userId) {
        return getMember(userId).isPresent();
    }

    public Optional<User> getMember(String userId) {
        return members.stream()
                .filter(member -> member.getId().equals(userId))
                .findFirst();
    }
}
