package com.collab.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class SessionSettings {
    @Builder.Default
    int maxMembers = 10;
    @Builder.Default
    boolean allowGuests = true;
    @Builder.Default
    boolean readOnly = false;

    // Users admitted even when guests are not allowed; the owner always is.
    @Singular
    Set<String> authorizedUserIds;

    public static SessionSettings defaults() {
        return SessionSettings.builder().build();
    }

    public boolean isAuthorized(String userId) {
        return authorizedUserIds.contains(userId);
    }
}
