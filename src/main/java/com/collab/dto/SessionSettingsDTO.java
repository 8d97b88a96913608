package com.collab.dto;

import com.collab.exception.InvalidMessageException;
import com.collab.model.SessionSettings;
import lombok.Data;

import java.util.List;

/**
 * Partial settings; unset fields fall back to the defaults passed to {@link #applyTo}.
 */
@Data
public class SessionSettingsDTO {
    private Integer maxMembers;
    private Boolean allowGuests;
    private Boolean readOnly;
    private List<String> authorizedUserIds;

    public SessionSettings applyTo(SessionSettings defaults) {
        SessionSettings.SessionSettingsBuilder builder = defaults.toBuilder();
        if (maxMembers != null) {
            if (maxMembers < 1) {
                throw new InvalidMessageException("maxMembers must be at least 1: " + maxMembers);
            }
            builder.maxMembers(maxMembers);
        }
        if (allowGuests != null) {
            builder.allowGuests(allowGuests);
        }
        if (readOnly != null) {
            builder.readOnly(readOnly);
        }
        if (authorizedUserIds != null) {
            builder.authorizedUserIds(authorizedUserIds);
        }
        return builder.build();
    }
}
