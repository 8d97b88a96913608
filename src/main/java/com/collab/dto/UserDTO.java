package com.collab.dto;

import com.collab.exception.InvalidMessageException;
import com.collab.model.User;
import lombok.Data;

@Data
public class UserDTO {
    private String id;
    private String displayName;
    private String email;
    private String avatarRef;

    public User toUser() {
        if (id == null || id.isBlank()) {
            throw new InvalidMessageException("User id is required");
        }
        return new User(id, displayName, email, avatarRef);
    }
}
