package com.collab.dto;

import lombok.Data;

@Data
public class CreateSessionDTO {
    private String documentId;
    private UserDTO owner;
    private SessionSettingsDTO settings;
    private String requestId;
}
