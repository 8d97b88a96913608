package com.collab.dto;

import lombok.Data;

@Data
public class UserActionDTO {
    private String userId;
}
