package com.collab.dto;

import lombok.Data;

@Data
public class ChatDTO {
    private String userId;
    private String text;
}
