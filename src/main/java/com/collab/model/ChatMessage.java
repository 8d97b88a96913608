package com.collab.model;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class ChatMessage {
    String id;
    String authorId;
    String authorName;
    String authorAvatar;
    String text;
    LocalDateTime timestamp;
}
