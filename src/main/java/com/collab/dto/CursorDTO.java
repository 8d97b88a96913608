package com.collab.dto;

import lombok.Data;

@Data
public class CursorDTO {
    private String userId;
    private int line;
    private int column;
}
