package com.collab.dto;

import lombok.Data;

@Data
public class SelectionDTO {
    private String userId;
    private int start;
    private int end;
}
