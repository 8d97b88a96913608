package com.collab.dto;

import lombok.Data;

@Data
public class JoinDTO {
    private UserDTO user;
}
