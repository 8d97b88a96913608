package com.collab.model;

public enum EditKind {
    INSERT,
    DELETE,
    REPLACE
}
