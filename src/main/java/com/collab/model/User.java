package com.collab.model;

import lombok.Data;

@Data
public class User {
    private final String id;
    private String displayName;
    private String email;
    private String avatarRef;
    private String color;
    private CursorPosition cursor;
    private SelectionRange selection;

    public User(String id, String displayName, String email, String avatarRef) {
        this.id = id;
        this.displayName = displayName;
        this.email = email;
        this.avatarRef = avatarRef;
    }

    public User copy() {
        User copy = new User(id, displayName, email, avatarRef);
        copy.setColor(color);
        copy.setCursor(cursor == null ? null : new CursorPosition(cursor.getLine(), cursor.getColumn()));
        copy.setSelection(selection == null ? null : new SelectionRange(selection.getStart(), selection.getEnd()));
        return copy;
    }

    @Data
    public static class CursorPosition {
        private int line;
        private int column;

        public CursorPosition(int line, int column) {
            this.line = line;
            this.column = column;
        }
    }

    @Data
    public static class SelectionRange {
        private int start;
        private int end;

        public SelectionRange(int start, int end) {
            this.start = start;
            this.end = end;
        }
    }
}
