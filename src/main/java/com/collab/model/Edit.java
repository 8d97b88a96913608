package com.collab.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A single text operation against a session's document. Instances are immutable;
 * transforms produce new instances through the {@code with*} methods.
 * <p>
 * {@code version} is the base version (the first version the author has not seen) when submitted,
 * and the authoritative version once the engine has accepted it.
 */
@Value
@With
@Builder(toBuilder = true)
public class Edit {
    String id;
    EditKind kind;
    int position;
    String content;
    int length;
    String authorId;
    long version;

    public static Edit insert(String authorId, int position, String content, long version) {
        return Edit.builder()
                .kind(EditKind.INSERT)
                .authorId(authorId)
                .position(position)
                .content(content)
                .version(version)
                .build();
    }

    public static Edit delete(String authorId, int position, int length, long version) {
        return Edit.builder()
                .kind(EditKind.DELETE)
                .authorId(authorId)
                .position(position)
                .length(length)
                .version(version)
                .build();
    }

    public static Edit replace(String authorId, int position, int length, String content, long version) {
        return Edit.builder()
                .kind(EditKind.REPLACE)
                .authorId(authorId)
                .position(position)
                .length(length)
                .content(content)
                .version(version)
                .build();
    }

    public boolean isInsert() {
        return kind == EditKind.INSERT;
    }

    public boolean isDelete() {
        return kind == EditKind.DELETE;
    }

    public int contentLength() {
        return content == null ? 0 : content.length();
    }

    public boolean isNoOp() {
        return switch (kind) {
            case INSERT -> contentLength() == 0;
            case DELETE -> length == 0;
            case REPLACE -> length == 0 && contentLength() == 0;
        };
    }

    /**
     * Applies this edit to {@code text}. Offsets past the end are clamped to the end.
     */
    public String applyTo(String text) {
        int start = Math.min(position, text.length());
        int end = (int) Math.min((long) start + length, text.length());
        String inserted = content == null ? "" : content;
        return switch (kind) {
            case INSERT -> text.substring(0, start) + inserted + text.substring(start);
            case DELETE -> text.substring(0, start) + text.substring(end);
            case REPLACE -> text.substring(0, start) + inserted + text.substring(end);
        };
    }
}
