package com.collab.dto;

import com.collab.exception.InvalidMessageException;
import com.collab.model.Edit;
import com.collab.model.EditKind;
import lombok.Data;

import java.util.Locale;

@Data
public class EditDTO {
    private String userId;
    private String kind;        // "insert", "delete", "replace"
    private int position;
    private String content;
    private int length;
    private long baseVersion;

    public Edit toEdit() {
        return Edit.builder()
                .kind(parseKind())
                .authorId(userId)
                .position(position)
                .content(content)
                .length(length)
                .version(baseVersion)
                .build();
    }

    private EditKind parseKind() {
        if (kind == null) {
            throw new InvalidMessageException("Edit kind is required");
        }
        try {
            return EditKind.valueOf(kind.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidMessageException("Unknown edit kind: " + kind);
        }
    }
}
