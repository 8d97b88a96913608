package com.collab.model.ot;

import com.collab.model.Edit;

import java.util.List;

/**
 * Single-direction transform used by the authoritative server: an incoming edit is
 * rewritten so that it applies after edits that were accepted before it.
 * Only the incoming side is transformed; the accepted edits are never rewritten.
 */
public final class OperationalTransform {

    private OperationalTransform() {
    }

    /**
     * Transforms {@code incoming} against each of {@code applied}, oldest first.
     */
    public static Edit transformAll(Edit incoming, List<Edit> applied) {
        Edit transformed = incoming;
        for (Edit edit : applied) {
            transformed = transform(transformed, edit);
        }
        return transformed;
    }

    /**
     * Transforms {@code a} so that it can be applied after {@code b}.
     * Pairs involving a replace are returned unchanged.
     */
    public static Edit transform(Edit a, Edit b) {
        if (a.isInsert() && b.isInsert()) {
            return insertAfterInsert(a, b);
        } else if (a.isDelete() && b.isInsert()) {
            return deleteAfterInsert(a, b);
        } else if (a.isInsert() && b.isDelete()) {
            return insertAfterDelete(a, b);
        } else if (a.isDelete() && b.isDelete()) {
            return deleteAfterDelete(a, b);
        }
        return a;
    }

    private static Edit insertAfterInsert(Edit a, Edit b) {
        if (a.getPosition() < b.getPosition()) {
            return a;
        }
        if (a.getPosition() > b.getPosition()) {
            return a.withPosition(shifted(a.getPosition(), b.contentLength()));
        }
        // Same offset: the lexicographically smaller author keeps the left slot.
        if (a.getAuthorId().compareTo(b.getAuthorId()) < 0) {
            return a;
        }
        return a.withPosition(shifted(a.getPosition(), b.contentLength()));
    }

    private static Edit deleteAfterInsert(Edit a, Edit b) {
        if (a.getPosition() < b.getPosition()) {
            return a;
        }
        return a.withPosition(shifted(a.getPosition(), b.contentLength()));
    }

    private static Edit insertAfterDelete(Edit a, Edit b) {
        if (a.getPosition() <= b.getPosition()) {
            return a;
        }
        if (a.getPosition() > end(b)) {
            return a.withPosition(a.getPosition() - b.getLength());
        }
        return a.withPosition(b.getPosition());
    }

    private static Edit deleteAfterDelete(Edit a, Edit b) {
        long aEnd = end(a);
        long bEnd = end(b);

        if (a.getPosition() < b.getPosition()) {
            // Keep the start, drop the tail that b already removed.
            int overlap = (int) Math.max(0, Math.min(aEnd, bEnd) - b.getPosition());
            return a.withLength(a.getLength() - overlap);
        }
        if (a.getPosition() > b.getPosition()) {
            int shift = Math.min(b.getLength(), a.getPosition() - b.getPosition());
            int overlap = (int) Math.max(0, Math.min(aEnd, bEnd) - a.getPosition());
            return a.withPosition(a.getPosition() - shift)
                    .withLength(a.getLength() - overlap);
        }
        return a.withLength(0);
    }

    // Offsets arrive from the wire; sums are taken in long so they cannot wrap.
    private static long end(Edit edit) {
        return (long) edit.getPosition() + edit.getLength();
    }

    private static int shifted(int position, int by) {
        return (int) Math.min(Integer.MAX_VALUE, (long) position + by);
    }
}
