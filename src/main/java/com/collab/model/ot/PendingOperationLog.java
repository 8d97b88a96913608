package com.collab.model.ot;

import com.collab.model.Edit;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded history of the edits most recently applied to one session.
 * Once more than {@code capacity} entries are held, only the newest
 * {@code retain} survive. Not thread-safe; callers hold the session lock.
 */
public class PendingOperationLog {
    public static final int DEFAULT_CAPACITY = 100;
    public static final int DEFAULT_RETAIN = 50;

    private final int capacity;
    private final int retain;
    private List<Edit> entries = new ArrayList<>();

    public PendingOperationLog() {
        this(DEFAULT_CAPACITY, DEFAULT_RETAIN);
    }

    public PendingOperationLog(int capacity, int retain) {
        if (retain <= 0 || retain > capacity) {
            throw new IllegalArgumentException("retain must be in (0, capacity]: " + retain);
        }
        this.capacity = capacity;
        this.retain = retain;
    }

    public void append(Edit edit) {
        entries.add(edit);
        if (entries.size() > capacity) {
            entries = new ArrayList<>(entries.subList(entries.size() - retain, entries.size()));
        }
    }

    /**
     * Entries whose version is at least {@code version}, oldest first.
     */
    public List<Edit> since(long version) {
        List<Edit> result = new ArrayList<>();
        for (Edit edit : entries) {
            if (edit.getVersion() >= version) {
                result.add(edit);
            }
        }
        return result;
    }

    public List<Edit> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public long latestVersion() {
        return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).getVersion();
    }
}
