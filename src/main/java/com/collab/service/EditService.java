package com.collab.service;

import com.collab.exception.InvalidMessageException;
import com.collab.exception.ReadOnlyViolationException;
import com.collab.exception.SessionNotFoundException;
import com.collab.model.Edit;
import com.collab.model.EditKind;
import com.collab.model.SessionEvent;
import com.collab.model.ot.OperationalTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Accepts edits into a session: transforms each against the edits its author had
 * not seen, assigns the next version and records it in the pending log.
 */
@Service
public class EditService {
    private static final Logger logger = LoggerFactory.getLogger(EditService.class);

    private final SessionService sessionService;
    private final IdGenerator idGenerator;
    private final BroadcastDispatcher dispatcher;

    @Autowired
    public EditService(SessionService sessionService, IdGenerator idGenerator, BroadcastDispatcher dispatcher) {
        this.sessionService = sessionService;
        this.idGenerator = idGenerator;
        this.dispatcher = dispatcher;
    }

    /**
     * Applies {@code edit}, whose {@code version} is its base version: the first version
     * its author has not seen, i.e. the last applied version plus one (0 when nothing was seen).
     * Every logged edit at or above the base version is transformed against.
     *
     * @return the transformed edit carrying its authoritative version
     * @throws SessionNotFoundException if the session does not exist
     * @throws ReadOnlyViolationException if the session is read-only and the author is not the owner
     * @throws InvalidMessageException if the edit is malformed
     */
    public Edit applyEdit(String sessionId, Edit edit) {
        validate(sessionId, edit);
        return sessionService.withSession(sessionId, state -> {
            if (state.getSettings().isReadOnly() && !state.getOwnerId().equals(edit.getAuthorId())) {
                throw new ReadOnlyViolationException(sessionId, edit.getAuthorId());
            }

            List<Edit> unseen = state.getLog().since(edit.getVersion());
            Edit transformed = OperationalTransform.transformAll(edit, unseen)
                    .withId(idGenerator.nextId())
                    .withVersion(state.nextVersion());
            state.getLog().append(transformed);

            logger.debug("Session {}: {} by {} at {} (base {}, {} unseen) -> position {} version {}",
                    sessionId, edit.getKind(), edit.getAuthorId(), edit.getPosition(), edit.getVersion(),
                    unseen.size(), transformed.getPosition(), transformed.getVersion());

            dispatcher.broadcast(state.memberIds(), SessionEvent.editApplied(sessionId, transformed),
                    edit.getAuthorId());
            return transformed;
        });
    }

    public long getCurrentVersion(String sessionId) {
        return sessionService.withSession(sessionId, SessionState::getCurrentVersion);
    }

    /**
     * Logged edits with a version of at least {@code version}. Older edits may have
     * been trimmed from the log already.
     */
    public List<Edit> getEditsSince(String sessionId, long version) {
        return sessionService.withSession(sessionId, state -> state.getLog().since(version));
    }

    private static void validate(String sessionId, Edit edit) {
        if (edit == null || edit.getKind() == null) {
            throw new InvalidMessageException(sessionId, "Edit kind is required");
        }
        if (edit.getAuthorId() == null || edit.getAuthorId().isBlank()) {
            throw new InvalidMessageException(sessionId, "Edit author is required");
        }
        if (edit.getPosition() < 0) {
            throw new InvalidMessageException(sessionId, "Edit position must not be negative: " + edit.getPosition());
        }
        if (edit.getLength() < 0) {
            throw new InvalidMessageException(sessionId, "Edit length must not be negative: " + edit.getLength());
        }
        if (edit.getVersion() < 0) {
            throw new InvalidMessageException(sessionId, "Base version must not be negative: " + edit.getVersion());
        }
        if (edit.getKind() != EditKind.DELETE && edit.getContent() == null) {
            throw new InvalidMessageException(sessionId, edit.getKind() + " requires content");
        }
    }
}
