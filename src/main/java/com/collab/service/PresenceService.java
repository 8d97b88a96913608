package com.collab.service;

import com.collab.exception.InvalidMessageException;
import com.collab.model.SessionEvent;
import com.collab.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Transient cursor and selection state. Last write wins; updates from users who
 * are not members of the session are ignored.
 */
@Service
public class PresenceService {
    private static final Logger logger = LoggerFactory.getLogger(PresenceService.class);

    private final SessionService sessionService;
    private final BroadcastDispatcher dispatcher;

    @Autowired
    public PresenceService(SessionService sessionService, BroadcastDispatcher dispatcher) {
        this.sessionService = sessionService;
        this.dispatcher = dispatcher;
    }

    public void updateCursor(String sessionId, String userId, User.CursorPosition cursor) {
        if (cursor == null) {
            throw new InvalidMessageException(sessionId, "Cursor position is required");
        }
        sessionService.withSession(sessionId, state -> {
            User member = state.member(userId);
            if (member == null) {
                logger.debug("Ignoring cursor from non-member {} in session {}", userId, sessionId);
                return null;
            }
            member.setCursor(new User.CursorPosition(cursor.getLine(), cursor.getColumn()));
            dispatcher.broadcast(state.memberIds(),
                    SessionEvent.cursorMoved(sessionId, userId,
                            new User.CursorPosition(cursor.getLine(), cursor.getColumn())),
                    userId);
            return null;
        });
    }

    public void updateSelection(String sessionId, String userId, User.SelectionRange selection) {
        if (selection == null) {
            throw new InvalidMessageException(sessionId, "Selection range is required");
        }
        sessionService.withSession(sessionId, state -> {
            User member = state.member(userId);
            if (member == null) {
                logger.debug("Ignoring selection from non-member {} in session {}", userId, sessionId);
                return null;
            }
            member.setSelection(new User.SelectionRange(selection.getStart(), selection.getEnd()));
            dispatcher.broadcast(state.memberIds(),
                    SessionEvent.selectionChanged(sessionId, userId,
                            new User.SelectionRange(selection.getStart(), selection.getEnd())),
                    userId);
            return null;
        });
    }
}
