package com.collab.service;

import com.collab.config.CollaborationProperties;
import com.collab.exception.GuestNotAllowedException;
import com.collab.exception.InvalidMessageException;
import com.collab.exception.SessionFullException;
import com.collab.exception.SessionNotFoundException;
import com.collab.model.Session;
import com.collab.model.SessionEvent;
import com.collab.model.SessionSettings;
import com.collab.model.SyncRequest;
import com.collab.model.User;
import com.collab.model.ot.PendingOperationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of active collaboration sessions and their membership.
 * <p>
 * A session lives exactly as long as it has at least one member. Every mutation of
 * a session runs under that session's lock, which is also the serialization point
 * for edit versioning; distinct sessions never contend.
 */
@Service
public class SessionService {
    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userSessions = new ConcurrentHashMap<>();

    private final IdGenerator idGenerator;
    private final ColorAllocator colorAllocator;
    private final BroadcastDispatcher dispatcher;
    private final CollaborationProperties properties;

    @Autowired
    public SessionService(IdGenerator idGenerator,
                          ColorAllocator colorAllocator,
                          BroadcastDispatcher dispatcher,
                          CollaborationProperties properties) {
        this.idGenerator = idGenerator;
        this.colorAllocator = colorAllocator;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    /**
     * Creates a session with {@code owner} as its only member.
     *
     * @param settings session settings, or null for the configured defaults
     * @throws InvalidMessageException if the settings admit no member
     */
    public Session createSession(String documentId, User owner, SessionSettings settings) {
        requireUser(owner);
        SessionSettings effective = settings != null ? settings : properties.defaultSettings();
        if (effective.getMaxMembers() < 1) {
            throw new InvalidMessageException("maxMembers must be at least 1, got " + effective.getMaxMembers());
        }
        String sessionId = idGenerator.nextId();

        SessionState state = new SessionState(sessionId, documentId, owner.getId(), effective,
                new PendingOperationLog(properties.getLogCapacity(), properties.getLogRetain()));
        User member = owner.copy();
        member.setColor(colorAllocator.colorFor(0));
        state.getMembers().put(member.getId(), member);

        Session snapshot = state.snapshot();
        sessions.put(sessionId, state);
        trackMembership(owner.getId(), sessionId);

        logger.info("Collaboration session {} created for document {} by {}",
                sessionId, documentId, owner.getId());
        return snapshot;
    }

    public Session createSession(String documentId, User owner) {
        return createSession(documentId, owner, null);
    }

    /**
     * Adds {@code user} to the session, announces it to the other members and asks
     * the joiner to sync. Joining again while already a member only repeats the sync.
     *
     * @throws SessionNotFoundException if the session does not exist
     * @throws SessionFullException if the session already holds {@code maxMembers}
     * @throws GuestNotAllowedException if guests are disallowed and the user is not authorized
     */
    public Session joinSession(String sessionId, User user) {
        requireUser(user);
        return withSession(sessionId, state -> {
            if (state.member(user.getId()) != null) {
                requestSync(state, user.getId());
                return state.snapshot();
            }

            SessionSettings settings = state.getSettings();
            if (state.getMembers().size() >= settings.getMaxMembers()) {
                throw new SessionFullException(sessionId, settings.getMaxMembers());
            }
            if (!settings.isAllowGuests() && !isAuthorized(state, user.getId())) {
                throw new GuestNotAllowedException(sessionId, user.getId());
            }

            User member = user.copy();
            member.setColor(colorAllocator.colorFor(state.getMembers().size()));
            member.setCursor(null);
            member.setSelection(null);

            List<String> existing = state.memberIds();
            state.getMembers().put(member.getId(), member);
            trackMembership(member.getId(), sessionId);

            dispatcher.broadcast(existing, SessionEvent.join(sessionId, member.copy()), member.getId());
            requestSync(state, member.getId());

            logger.info("User {} joined session {} ({} members)",
                    member.getId(), sessionId, state.getMembers().size());
            return state.snapshot();
        });
    }

    /**
     * Removes the user from the session; destroys the session when it becomes empty.
     * Unknown sessions and non-members are ignored.
     */
    public void leaveSession(String sessionId, String userId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return;
        }

        state.getLock().lock();
        try {
            if (state.isDestroyed() || state.getMembers().remove(userId) == null) {
                return;
            }
            untrackMembership(userId, sessionId);
            dispatcher.broadcast(state.memberIds(), SessionEvent.leave(sessionId, userId), userId);
            logger.info("User {} left session {}", userId, sessionId);

            if (state.getMembers().isEmpty()) {
                state.markDestroyed();
                sessions.remove(sessionId, state);
                logger.info("Collaboration session {} ended (no members)", sessionId);
            }
        } finally {
            state.getLock().unlock();
        }
    }

    /**
     * Leaves every session the user belongs to. Called when the user's transport goes away.
     */
    public void leaveAllSessions(String userId) {
        Set<String> sessionIds = userSessions.get(userId);
        if (sessionIds == null) {
            return;
        }
        for (String sessionId : new ArrayList<>(sessionIds)) {
            leaveSession(sessionId, userId);
        }
    }

    public Optional<Session> getSession(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        state.getLock().lock();
        try {
            return state.isDestroyed() ? Optional.empty() : Optional.of(state.snapshot());
        } finally {
            state.getLock().unlock();
        }
    }

    public Session requireSession(String sessionId) {
        return getSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public List<User> getActiveMembers(String sessionId) {
        return getSession(sessionId)
                .map(Session::getMembers)
                .orElse(List.of());
    }

    public List<Session> getUserSessions(String userId) {
        Set<String> sessionIds = userSessions.get(userId);
        if (sessionIds == null) {
            return List.of();
        }
        List<Session> result = new ArrayList<>();
        for (String sessionId : sessionIds) {
            getSession(sessionId).ifPresent(result::add);
        }
        return result;
    }

    public int getSessionCount() {
        return sessions.size();
    }

    /**
     * Runs {@code action} on the live session state while holding its lock.
     *
     * @throws SessionNotFoundException if the session is unknown or already destroyed
     */
    <T> T withSession(String sessionId, Function<SessionState, T> action) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            throw new SessionNotFoundException(sessionId);
        }
        state.getLock().lock();
        try {
            if (state.isDestroyed()) {
                throw new SessionNotFoundException(sessionId);
            }
            return action.apply(state);
        } finally {
            state.getLock().unlock();
        }
    }

    private void requestSync(SessionState state, String userId) {
        SyncRequest request = new SyncRequest(state.getId(), userId, state.getCurrentVersion());
        dispatcher.sendTo(userId, SessionEvent.syncRequest(request));
    }

    private boolean isAuthorized(SessionState state, String userId) {
        return state.getOwnerId().equals(userId) || state.getSettings().isAuthorized(userId);
    }

    private void trackMembership(String userId, String sessionId) {
        userSessions.compute(userId, (id, ids) -> {
            Set<String> result = ids != null ? ids : ConcurrentHashMap.newKeySet();
            result.add(sessionId);
            return result;
        });
    }

    // Runs inside the map's compute so a concurrent join cannot lose its fresh queue.
    private void untrackMembership(String userId, String sessionId) {
        userSessions.computeIfPresent(userId, (id, ids) -> {
            ids.remove(sessionId);
            if (ids.isEmpty()) {
                dispatcher.release(userId);
                return null;
            }
            return ids;
        });
    }

    private static void requireUser(User user) {
        if (user == null || user.getId() == null || user.getId().isBlank()) {
            throw new InvalidMessageException("User with a non-blank id is required");
        }
    }
}
