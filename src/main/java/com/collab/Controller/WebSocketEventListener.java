package com.collab.Controller;

import com.collab.service.BroadcastDispatcher;
import com.collab.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Removes a user from all its sessions once its last connection closes.
 * A user may hold several connections (one per tab); closing one of them leaves
 * the sessions in place.
 */
@Component
public class WebSocketEventListener {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketEventListener.class);

    private final SessionService sessionService;
    private final BroadcastDispatcher dispatcher;
    private final Map<String, Set<String>> connections = new ConcurrentHashMap<>();

    @Autowired
    public WebSocketEventListener(SessionService sessionService, BroadcastDispatcher dispatcher) {
        this.sessionService = sessionService;
        this.dispatcher = dispatcher;
    }

    @EventListener
    public void onConnect(SessionConnectedEvent event) {
        Principal user = event.getUser();
        String connectionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        if (user == null || connectionId == null) {
            return;
        }
        connections.compute(user.getName(), (id, ids) -> {
            Set<String> result = ids != null ? ids : ConcurrentHashMap.newKeySet();
            result.add(connectionId);
            return result;
        });
        logger.debug("User {} connected on {}", user.getName(), connectionId);
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        Principal user = event.getUser();
        if (user == null) {
            // Messages from such connections are refused, so they own no membership.
            logger.debug("Anonymous connection {} closed", event.getSessionId());
            return;
        }
        if (closeConnection(user.getName(), event.getSessionId())) {
            handleDisconnect(user.getName());
        } else {
            logger.debug("Connection {} of user {} closed, other connections remain",
                    event.getSessionId(), user.getName());
        }
    }

    void handleDisconnect(String userId) {
        logger.info("Last connection for user {} closed, leaving its sessions", userId);
        sessionService.leaveAllSessions(userId);
        dispatcher.release(userId);
    }

    int connectionCount(String userId) {
        Set<String> ids = connections.get(userId);
        return ids == null ? 0 : ids.size();
    }

    /**
     * Forgets the connection; true when the user has no connection left.
     */
    private boolean closeConnection(String userId, String connectionId) {
        boolean[] last = {true};
        connections.computeIfPresent(userId, (id, ids) -> {
            ids.remove(connectionId);
            if (ids.isEmpty()) {
                return null;
            }
            last[0] = false;
            return ids;
        });
        return last[0];
    }
}
