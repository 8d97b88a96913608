package com.collab.service;

import com.collab.config.CollaborationProperties;
import com.collab.model.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Fans session events out to members through the {@link Transport}.
 * <p>
 * Calls never block on delivery: each event is queued on the recipient's bounded
 * outbound queue and handed to the transport from the dispatch executor. A slow
 * recipient fills its own queue and loses events; it cannot stall the session.
 */
@Service
public class BroadcastDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final Transport transport;
    private final Executor executor;
    private final int queueCapacity;
    private final Map<String, OutboundQueue> queues = new ConcurrentHashMap<>();

    @Autowired
    public BroadcastDispatcher(Transport transport,
                               @Qualifier("collabDispatchExecutor") Executor executor,
                               CollaborationProperties properties) {
        this.transport = transport;
        this.executor = executor;
        this.queueCapacity = properties.getOutboundQueueCapacity();
    }

    /**
     * Queues {@code event} for every member except {@code excludeUserId}, which may be null.
     */
    public void broadcast(Collection<String> memberIds, SessionEvent event, String excludeUserId) {
        for (String memberId : memberIds) {
            if (!memberId.equals(excludeUserId)) {
                sendTo(memberId, event);
            }
        }
    }

    public void sendTo(String userId, SessionEvent event) {
        OutboundQueue queue = queues.computeIfAbsent(userId,
                id -> new OutboundQueue(id, queueCapacity, transport, executor));
        if (!queue.offer(event)) {
            logger.warn("Outbound queue full for user {}, dropping {} event of session {}",
                    userId, event.getType(), event.getSessionId());
        }
    }

    /**
     * Discards the user's outbound queue once it belongs to no session or its connection is gone.
     */
    public void release(String userId) {
        OutboundQueue queue = queues.remove(userId);
        if (queue != null) {
            queue.clear();
        }
    }

    public int queueCount() {
        return queues.size();
    }

    public int pendingFor(String userId) {
        OutboundQueue queue = queues.get(userId);
        return queue == null ? 0 : queue.size();
    }
}
