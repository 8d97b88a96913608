package com.collab.service;

import com.collab.model.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded mailbox for one user. Events are handed to the transport in the order
 * they were offered; at most one drain task per user runs at a time.
 */
class OutboundQueue {
    private static final Logger logger = LoggerFactory.getLogger(OutboundQueue.class);

    private final String userId;
    private final ArrayBlockingQueue<SessionEvent> pending;
    private final Transport transport;
    private final Executor executor;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    OutboundQueue(String userId, int capacity, Transport transport, Executor executor) {
        this.userId = userId;
        this.pending = new ArrayBlockingQueue<>(capacity);
        this.transport = transport;
        this.executor = executor;
    }

    /**
     * @return false if the queue is full and the event was dropped
     */
    boolean offer(SessionEvent event) {
        if (!pending.offer(event)) {
            return false;
        }
        schedule();
        return true;
    }

    int size() {
        return pending.size();
    }

    void clear() {
        pending.clear();
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            logger.warn("Dispatch executor rejected drain for user {}, {} events pending",
                    userId, pending.size(), e);
        }
    }

    private void drain() {
        try {
            SessionEvent event;
            while ((event = pending.poll()) != null) {
                deliver(event);
            }
        } finally {
            scheduled.set(false);
        }
        // An offer may have landed between the last poll and the reset above.
        if (!pending.isEmpty()) {
            schedule();
        }
    }

    private void deliver(SessionEvent event) {
        try {
            transport.deliver(userId, event);
        } catch (RuntimeException e) {
            logger.warn("Transport failed delivering {} to user {}", event.getType(), userId, e);
        }
    }
}
