package com.collab.service;

import com.collab.model.SessionEvent;

/**
 * Delivery capability supplied by the embedding system, typically one live
 * connection per user. Implementations report or drop their own failures.
 */
public interface Transport {
    void deliver(String userId, SessionEvent event);
}
