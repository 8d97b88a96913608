package com.collab.service;

import com.collab.model.SessionEvent;
import com.collab.model.SessionEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Component
public class StompTransport implements Transport {
    public static final String EVENTS_QUEUE = "/queue/collaboration";
    public static final String ERRORS_QUEUE = "/queue/errors";

    private static final Logger logger = LoggerFactory.getLogger(StompTransport.class);

    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public StompTransport(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void deliver(String userId, SessionEvent event) {
        String destination = event.getType() == SessionEventType.ERROR ? ERRORS_QUEUE : EVENTS_QUEUE;
        try {
            messagingTemplate.convertAndSendToUser(userId, destination, event);
        } catch (MessagingException e) {
            logger.warn("Failed to deliver {} event to user {} in session {}",
                    event.getType(), userId, event.getSessionId(), e);
        }
    }
}
