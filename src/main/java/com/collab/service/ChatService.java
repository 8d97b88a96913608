package com.collab.service;

import com.collab.exception.InvalidMessageException;
import com.collab.model.ChatMessage;
import com.collab.model.SessionEvent;
import com.collab.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class ChatService {
    private static final Logger logger = LoggerFactory.getLogger(ChatService.class);

    private final SessionService sessionService;
    private final IdGenerator idGenerator;
    private final BroadcastDispatcher dispatcher;

    @Autowired
    public ChatService(SessionService sessionService, IdGenerator idGenerator, BroadcastDispatcher dispatcher) {
        this.sessionService = sessionService;
        this.idGenerator = idGenerator;
        this.dispatcher = dispatcher;
    }

    /**
     * Relays a chat message to every other member. The sender keeps its local copy,
     * so it gets no echo.
     *
     * @return the message as sent, or empty if the author is not a member
     */
    public Optional<ChatMessage> sendChatMessage(String sessionId, String authorId, String text) {
        if (text == null) {
            throw new InvalidMessageException(sessionId, "Chat message text is required");
        }
        return sessionService.withSession(sessionId, state -> {
            User author = state.member(authorId);
            if (author == null) {
                logger.debug("Ignoring chat from non-member {} in session {}", authorId, sessionId);
                return Optional.empty();
            }
            ChatMessage message = new ChatMessage(idGenerator.nextId(), authorId, author.getDisplayName(),
                    author.getAvatarRef(), text, LocalDateTime.now());
            dispatcher.broadcast(state.memberIds(), SessionEvent.chat(sessionId, message), authorId);
            return Optional.of(message);
        });
    }
}
