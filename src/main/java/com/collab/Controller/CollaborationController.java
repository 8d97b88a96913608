package com.collab.Controller;

import com.collab.config.CollaborationProperties;
import com.collab.dto.ChatDTO;
import com.collab.dto.CreateSessionDTO;
import com.collab.dto.CursorDTO;
import com.collab.dto.EditDTO;
import com.collab.dto.JoinDTO;
import com.collab.dto.SelectionDTO;
import com.collab.dto.UserActionDTO;
import com.collab.exception.CollaborationException;
import com.collab.exception.InvalidMessageException;
import com.collab.model.Edit;
import com.collab.model.ErrorCode;
import com.collab.model.Session;
import com.collab.model.SessionEvent;
import com.collab.model.SessionSettings;
import com.collab.model.User;
import com.collab.service.ChatService;
import com.collab.service.EditService;
import com.collab.service.PresenceService;
import com.collab.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.HashMap;
import java.util.Map;

/**
 * STOMP entry points for a collaboration session. Events produced by these calls
 * reach the other members through the broadcast dispatcher; failures go back to
 * the calling connection only.
 */
@Controller
public class CollaborationController {
    public static final String SESSION_QUEUE = "/queue/session";
    public static final String EDIT_ACK_QUEUE = "/queue/edit-ack";

    private static final Logger logger = LoggerFactory.getLogger(CollaborationController.class);

    private final SessionService sessionService;
    private final EditService editService;
    private final PresenceService presenceService;
    private final ChatService chatService;
    private final CollaborationProperties properties;
    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public CollaborationController(SessionService sessionService,
                                   EditService editService,
                                   PresenceService presenceService,
                                   ChatService chatService,
                                   CollaborationProperties properties,
                                   SimpMessagingTemplate messagingTemplate) {
        this.sessionService = sessionService;
        this.editService = editService;
        this.presenceService = presenceService;
        this.chatService = chatService;
        this.properties = properties;
        this.messagingTemplate = messagingTemplate;
    }

    @MessageMapping("/session/create")
    public void createSession(@Payload CreateSessionDTO request, Principal principal) {
        if (request.getOwner() == null) {
            throw new InvalidMessageException("Session owner is required");
        }
        User owner = request.getOwner().toUser();
        resolveUserId(principal, owner.getId());

        SessionSettings settings = request.getSettings() == null
                ? null
                : request.getSettings().applyTo(properties.defaultSettings());
        Session session = sessionService.createSession(request.getDocumentId(), owner, settings);

        Map<String, Object> response = new HashMap<>();
        response.put("requestId", request.getRequestId());
        response.put("session", session);
        messagingTemplate.convertAndSendToUser(owner.getId(), SESSION_QUEUE, response);
    }

    @MessageMapping("/session/{sessionId}/join")
    public void join(@DestinationVariable String sessionId, @Payload JoinDTO request, Principal principal) {
        if (request.getUser() == null) {
            throw new InvalidMessageException(sessionId, "Joining user is required");
        }
        User user = request.getUser().toUser();
        resolveUserId(principal, user.getId());

        Session session = sessionService.joinSession(sessionId, user);
        messagingTemplate.convertAndSendToUser(user.getId(), SESSION_QUEUE, Map.of("session", session));
    }

    @MessageMapping("/session/{sessionId}/leave")
    public void leave(@DestinationVariable String sessionId, @Payload UserActionDTO request, Principal principal) {
        sessionService.leaveSession(sessionId, resolveUserId(principal, request.getUserId()));
    }

    @MessageMapping("/session/{sessionId}/cursor")
    public void cursor(@DestinationVariable String sessionId, @Payload CursorDTO request, Principal principal) {
        String userId = resolveUserId(principal, request.getUserId());
        presenceService.updateCursor(sessionId, userId, new User.CursorPosition(request.getLine(), request.getColumn()));
    }

    @MessageMapping("/session/{sessionId}/selection")
    public void selection(@DestinationVariable String sessionId, @Payload SelectionDTO request, Principal principal) {
        String userId = resolveUserId(principal, request.getUserId());
        presenceService.updateSelection(sessionId, userId, new User.SelectionRange(request.getStart(), request.getEnd()));
    }

    @MessageMapping("/session/{sessionId}/edit")
    public void edit(@DestinationVariable String sessionId, @Payload EditDTO request, Principal principal) {
        request.setUserId(resolveUserId(principal, request.getUserId()));
        Edit applied = editService.applyEdit(sessionId, request.toEdit());

        // The author already shows its own edit; it only needs the assigned version and position.
        messagingTemplate.convertAndSendToUser(applied.getAuthorId(), EDIT_ACK_QUEUE, applied);
    }

    @MessageMapping("/session/{sessionId}/chat")
    public void chat(@DestinationVariable String sessionId, @Payload ChatDTO request, Principal principal) {
        chatService.sendChatMessage(sessionId, resolveUserId(principal, request.getUserId()), request.getText());
    }

    @MessageExceptionHandler(CollaborationException.class)
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public SessionEvent handleCollaborationException(CollaborationException e, Principal principal) {
        logger.debug("Rejected message: {}", e.getMessage());
        return SessionEvent.error(e.getSessionId(), principal == null ? null : principal.getName(),
                e.getCode(), e.getMessage());
    }

    @MessageExceptionHandler(MessageConversionException.class)
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public SessionEvent handleMalformedPayload(MessageConversionException e, Principal principal) {
        logger.warn("Malformed collaboration message: {}", e.getMessage());
        return SessionEvent.error(null, principal == null ? null : principal.getName(),
                ErrorCode.INVALID_MESSAGE, "Invalid message");
    }

    /**
     * The connection's principal is authoritative; a payload naming another user is rejected.
     * Connections without a principal cannot be cleaned up on disconnect, so they are refused.
     */
    private static String resolveUserId(Principal principal, String claimedUserId) {
        if (principal == null) {
            throw new InvalidMessageException("Connection has no user; connect with a userId");
        }
        if (claimedUserId != null && !claimedUserId.equals(principal.getName())) {
            throw new InvalidMessageException("User mismatch: connection belongs to " + principal.getName());
        }
        return principal.getName();
    }
}
