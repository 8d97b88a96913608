package com.collab.Controller;

import com.collab.config.CollaborationProperties;
import com.collab.dto.CreateSessionDTO;
import com.collab.dto.JoinDTO;
import com.collab.exception.InvalidMessageException;
import com.collab.model.Edit;
import com.collab.model.Session;
import com.collab.model.SessionSettings;
import com.collab.model.User;
import com.collab.service.EditService;
import com.collab.service.SessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SessionController {
    private final SessionService sessionService;
    private final EditService editService;
    private final CollaborationProperties properties;

    @Autowired
    public SessionController(SessionService sessionService,
                             EditService editService,
                             CollaborationProperties properties) {
        this.sessionService = sessionService;
        this.editService = editService;
        this.properties = properties;
    }

    @PostMapping("/sessions")
    public ResponseEntity<Session> createSession(@RequestBody CreateSessionDTO request) {
        if (request.getOwner() == null) {
            throw new InvalidMessageException("Session owner is required");
        }
        SessionSettings settings = request.getSettings() == null
                ? null
                : request.getSettings().applyTo(properties.defaultSettings());
        Session session = sessionService.createSession(request.getDocumentId(), request.getOwner().toUser(), settings);
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping("/sessions/{sessionId}")
    public Session getSession(@PathVariable String sessionId) {
        return sessionService.requireSession(sessionId);
    }

    @GetMapping("/sessions/{sessionId}/members")
    public List<User> getMembers(@PathVariable String sessionId) {
        return sessionService.requireSession(sessionId).getMembers();
    }

    @PostMapping("/sessions/{sessionId}/members")
    public Session join(@PathVariable String sessionId, @RequestBody JoinDTO request) {
        if (request.getUser() == null) {
            throw new InvalidMessageException(sessionId, "Joining user is required");
        }
        return sessionService.joinSession(sessionId, request.getUser().toUser());
    }

    @DeleteMapping("/sessions/{sessionId}/members/{userId}")
    public ResponseEntity<Void> leave(@PathVariable String sessionId, @PathVariable String userId) {
        sessionService.leaveSession(sessionId, userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sessions/{sessionId}/edits")
    public List<Edit> getEdits(@PathVariable String sessionId,
                               @RequestParam(name = "since", defaultValue = "0") long since) {
        return editService.getEditsSince(sessionId, since);
    }

    @GetMapping("/users/{userId}/sessions")
    public List<Session> getUserSessions(@PathVariable String userId) {
        return sessionService.getUserSessions(userId);
    }
}
