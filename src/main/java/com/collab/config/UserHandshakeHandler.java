package com.collab.config;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.security.Principal;
import java.util.Map;

/**
 * Names the connection's principal after the already-authenticated user id passed
 * on the handshake, so per-user destinations reach that connection.
 */
public class UserHandshakeHandler extends DefaultHandshakeHandler {
    public static final String USER_ID_PARAM = "userId";

    @Override
    protected Principal determineUser(ServerHttpRequest request, WebSocketHandler wsHandler,
                                      Map<String, Object> attributes) {
        Principal existing = super.determineUser(request, wsHandler, attributes);
        if (existing != null) {
            return existing;
        }
        String userId = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(USER_ID_PARAM);
        if (userId == null || userId.isBlank()) {
            return null;
        }
        return new UserPrincipal(userId);
    }

    public record UserPrincipal(String name) implements Principal {
        @Override
        public String getName() {
            return name;
        }
    }
}
