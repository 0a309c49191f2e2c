package com.example.clipflow.gateway;

import com.example.clipflow.security.JwtService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * Authenticates the WebSocket upgrade. Browsers cannot set headers on the upgrade request, so the
 * token may also arrive as the {@code token} query parameter.
 */
@Component
public class GatewayHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GatewayHandshakeInterceptor.class);

    public static final String USER_ATTRIBUTE = "clipflow.user";
    static final String TOKEN_PARAM = "token";

    private final JwtService jwtService;

    public GatewayHandshakeInterceptor(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request, @NonNull ServerHttpResponse response,
                                   @NonNull WebSocketHandler wsHandler, @NonNull Map<String, Object> attributes) {
        Optional<String> username = extractToken(request).flatMap(jwtService::validateToken);
        if (username.isEmpty()) {
            log.warn("[Gateway] Rejected handshake from {}: missing or invalid token", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(USER_ATTRIBUTE, username.get());
        return true;
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request, @NonNull ServerHttpResponse response,
                               @NonNull WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("[Gateway] Handshake failed: {}", exception.getMessage());
        }
    }

    private Optional<String> extractToken(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst(TOKEN_PARAM);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return Optional.of(fromQuery);
        }
        return JwtService.extractBearer(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
    }
}
