package com.example.clipflow.gateway;

import com.example.clipflow.broadcast.BroadcastChannel;
import com.example.clipflow.broadcast.BroadcastSubscription;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.events.ProgressEvent;
import com.example.clipflow.service.WorkUnitService;
import com.example.clipflow.web.dto.StageDescriptor;
import com.example.clipflow.web.dto.WorkUnitResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint streaming work unit progress. A connection subscribes to any number of targets;
 * each subscription is a listener on the broadcast channel for that target.
 * <p>
 * Inbound: {@code subscribe}, {@code unsubscribe}, {@code ping}. Outbound: {@code bootstrap},
 * {@code progress}, {@code pong}, {@code error}. Malformed input never closes the connection.
 */
@Component
public class RealtimeGatewayHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeGatewayHandler.class);

    static final String OP = "op";
    static final String TARGET_ID = "target_id";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, GatewayConnection> connections = new ConcurrentHashMap<>();
    private final BroadcastChannel broadcastChannel;
    private final WorkUnitService workUnitService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration idleTimeout;

    public RealtimeGatewayHandler(BroadcastChannel broadcastChannel,
                                  WorkUnitService workUnitService,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  @Value("${clipflow.gateway.idle-timeout-ms:300000}") long idleTimeoutMs) {
        this.broadcastChannel = broadcastChannel;
        this.workUnitService = workUnitService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.idleTimeout = Duration.ofMillis(idleTimeoutMs);
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        String username = (String) session.getAttributes().get(GatewayHandshakeInterceptor.USER_ATTRIBUTE);
        if (username == null) {
            log.warn("[Gateway] Session {} has no authenticated user, closing", session.getId());
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        connections.put(session.getId(), new GatewayConnection(decorated, username, clock.instant()));
        log.info("[Gateway] Connection {} opened for user {}. Open connections: {}",
                session.getId(), username, connections.size());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        GatewayConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        connection.touch(clock.instant());

        JsonNode request;
        try {
            request = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendError(connection, "Malformed message: not valid JSON");
            return;
        }
        if (request == null || !request.isObject() || !request.path(OP).isTextual()) {
            sendError(connection, "Malformed message: 'op' is required");
            return;
        }

        String op = request.get(OP).asText();
        switch (op) {
            case "subscribe" -> requireTarget(connection, request).ifPresent(target -> subscribe(connection, target));
            case "unsubscribe" -> requireTarget(connection, request).ifPresent(target -> unsubscribe(connection, target));
            case "ping" -> send(connection, objectMapper.createObjectNode().put(OP, "pong"));
            default -> sendError(connection, "Unknown op: " + op);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("[Gateway] Transport error on connection {}: {}", session.getId(), exception.getMessage());
        closeQuietly(session, CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        GatewayConnection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.cancelAll();
            log.info("[Gateway] Connection {} closed ({}). Open connections: {}",
                    session.getId(), status.getCode(), connections.size());
        }
    }

    void subscribe(GatewayConnection connection, String targetId) {
        connection.openStream(targetId);
        BroadcastSubscription subscription = broadcastChannel.subscribe(targetId, event -> deliver(connection, event));
        connection.addSubscription(targetId, subscription);

        // Read after the listener is in place; later commits are held back until the bootstrap is out
        Optional<WorkUnit> latest = workUnitService.findLatestForTarget(targetId);
        if (latest.isPresent() && !latest.get().getOwnerId().equals(connection.username())) {
            connection.removeSubscription(targetId);
            log.warn("[Gateway] User {} tried to subscribe to target {} owned by someone else",
                    connection.username(), targetId);
            sendError(connection, "Access denied for target " + targetId);
            return;
        }

        ObjectNode bootstrap = objectMapper.createObjectNode();
        bootstrap.put(OP, "bootstrap");
        bootstrap.put(TARGET_ID, targetId);
        ProgressEvent snapshot = null;
        if (latest.isPresent()) {
            WorkUnit unit = latest.get();
            snapshot = ProgressEvent.of(unit, clock.instant());
            bootstrap.set("work_unit", objectMapper.valueToTree(WorkUnitResponse.fromEntity(unit)));
        } else {
            bootstrap.putNull("work_unit");
        }
        bootstrap.set("stages", objectMapper.valueToTree(StageDescriptor.all()));
        connection.completeBootstrap(targetId, snapshot, () -> send(connection, bootstrap),
                event -> sendProgress(connection, event));
        log.debug("[Gateway] Connection {} subscribed to {} ({} subscriptions)",
                connection.session().getId(), targetId, connection.subscriptionCount());
    }

    void unsubscribe(GatewayConnection connection, String targetId) {
        if (connection.removeSubscription(targetId)) {
            log.debug("[Gateway] Connection {} unsubscribed from {}", connection.session().getId(), targetId);
        }
    }

    void deliver(GatewayConnection connection, ProgressEvent event) {
        if (!connection.username().equals(event.ownerId())) {
            log.trace("[Gateway] Dropping progress for target {} owned by another user", event.targetId());
            return;
        }
        connection.offer(event, accepted -> sendProgress(connection, accepted));
    }

    /**
     * Closes connections that have sent nothing within the idle timeout.
     */
    @Scheduled(fixedDelayString = "${clipflow.gateway.idle-sweep-ms:60000}")
    public void closeIdleConnections() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        for (GatewayConnection connection : List.copyOf(connections.values())) {
            if (connection.lastActivity().isBefore(cutoff)) {
                log.info("[Gateway] Closing idle connection {} of user {}",
                        connection.session().getId(), connection.username());
                closeQuietly(connection.session(), CloseStatus.GOING_AWAY.withReason("Idle timeout"));
            }
        }
    }

    int openConnections() {
        return connections.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Gateway] Shutting down. Closing {} connections.", connections.size());
        for (GatewayConnection connection : List.copyOf(connections.values())) {
            connection.cancelAll();
            closeQuietly(connection.session(), CloseStatus.GOING_AWAY);
        }
        connections.clear();
    }

    // Helper methods

    private Optional<String> requireTarget(GatewayConnection connection, JsonNode request) {
        JsonNode target = request.path(TARGET_ID);
        if (!target.isTextual() || target.asText().isBlank()) {
            sendError(connection, "Malformed message: 'target_id' is required");
            return Optional.empty();
        }
        return Optional.of(target.asText());
    }

    private void sendProgress(GatewayConnection connection, ProgressEvent event) {
        ObjectNode payload = objectMapper.valueToTree(event);
        payload.remove("owner_id");
        payload.put(OP, "progress");
        send(connection, payload);
    }

    private void sendError(GatewayConnection connection, String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put(OP, "error");
        error.put("message", message);
        send(connection, error);
    }

    private void send(GatewayConnection connection, JsonNode payload) {
        WebSocketSession session = connection.session();
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
        } catch (IOException e) {
            log.warn("[Gateway] Failed to send to connection {}: {}. Closing.", session.getId(), e.getMessage());
            closeQuietly(session, CloseStatus.SESSION_NOT_RELIABLE);
        } catch (RuntimeException e) {
            // SessionLimitExceededException: the decorator already closed the slow session
            log.warn("[Gateway] Connection {} cannot keep up: {}", session.getId(), e.getMessage());
        }
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("[Gateway] Error closing connection {}: {}", session.getId(), e.getMessage());
        }
    }
}
