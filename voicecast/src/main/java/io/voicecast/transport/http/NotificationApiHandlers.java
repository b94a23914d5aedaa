package io.voicecast.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import io.voicecast.application.service.NotificationService;
import io.voicecast.application.service.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * HTTP handlers for the trigger API.
 *
 * Provides REST API for:
 * - POST /api/notify - Queue a notification ({"target": "...", "text": "..."})
 * - GET /api/targets - List known targets
 * - GET /api/health - Liveness and queue depth
 */
public final class NotificationApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(NotificationApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final NotificationService service;
    private final TargetRegistry registry;

    public NotificationApiHandlers(NotificationService service, TargetRegistry registry) {
        this.service = service;
        this.registry = registry;
    }

    /**
     * Route table for the API listener. {@code metricsHandler} is mounted at /metrics when present.
     */
    public RoutingHandler routes(HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .post("/api/notify", this::submitNotification)
            .get("/api/targets", this::targets)
            .get("/api/health", this::health)
            .setFallbackHandler(exchange -> sendError(exchange, StatusCodes.NOT_FOUND, "Not found"))
            .setInvalidMethodHandler(exchange -> sendError(exchange, StatusCodes.METHOD_NOT_ALLOWED, "Method not allowed"));
        if (metricsHandler != null) {
            routes.get("/metrics", metricsHandler);
        }
        return routes;
    }

    /**
     * POST /api/notify
     *
     * Queues the notification and answers 202 without waiting for playback. A missing target
     * falls back to the default target.
     */
    public void submitNotification(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                JsonNode json = MAPPER.readTree(body);
                if (json == null || !json.isObject()) {
                    sendError(ex, StatusCodes.BAD_REQUEST, "Request body must be a JSON object");
                    return;
                }

                String text = json.path("text").asText("").trim();
                if (text.isEmpty()) {
                    sendError(ex, StatusCodes.BAD_REQUEST, "Missing 'text'");
                    return;
                }

                String target = json.path("target").asText("").trim();
                if (target.isEmpty()) {
                    target = service.defaultTarget();
                }
                if (target.isEmpty()) {
                    sendError(ex, StatusCodes.BAD_REQUEST, "Missing 'target' and no default target configured");
                    return;
                }

                if (!service.submit(target, text)) {
                    sendError(ex, StatusCodes.SERVICE_UNAVAILABLE, "Notification queue is closed");
                    return;
                }

                log.info("POST /api/notify → 202 (target='{}')", target);
                sendJson(ex, StatusCodes.ACCEPTED, Map.of("queued", true));

            } catch (JsonProcessingException e) {
                log.warn("POST /api/notify: invalid JSON: {}", e.getOriginalMessage());
                sendError(ex, StatusCodes.BAD_REQUEST, "Invalid JSON");
            } catch (Exception e) {
                log.error("POST /api/notify failed: {}", e.getMessage(), e);
                sendError(ex, StatusCodes.INTERNAL_SERVER_ERROR, "Unexpected error: " + e.getMessage());
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /api/targets
     */
    public void targets(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, registry.describe());
        } catch (Exception e) {
            log.error("GET /api/targets failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to list targets");
        }
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, Map.of(
                "status", "ok",
                "pending", service.pendingCount(),
                "targets", registry.size()));
        } catch (Exception e) {
            log.error("GET /api/health failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Health check failed");
        }
    }

    private static void sendJson(HttpServerExchange exchange, int statusCode, Object payload) throws JsonProcessingException {
        String json = MAPPER.writeValueAsString(payload);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int statusCode, String message) {
        String json;
        try {
            json = MAPPER.writeValueAsString(Map.of("error", message));
        } catch (JsonProcessingException e) {
            json = "{\"error\":\"internal\"}";
        }
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }
}
