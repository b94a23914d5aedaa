package io.voicecast.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves a registry in the Prometheus text format.
 *
 * {@code GET /metrics?name[]=voicecast_queue_depth} limits the output to the named series,
 * the same filter the stock Prometheus exporters accept.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[Metrics] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("metrics export failed", StandardCharsets.UTF_8);
            return;
        }

        String body = writer.toString();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
        log.debug("[Metrics] Served {} bytes to {}", body.length(), exchange.getSourceAddress());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
