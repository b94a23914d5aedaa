package io.voicecast.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.voicecast.domain.model.SessionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of NotificationMetrics.
 *
 * Key Metrics:
 * - voicecast_notifications_total{outcome} - Sessions by terminal state
 * - voicecast_session_duration_seconds{outcome} - Dequeue-to-verdict time
 * - voicecast_queue_depth - Requests waiting or in flight
 * - voicecast_media_requests_total{status} - Media server responses
 * - voicecast_media_bytes_total - Audio bytes streamed to targets
 *
 * Usage:
 * <pre>
 * PrometheusNotificationMetrics metrics = new PrometheusNotificationMetrics();
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusNotificationMetrics implements NotificationMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusNotificationMetrics.class);

    private final CollectorRegistry registry;

    private final Counter sessionCounter;
    private final Histogram sessionDuration;
    private final Gauge queueDepth;
    private final Counter mediaRequestCounter;
    private final Counter mediaBytesCounter;

    public PrometheusNotificationMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusNotificationMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.sessionCounter = Counter.build()
            .name("voicecast_notifications_total")
            .help("Total number of notification sessions by outcome")
            .labelNames("outcome")
            .register(registry);

        this.sessionDuration = Histogram.build()
            .name("voicecast_session_duration_seconds")
            .help("Notification session duration in seconds")
            .labelNames("outcome")
            .buckets(0.5, 1, 2, 5, 10, 20, 30, 60, 120)
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("voicecast_queue_depth")
            .help("Notification requests enqueued but not yet processed")
            .register(registry);

        this.mediaRequestCounter = Counter.build()
            .name("voicecast_media_requests_total")
            .help("Total number of media server responses by status code")
            .labelNames("status")
            .register(registry);

        this.mediaBytesCounter = Counter.build()
            .name("voicecast_media_bytes_total")
            .help("Total audio bytes served to targets")
            .register(registry);

        log.info("[PrometheusNotificationMetrics] Initialized");
    }

    @Override
    public void recordSession(SessionOutcome outcome, Duration elapsed) {
        sessionCounter.labels(outcome.label()).inc();
        sessionDuration.labels(outcome.label()).observe(elapsed.toMillis() / 1000.0);
    }

    @Override
    public void recordQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    @Override
    public void recordMediaRequest(int statusCode, long bytesSent) {
        mediaRequestCounter.labels(Integer.toString(statusCode)).inc();
        if (bytesSent > 0) {
            mediaBytesCounter.inc(bytesSent);
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
