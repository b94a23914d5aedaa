package io.voicecast.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.voicecast.domain.model.SessionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusNotificationMetricsTest {

    private CollectorRegistry registry;
    private PrometheusNotificationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusNotificationMetrics(registry);
    }

    @Test
    void sessionsAreCountedByOutcome() {
        metrics.recordSession(SessionOutcome.COMPLETED, Duration.ofSeconds(4));
        metrics.recordSession(SessionOutcome.COMPLETED, Duration.ofSeconds(6));
        metrics.recordSession(SessionOutcome.SKIPPED_MUTED, Duration.ofMillis(1));

        assertEquals(2.0, registry.getSampleValue("voicecast_notifications_total",
            new String[]{"outcome"}, new String[]{"completed"}));
        assertEquals(1.0, registry.getSampleValue("voicecast_notifications_total",
            new String[]{"outcome"}, new String[]{"skipped_muted"}));
        assertEquals(10.0, registry.getSampleValue("voicecast_session_duration_seconds_sum",
            new String[]{"outcome"}, new String[]{"completed"}), 1e-9);
    }

    @Test
    void queueDepthIsAGauge() {
        metrics.recordQueueDepth(3);
        metrics.recordQueueDepth(1);

        assertEquals(1.0, registry.getSampleValue("voicecast_queue_depth"));
    }

    @Test
    void mediaRequestsAndBytes() {
        metrics.recordMediaRequest(206, 16384);
        metrics.recordMediaRequest(206, 100);
        metrics.recordMediaRequest(404, 0);

        assertEquals(2.0, registry.getSampleValue("voicecast_media_requests_total",
            new String[]{"status"}, new String[]{"206"}));
        assertEquals(1.0, registry.getSampleValue("voicecast_media_requests_total",
            new String[]{"status"}, new String[]{"404"}));
        assertEquals(16484.0, registry.getSampleValue("voicecast_media_bytes_total"));
    }
}
