package io.voicecast.infrastructure.metrics;

import io.voicecast.domain.model.SessionOutcome;

import java.time.Duration;

/**
 * Notification pipeline metrics.
 *
 * Implementations can publish to Prometheus or drop everything ({@link #NOOP}).
 */
public interface NotificationMetrics {

    NotificationMetrics NOOP = new NotificationMetrics() {
        @Override
        public void recordSession(SessionOutcome outcome, Duration elapsed) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }

        @Override
        public void recordMediaRequest(int statusCode, long bytesSent) {
        }
    };

    /**
     * Record the end of one notification session.
     *
     * @param outcome terminal state
     * @param elapsed time from dequeue to terminal state
     */
    void recordSession(SessionOutcome outcome, Duration elapsed);

    /**
     * @param depth requests enqueued but not yet processed
     */
    void recordQueueDepth(int depth);

    /**
     * Record one media server response.
     *
     * @param statusCode HTTP status sent
     * @param bytesSent  body bytes written
     */
    void recordMediaRequest(int statusCode, long bytesSent);
}
