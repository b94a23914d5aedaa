package io.voicecast.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A spoken notification waiting for delivery: which target, what to say.
 *
 * {@link #SHUTDOWN} is the queue sentinel. It is compared by identity and never delivered.
 */
public record NotificationRequest(String target, String text, Instant enqueuedAt) {

    public static final NotificationRequest SHUTDOWN = new NotificationRequest("", "", Instant.EPOCH);

    public NotificationRequest {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }

    public static NotificationRequest of(String target, String text) {
        return new NotificationRequest(target, text, Instant.now());
    }

    public boolean isShutdown() {
        return this == SHUTDOWN;
    }
}
