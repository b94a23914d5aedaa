package io.voicecast.application.exception;

import io.voicecast.domain.model.SessionOutcome;

/**
 * Base class for failures that end a notification session.
 *
 * Each subclass maps to one {@link SessionOutcome}. The worker logs it and moves on to the
 * next queued request.
 */
public abstract class NotificationException extends RuntimeException {

    private final String target;

    protected NotificationException(String target, String message) {
        super(String.format("[%s] %s", target, message));
        this.target = target;
    }

    protected NotificationException(String target, String message, Throwable cause) {
        super(String.format("[%s] %s", target, message), cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }

    public abstract SessionOutcome outcome();
}
