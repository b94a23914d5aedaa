package io.voicecast.application.exception;

import io.voicecast.domain.model.SessionOutcome;

/**
 * The target is known but not connected or has not reported status yet.
 */
public class TargetUnavailableException extends NotificationException {

    public TargetUnavailableException(String target) {
        super(target, "target unavailable, not connected");
    }

    @Override
    public SessionOutcome outcome() {
        return SessionOutcome.TARGET_UNAVAILABLE;
    }
}
