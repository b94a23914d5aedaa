package io.voicecast.application.exception;

import io.voicecast.domain.model.SessionOutcome;

/**
 * No known target carries the requested name.
 */
public class TargetNotFoundException extends NotificationException {

    public TargetNotFoundException(String target) {
        super(target, "target not found");
    }

    @Override
    public SessionOutcome outcome() {
        return SessionOutcome.TARGET_NOT_FOUND;
    }
}
