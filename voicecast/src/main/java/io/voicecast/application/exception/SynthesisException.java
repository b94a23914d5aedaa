package io.voicecast.application.exception;

import io.voicecast.domain.model.SessionOutcome;

/**
 * The speech engine failed or produced an empty file.
 */
public class SynthesisException extends NotificationException {

    public SynthesisException(String target, String message) {
        super(target, message);
    }

    public SynthesisException(String target, String message, Throwable cause) {
        super(target, message, cause);
    }

    @Override
    public SessionOutcome outcome() {
        return SessionOutcome.SYNTHESIS_FAILED;
    }
}
