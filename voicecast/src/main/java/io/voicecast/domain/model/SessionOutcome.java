package io.voicecast.domain.model;

/**
 * Terminal state of one notification session.
 */
public enum SessionOutcome {
    COMPLETED(false),
    SKIPPED_MUTED(false),
    TARGET_NOT_FOUND(true),
    TARGET_UNAVAILABLE(true),
    SYNTHESIS_FAILED(true),
    ASSET_MISSING(true),
    PLAYBACK_TIMEOUT(true),
    CANCELLED(false),
    FAILED(true);

    private final boolean error;

    SessionOutcome(boolean error) {
        this.error = error;
    }

    public boolean isError() {
        return error;
    }

    /** Lower-case label for metrics. */
    public String label() {
        return name().toLowerCase();
    }
}
