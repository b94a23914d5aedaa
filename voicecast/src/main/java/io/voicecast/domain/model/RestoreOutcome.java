package io.voicecast.domain.model;

/**
 * Result of reapplying a {@link TargetStateSnapshot}.
 */
public enum RestoreOutcome {
    /** Volume and mute were reapplied. */
    RESTORED,
    /** The snapshot was empty. */
    NOTHING_TO_RESTORE,
    /** The target never became ready; its state was left as-is. */
    TIMED_OUT,
    /** Shutdown was requested while waiting for the target. */
    CANCELLED
}
