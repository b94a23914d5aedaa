package io.voicecast.domain.model;

/**
 * Target state captured before a notification plays.
 *
 * Fields the target had not reported are null. Without a saved volume there is
 * nothing to restore.
 */
public record TargetStateSnapshot(Double volumeLevel, Boolean muted, String runningApp, Boolean supportsSeek) {

    public static final TargetStateSnapshot EMPTY = new TargetStateSnapshot(null, null, null, null);

    public boolean isEmpty() {
        return volumeLevel == null;
    }
}
