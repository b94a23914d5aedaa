package io.voicecast.domain.model;

/**
 * Receiver status as last reported by a target. Any field may be null when the
 * device has not reported it.
 */
public record EndpointStatus(Double volumeLevel, Boolean muted, String appId, String displayName) {

    public boolean isMuted() {
        return Boolean.TRUE.equals(muted);
    }
}
