package io.voicecast.domain.model;

/**
 * Transport state reported by a target's media session.
 */
public enum PlayerState {
    PLAYING,
    PAUSED,
    BUFFERING,
    IDLE,
    UNKNOWN
}
