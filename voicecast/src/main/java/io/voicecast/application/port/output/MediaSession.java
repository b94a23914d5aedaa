package io.voicecast.application.port.output;

import io.voicecast.domain.model.PlaybackStatus;

/**
 * Media controller of an {@link Endpoint}.
 */
public interface MediaSession {

    /**
     * Ask the receiver to load and play a URL.
     */
    void play(String url, String contentType);

    /**
     * @return true once the receiver has an active media session for the last play command
     */
    boolean isActive();

    /**
     * Request a fresh status from the receiver. The answer is visible through
     * {@link #status()} once it arrives.
     */
    void refreshStatus();

    /**
     * @return last reported status, or null if the receiver has not reported any
     */
    PlaybackStatus status();

    void seek(double positionSeconds);
}
