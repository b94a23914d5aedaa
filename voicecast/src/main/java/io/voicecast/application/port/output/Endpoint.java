package io.voicecast.application.port.output;

import io.voicecast.domain.model.EndpointStatus;

/**
 * A networked audio receiver that can be told to play a URL.
 *
 * Implementations wrap a cast protocol client. Calls may block on network I/O and may
 * throw unchecked exceptions when the device connection drops.
 */
public interface Endpoint {

    /** Stable identifier, unchanged across rediscovery. */
    String id();

    /** Friendly name, the key producers use to address the target. */
    String name();

    /** Model name as advertised during discovery. */
    String model();

    /**
     * @return true once the device has reported status on its current connection
     */
    boolean isReady();

    /**
     * @return last reported receiver status, or null if none has arrived yet
     */
    EndpointStatus status();

    MediaSession mediaSession();

    /**
     * @param level volume between 0.0 and 1.0
     */
    void setVolume(double level);

    void setMuted(boolean muted);

    void startApp(String appId);

    /** Quit whatever application is running on the receiver. */
    void stopApp();

    /** Close the connection to the device. */
    void disconnect();
}
