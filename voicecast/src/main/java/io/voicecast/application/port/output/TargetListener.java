package io.voicecast.application.port.output;

/**
 * Host-side device model notified when targets come and go.
 */
public interface TargetListener {

    /** A target was seen for the first time. */
    void deviceCreated(Endpoint endpoint);

    /** A known target was rediscovered and its handle replaced. */
    void deviceUpdated(Endpoint endpoint);

    /** A target disappeared from the network. */
    default void deviceRemoved(String id) {
    }
}
