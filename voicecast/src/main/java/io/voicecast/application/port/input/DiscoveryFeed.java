package io.voicecast.application.port.input;

/**
 * Source of endpoint events, loaded through {@link java.util.ServiceLoader}.
 */
public interface DiscoveryFeed {

    /**
     * Start browsing and report endpoints to {@code listener} until {@link #stop()}.
     */
    void start(DiscoveryListener listener);

    void stop();
}
