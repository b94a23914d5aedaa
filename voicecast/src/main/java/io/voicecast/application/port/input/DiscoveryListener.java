package io.voicecast.application.port.input;

import io.voicecast.application.port.output.Endpoint;

/**
 * Receives endpoint events from a discovery feed (mDNS browser or similar).
 */
public interface DiscoveryListener {

    void onEndpointFound(Endpoint endpoint);

    void onEndpointLost(String id);
}
