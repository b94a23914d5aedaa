package io.voicecast.application.service;

import io.voicecast.application.port.output.Endpoint;

import java.util.Optional;

/**
 * Read-only lookup of known targets.
 */
public interface TargetDirectory {

    Optional<Endpoint> findByName(String name);
}
