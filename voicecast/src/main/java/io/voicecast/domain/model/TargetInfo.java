package io.voicecast.domain.model;

/**
 * Read-only view of a known target, as listed by the trigger API.
 */
public record TargetInfo(String id, String name, String model, boolean ready) {
}
