package io.voicecast.application.exception;

import io.voicecast.domain.model.SessionOutcome;

import java.nio.file.Path;

/**
 * The engine reported success but no asset file exists.
 */
public class AssetMissingException extends NotificationException {

    private final Path path;

    public AssetMissingException(String target, Path path) {
        super(target, "'" + path + "' not found, synthesis must have failed");
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public SessionOutcome outcome() {
        return SessionOutcome.ASSET_MISSING;
    }
}
