package io.voicecast.domain.model;

import java.nio.file.Path;

/**
 * Generated audio file for one in-flight notification.
 *
 * @param path                     location inside the asset directory
 * @param sizeBytes                file size at generation time
 * @param estimatedDurationSeconds size-based estimate, see {@link #estimateSeconds(long, int)}
 */
public record AudioAsset(Path path, long sizeBytes, double estimatedDurationSeconds) {

    public String fileName() {
        return path.getFileName().toString();
    }

    /**
     * Estimate playback length assuming a constant bitrate.
     *
     * @param sizeBytes  file size
     * @param bitrateBps assumed encoder bitrate in bits per second
     */
    public static double estimateSeconds(long sizeBytes, int bitrateBps) {
        if (bitrateBps <= 0) {
            throw new IllegalArgumentException("bitrate must be positive: " + bitrateBps);
        }
        return sizeBytes * 8.0 / bitrateBps;
    }
}
