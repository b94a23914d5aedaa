package io.voicecast.bootstrap;

import io.voicecast.application.service.DetectorSettings;
import io.voicecast.util.Env;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Runtime configuration, read from {@code VOICECAST_*} environment variables or system properties.
 */
public record VoiceCastConfig(
    int mediaPort,
    String mediaHost,
    int apiPort,
    Path assetDir,
    String defaultTarget,
    String language,
    Map<String, String> languageOverrides,
    int volumePercent,
    String ttsEngine,
    String ttsCommand,
    int estimateBitrateBps,
    Duration settle,
    Duration pollInterval,
    Duration flushGrace,
    Duration activeTimeout,
    Duration shutdownTimeout
) {

    public static VoiceCastConfig fromEnv() {
        DetectorSettings defaults = DetectorSettings.defaults();
        return new VoiceCastConfig(
            Env.getInt("VOICECAST_MEDIA_PORT", 15555),
            Env.get("VOICECAST_MEDIA_HOST", ""),
            Env.getInt("VOICECAST_API_PORT", 15556),
            Path.of(Env.get("VOICECAST_ASSET_DIR", "./messages")),
            Env.get("VOICECAST_DEFAULT_TARGET", ""),
            Env.get("VOICECAST_LANGUAGE", "fr"),
            Env.getPairs("VOICECAST_LANGUAGE_OVERRIDES"),
            Env.getInt("VOICECAST_VOLUME", 50),
            Env.get("VOICECAST_TTS_ENGINE", "google"),
            Env.get("VOICECAST_TTS_COMMAND", ""),
            Env.getInt("VOICECAST_ESTIMATE_BITRATE", defaults.estimateBitrateBps()),
            Env.getMillis("VOICECAST_SETTLE_MS", defaults.settle()),
            Env.getMillis("VOICECAST_POLL_MS", defaults.pollInterval()),
            Env.getMillis("VOICECAST_GRACE_MS", defaults.flushGrace()),
            Env.getMillis("VOICECAST_ACTIVE_TIMEOUT_MS", defaults.activeTimeout()),
            Duration.ofSeconds(Env.getLong("VOICECAST_SHUTDOWN_TIMEOUT_S", 30))
        );
    }

    /** Notification volume as a 0..1 level. */
    public double notificationVolume() {
        return volumePercent / 100.0;
    }

    public boolean apiEnabled() {
        return apiPort > 0;
    }

    public DetectorSettings detectorSettings() {
        return DetectorSettings.defaults()
            .withEstimateBitrate(estimateBitrateBps)
            .withTimings(activeTimeout, settle, pollInterval, flushGrace);
    }
}
