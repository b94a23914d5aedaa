package io.voicecast.bootstrap;

import io.voicecast.infrastructure.tts.SpeechSynthesizerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Startup configuration validator.
 *
 * Runs from App.main() before anything starts. Invalid configuration throws
 * IllegalStateException and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static void validate(VoiceCastConfig config) {
        log.info("Running startup config validation...");

        requirePort("VOICECAST_MEDIA_PORT", config.mediaPort(), false);
        requirePort("VOICECAST_API_PORT", config.apiPort(), true);
        if (config.apiEnabled() && config.apiPort() == config.mediaPort()) {
            throw new IllegalStateException(
                "INVALID CONFIG: VOICECAST_API_PORT and VOICECAST_MEDIA_PORT must differ (" + config.apiPort() + ")");
        }

        if (config.volumePercent() < 10 || config.volumePercent() > 100) {
            throw new IllegalStateException(
                "INVALID CONFIG: VOICECAST_VOLUME must be between 10 and 100, got " + config.volumePercent());
        }
        log.info("✓ Notification volume {}%", config.volumePercent());

        String engine = config.ttsEngine().trim().toLowerCase(Locale.ROOT);
        if (!engine.equals(SpeechSynthesizerFactory.GOOGLE) && !engine.equals(SpeechSynthesizerFactory.COMMAND)) {
            throw new IllegalStateException(
                "INVALID CONFIG: VOICECAST_TTS_ENGINE must be 'google' or 'command', got '" + config.ttsEngine() + "'");
        }
        if (engine.equals(SpeechSynthesizerFactory.COMMAND) && config.ttsCommand().isBlank()) {
            throw new IllegalStateException(
                "INVALID CONFIG: VOICECAST_TTS_ENGINE=command requires VOICECAST_TTS_COMMAND\n" +
                "Example: VOICECAST_TTS_COMMAND=\"espeak-ng -v {lang} -w {output} {text}\"");
        }
        log.info("✓ Speech engine '{}', language '{}'", engine, config.language());

        if (config.language().isBlank()) {
            throw new IllegalStateException("INVALID CONFIG: VOICECAST_LANGUAGE must not be empty");
        }
        if (config.estimateBitrateBps() <= 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: VOICECAST_ESTIMATE_BITRATE must be positive, got " + config.estimateBitrateBps());
        }
        requirePositive("VOICECAST_POLL_MS", config.pollInterval());
        requirePositive("VOICECAST_ACTIVE_TIMEOUT_MS", config.activeTimeout());
        requirePositive("VOICECAST_SHUTDOWN_TIMEOUT_S", config.shutdownTimeout());

        if (config.defaultTarget().isBlank()) {
            log.warn("⚠️  VOICECAST_DEFAULT_TARGET not set: host notifications will be ignored");
        }

        log.info("✅ Startup config validation passed");
    }

    private static void requirePort(String key, int port, boolean zeroAllowed) {
        if ((port == 0 && zeroAllowed) || (port > 0 && port <= 65535)) {
            return;
        }
        throw new IllegalStateException("INVALID CONFIG: " + key + " is not a valid port: " + port);
    }

    private static void requirePositive(String key, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " must be positive");
        }
    }

    private StartupConfigValidator() {}
}
