package io.voicecast.application.service;

import java.time.Duration;

/**
 * Tuning values for {@link PlaybackCompletionDetector}.
 *
 * The defaults were tuned against Google Home and Nest speakers. The estimate bitrate has to
 * match what the speech engine actually produces or the initial deadline drifts.
 *
 * @param estimateBitrateBps bits per second used to estimate duration from file size
 * @param activeTimeout      longest wait for the receiver to report an active media session
 * @param activePollInterval how often the active flag is checked while waiting
 * @param settle             pause after the session becomes active, before the first poll
 * @param pollInterval       status poll period
 * @param minimumDeadline    lower bound of the initial deadline
 * @param estimatePadding    added to the estimated duration for the initial deadline
 * @param durationPadding    added to the reported duration once it is known
 * @param flushGrace         wait after the verdict so buffered audio finishes before restore
 */
public record DetectorSettings(
        int estimateBitrateBps,
        Duration activeTimeout,
        Duration activePollInterval,
        Duration settle,
        Duration pollInterval,
        Duration minimumDeadline,
        Duration estimatePadding,
        Duration durationPadding,
        Duration flushGrace) {

    public static final int DEFAULT_ESTIMATE_BITRATE = 64_000;

    public DetectorSettings {
        if (estimateBitrateBps <= 0) {
            throw new IllegalArgumentException("estimateBitrateBps must be positive");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (activePollInterval.isZero() || activePollInterval.isNegative()) {
            throw new IllegalArgumentException("activePollInterval must be positive");
        }
    }

    public static DetectorSettings defaults() {
        return new DetectorSettings(
            DEFAULT_ESTIMATE_BITRATE,
            Duration.ofSeconds(10),
            Duration.ofMillis(100),
            Duration.ofMillis(1500),
            Duration.ofMillis(500),
            Duration.ofSeconds(15),
            Duration.ofSeconds(10),
            Duration.ofSeconds(5),
            Duration.ofMillis(2000));
    }

    public DetectorSettings withEstimateBitrate(int bitrateBps) {
        return new DetectorSettings(bitrateBps, activeTimeout, activePollInterval, settle, pollInterval,
            minimumDeadline, estimatePadding, durationPadding, flushGrace);
    }

    public DetectorSettings withTimings(Duration activeTimeout, Duration settle, Duration pollInterval, Duration flushGrace) {
        return new DetectorSettings(estimateBitrateBps, activeTimeout, activePollInterval, settle, pollInterval,
            minimumDeadline, estimatePadding, durationPadding, flushGrace);
    }

    public DetectorSettings withDeadlines(Duration minimumDeadline, Duration estimatePadding, Duration durationPadding) {
        return new DetectorSettings(estimateBitrateBps, activeTimeout, activePollInterval, settle, pollInterval,
            minimumDeadline, estimatePadding, durationPadding, flushGrace);
    }

    /**
     * Initial deadline for an asset of the given estimated length:
     * {@code max(minimumDeadline, estimate + estimatePadding)}.
     */
    public Duration initialDeadline(double estimatedSeconds) {
        Duration estimated = Duration.ofMillis(Math.round(estimatedSeconds * 1000)).plus(estimatePadding);
        return estimated.compareTo(minimumDeadline) > 0 ? estimated : minimumDeadline;
    }
}
