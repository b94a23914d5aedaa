package io.voicecast.domain.model;

import java.time.Duration;

/**
 * Verdict of one playback session.
 *
 * @param completed  an idle transition was seen after playback had started
 * @param sawPlaying the target reported playing or paused at least once
 * @param cancelled  shutdown interrupted the session
 * @param elapsed    time from play command to verdict
 */
public record PlaybackResult(boolean completed, boolean sawPlaying, boolean cancelled, Duration elapsed) {
}
