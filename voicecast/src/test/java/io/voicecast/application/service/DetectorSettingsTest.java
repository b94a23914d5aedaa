package io.voicecast.application.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DetectorSettingsTest {

    private final DetectorSettings defaults = DetectorSettings.defaults();

    @Test
    void initialDeadlineHasMinimum() {
        assertEquals(Duration.ofSeconds(15), defaults.initialDeadline(1.0));
    }

    @Test
    void initialDeadlinePadsLongEstimates() {
        assertEquals(Duration.ofSeconds(30), defaults.initialDeadline(20.0));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> defaults.withEstimateBitrate(0));
        assertThrows(IllegalArgumentException.class,
            () -> defaults.withTimings(Duration.ofSeconds(1), Duration.ZERO, Duration.ZERO, Duration.ZERO));
    }
}
