package com.kmg.lineocr.service;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RunSettingsTest {

    @Test
    void rejectsNonPositiveFlushCadence() {
        assertThrows(IllegalArgumentException.class, () -> new RunSettings(Path.of("runs"), 0, Duration.ZERO));
    }

    @Test
    void negativeOrMissingIntervalMeansNoPause() {
        assertEquals(Duration.ZERO, new RunSettings(Path.of("runs"), 1, Duration.ofSeconds(-1)).pageInterval());
        assertEquals(Duration.ZERO, new RunSettings(Path.of("runs"), 1, null).pageInterval());
    }

    @Test
    void imagesLiveUnderTheJobDirectory() {
        RunSettings settings = new RunSettings(Path.of("runs"), 1, Duration.ZERO);

        assertEquals(Path.of("runs", "job-1", "images"), settings.imagesDir("job-1"));
    }

    @Test
    void pauseEndsAsSoonAsCancelIsRequested() throws Exception {
        RunSettings settings = new RunSettings(Path.of("runs"), 1, Duration.ofMinutes(5));

        long started = System.nanoTime();
        settings.pauseBetweenPages(() -> true);

        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
    }
}
