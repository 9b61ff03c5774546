package io.surfworks.songfolder.media;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SilentPlaybackEngine}.
 */
class SilentPlaybackEngineTest {

    @TempDir
    Path tempDir;

    private Path track;
    private SilentPlaybackEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        track = Files.createFile(tempDir.resolve("a.mp3"));
        engine = new SilentPlaybackEngine(10_000);
    }

    @Test
    @DisplayName("play starts at the requested position")
    void play_startsAtPosition() {
        assertTrue(engine.play(track, 2_500));

        assertTrue(engine.isPlaying());
        assertEquals(2_500, engine.positionMs());
        assertEquals(track, engine.currentTrack());
    }

    @Test
    @DisplayName("load leaves the engine paused")
    void load_paused() {
        assertTrue(engine.load(track, 1_000));

        assertFalse(engine.isPlaying());
        engine.resume();
        assertTrue(engine.isPlaying());
    }

    @Test
    @DisplayName("Missing file is not played")
    void play_missingFile_returnsFalse() {
        assertFalse(engine.play(tempDir.resolve("missing.mp3"), 0));
        assertNull(engine.currentTrack());
        assertEquals(-1, engine.positionMs());
    }

    @Test
    @DisplayName("seek clamps into the track length")
    void seek_clamps() {
        engine.play(track, 0);

        engine.seek(50_000);
        assertEquals(10_000, engine.positionMs());

        engine.seek(-5);
        assertEquals(0, engine.positionMs());
    }

    @Test
    @DisplayName("advance to the end fires the end-of-track listener once")
    void advance_firesEndOfTrack() {
        AtomicInteger ends = new AtomicInteger();
        engine.setEndOfTrackListener(ends::incrementAndGet);
        engine.play(track, 9_000);

        engine.advance(500);
        assertEquals(0, ends.get());

        engine.advance(1_000);
        assertEquals(1, ends.get());
        assertFalse(engine.isPlaying());

        engine.advance(1_000);
        assertEquals(1, ends.get());
    }

    @Test
    @DisplayName("advance while paused does nothing")
    void advance_paused_noop() {
        engine.load(track, 100);

        engine.advance(1_000);

        assertEquals(100, engine.positionMs());
    }

    @Test
    @DisplayName("Volume is clamped to 0-100")
    void volume_clamped() {
        engine.setVolume(150);
        assertEquals(100, engine.getVolume());
        engine.setVolume(-3);
        assertEquals(0, engine.getVolume());
    }

    @Test
    @DisplayName("stop unloads the track")
    void stop_unloads() {
        engine.play(track, 0);

        engine.stop();

        assertNull(engine.currentTrack());
        assertEquals(-1, engine.lengthMs());
    }
}
