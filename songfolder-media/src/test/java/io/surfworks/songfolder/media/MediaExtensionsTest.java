package io.surfworks.songfolder.media;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MediaExtensions}.
 */
class MediaExtensionsTest {

    @ParameterizedTest
    @ValueSource(strings = {"a.mp3", "b.FLAC", "c.Opus", "d.mkv", "e.MPG", "f.aiff", "g.webm"})
    @DisplayName("Supported extensions match regardless of case")
    void supported_matches(String name) {
        assertTrue(MediaExtensions.isMedia(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"cover.jpg", "notes.txt", "playlist.m3u", "noext", "trailingdot.", ".mp3"})
    @DisplayName("Unsupported names do not match")
    void unsupported_doesNotMatch(String name) {
        assertFalse(MediaExtensions.isMedia(name));
    }

    @Test
    @DisplayName("Path overload looks at the file name only")
    void pathOverload() {
        assertTrue(MediaExtensions.isMedia(Path.of("/music/dir.flac/song.mp3")));
        assertFalse(MediaExtensions.isMedia(Path.of("/music/dir.mp3/cover.png")));
    }

    @Test
    @DisplayName("Audio check excludes video")
    void audioExcludesVideo() {
        assertTrue(MediaExtensions.isAudio("a.ogg"));
        assertFalse(MediaExtensions.isAudio("a.mp4"));
    }

    @Test
    @DisplayName("extensionOf lower-cases and keeps the dot")
    void extensionOf_lowerCase() {
        assertEquals(".mp3", MediaExtensions.extensionOf("Song.MP3"));
        assertEquals("", MediaExtensions.extensionOf("README"));
    }
}
