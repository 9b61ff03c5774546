package io.surfworks.songfolder.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.surfworks.songfolder.media.LocalFolderScanner;
import io.surfworks.songfolder.media.SilentPlaybackEngine;
import io.surfworks.songfolder.state.StateStore;
import io.surfworks.songfolder.state.config.SongFolderConfig;
import io.surfworks.songfolder.state.lock.FileLockCoordinator;
import io.surfworks.songfolder.state.session.PlayerSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CommandInterpreter}.
 */
class CommandInterpreterTest {

    @Nested
    @DisplayName("Tokenizer")
    class Tokenizer {

        @Test
        @DisplayName("splits on whitespace")
        void tokenize_whitespace() {
            assertEquals(List.of("shuffle", "on"), CommandInterpreter.tokenize("  shuffle   on "));
            assertEquals(List.of(), CommandInterpreter.tokenize("   "));
        }

        @Test
        @DisplayName("keeps quoted paths together")
        void tokenize_quotes() {
            assertEquals(List.of("open", "/music/Live at Leeds"),
                CommandInterpreter.tokenize("open \"/music/Live at Leeds\""));
            assertEquals(List.of("list", "--filter", "it's"),
                CommandInterpreter.tokenize("list --filter \"it's\""));
            assertEquals(List.of("forget", ""), CommandInterpreter.tokenize("forget ''"));
        }

        @Test
        @DisplayName("rejects an unterminated quote")
        void tokenize_unterminated() {
            assertThrows(IllegalArgumentException.class, () -> CommandInterpreter.tokenize("open \"/music"));
        }
    }

    @Test
    @DisplayName("positions format as m:ss or h:mm:ss")
    void formatPosition() {
        assertEquals("0:00", CommandInterpreter.formatPosition(0));
        assertEquals("1:05", CommandInterpreter.formatPosition(65_400));
        assertEquals("1:01:01", CommandInterpreter.formatPosition(3_661_000));
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @TempDir
        Path tempDir;

        private Path album;
        private PlayerSession session;
        private SilentPlaybackEngine engine;
        private ByteArrayOutputStream buffer;

        @BeforeEach
        void setUp() throws IOException {
            album = Files.createDirectories(tempDir.resolve("album"));
            for (String name : List.of("01 Intro.mp3", "02 Live Song.flac", "03 Outro.wav")) {
                Files.createFile(album.resolve(name));
            }
            Path stateDir = tempDir.resolve("state");
            SongFolderConfig config = SongFolderConfig.defaults(stateDir).withAutosaveInterval(Duration.ofHours(1));
            engine = new SilentPlaybackEngine(180_000);
            session = new PlayerSession(config, new StateStore(stateDir), FileLockCoordinator.inDirectory(stateDir),
                new LocalFolderScanner(), engine, new Random(3));
            session.start(false);
            buffer = new ByteArrayOutputStream();
        }

        @AfterEach
        void tearDown() {
            session.close();
        }

        private String run(boolean json, String line) throws IOException {
            buffer.reset();
            CommandInterpreter interpreter = new CommandInterpreter(
                session, new PrintStream(buffer, true, StandardCharsets.UTF_8), json);
            interpreter.execute(CommandInterpreter.tokenize(line));
            return buffer.toString(StandardCharsets.UTF_8);
        }

        @Test
        @DisplayName("status without a folder")
        void status_noFolder() throws IOException {
            String output = run(false, "status");

            assertTrue(output.contains("Folder:   (none)"));
            assertTrue(output.contains("Volume:   100"));
            assertFalse(output.contains("READ-ONLY"));
        }

        @Test
        @DisplayName("open shows the first track paused")
        void open_showsFirstTrack() throws IOException {
            String output = run(false, "open " + album);

            assertTrue(output.contains("Track:    1/3  01 Intro.mp3"));
            assertTrue(output.contains("State:    paused"));
        }

        @Test
        @DisplayName("play <n> jumps to a track and plays it")
        void play_number() throws IOException {
            run(false, "open " + album);

            String output = run(false, "play 3");

            assertTrue(output.contains("Track:    3/3  03 Outro.wav"));
            assertTrue(engine.isPlaying());
        }

        @Test
        @DisplayName("next at the end reports the end of the playlist")
        void next_atEnd() throws IOException {
            run(false, "open " + album);
            run(false, "play 3");

            assertEquals("End of playlist." + System.lineSeparator(), run(false, "next"));
        }

        @Test
        @DisplayName("list marks the current track and filters by name")
        void list_filter() throws IOException {
            run(false, "open " + album);
            run(false, "play 2");

            String all = run(false, "list");
            assertTrue(all.contains(">   2  02 Live Song.flac"));
            assertTrue(all.contains("    1  01 Intro.mp3"));

            String filtered = run(false, "list --filter live");
            assertEquals(1, filtered.lines().count());
        }

        @Test
        @DisplayName("json status carries the current track")
        void json_status() throws IOException {
            run(false, "open " + album);
            run(false, "shuffle on");

            JsonNode status = CommandInterpreter.JSON.readTree(run(true, "status"));

            assertEquals("WRITER", status.get("role").asText());
            assertEquals("SHUFFLE", status.get("mode").asText());
            assertEquals(1, status.get("currentTrack").asInt());
            assertEquals("01 Intro.mp3", status.get("currentName").asText());
            assertEquals(3, status.get("trackCount").asInt());
        }

        @Test
        @DisplayName("json list is an array of tracks")
        void json_list() throws IOException {
            run(false, "open " + album);

            JsonNode tracks = CommandInterpreter.JSON.readTree(run(true, "list"));

            assertEquals(3, tracks.size());
            assertEquals("02 Live Song.flac", tracks.get(1).get("name").asText());
            assertTrue(tracks.get(0).get("current").asBoolean());
        }

        @Test
        @DisplayName("volume accepts absolute and relative values")
        void volume() throws IOException {
            assertTrue(run(false, "volume 40").contains("Volume:   40"));
            assertTrue(run(false, "volume -5").contains("Volume:   35"));
            assertTrue(run(false, "volume +10").contains("Volume:   45"));
            assertEquals(45, engine.getVolume());
        }

        @Test
        @DisplayName("zoom steps are shown as percentages")
        void zoom() throws IOException {
            assertTrue(run(false, "zoom in").contains("Zoom:     110%"));
            assertTrue(run(false, "zoom reset").contains("Zoom:     100%"));
        }

        @Test
        @DisplayName("recent and forget manage the recent list")
        void recentAndForget() throws IOException {
            run(false, "open " + album);

            assertTrue(run(false, "recent").contains(album.toAbsolutePath().normalize().toString()));
            assertTrue(run(false, "forget " + album).startsWith("Forgot"));
            assertEquals("No recent folders." + System.lineSeparator(), run(false, "recent"));
        }

        @Test
        @DisplayName("reshuffle outside shuffle mode explains itself")
        void reshuffle_straight() throws IOException {
            run(false, "open " + album);

            assertTrue(run(false, "reshuffle").contains("only applies in shuffle mode"));
        }

        @Test
        @DisplayName("bad arguments are rejected")
        void badArguments() {
            assertThrows(IllegalArgumentException.class, () -> run(false, "shuffle maybe"));
            assertThrows(IllegalArgumentException.class, () -> run(false, "volume loud"));
            assertThrows(IllegalArgumentException.class, () -> run(false, "zoom sideways"));
            assertThrows(IllegalArgumentException.class, () -> run(false, "frobnicate"));
        }

        @Test
        @DisplayName("quit ends the shell")
        void quit() throws IOException {
            CommandInterpreter interpreter = new CommandInterpreter(session, new PrintStream(buffer), false);

            assertFalse(interpreter.execute(List.of("quit")));
            assertTrue(interpreter.execute(List.of()));
        }
    }
}
