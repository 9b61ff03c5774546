package io.surfworks.songfolder.state.config;

import io.surfworks.songfolder.state.ReshufflePolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SongFolderConfig} and {@link SongFolderConfigLoader}.
 */
class SongFolderConfigTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("State directory resolution")
    class Resolution {

        @Test
        @DisplayName("SONGFOLDER_HOME wins")
        void resolve_envHome() {
            Path dir = SongFolderConfig.resolveStateDir(
                Map.of("SONGFOLDER_HOME", "/data/sf", "XDG_CONFIG_HOME", "/xdg"), "/home/u");

            assertEquals(Path.of("/data/sf"), dir);
        }

        @Test
        @DisplayName("XDG_CONFIG_HOME is used next")
        void resolve_xdg() {
            Path dir = SongFolderConfig.resolveStateDir(Map.of("XDG_CONFIG_HOME", "/xdg"), "/home/u");

            assertEquals(Path.of("/xdg", "songfolder"), dir);
        }

        @Test
        @DisplayName("falls back to ~/.config/songfolder, ignoring blank values")
        void resolve_home() {
            Path dir = SongFolderConfig.resolveStateDir(Map.of("SONGFOLDER_HOME", " "), "/home/u");

            assertEquals(Path.of("/home/u", ".config", "songfolder"), dir);
        }
    }

    @Test
    @DisplayName("derived file paths live in the state directory")
    void paths() {
        SongFolderConfig config = SongFolderConfig.defaults(tempDir);

        assertEquals(tempDir.resolve("state.json"), config.stateFile());
        assertEquals(tempDir.resolve("state.lock"), config.lockFile());
        assertEquals(tempDir.resolve("config.json"), config.configFile());
    }

    @Test
    @DisplayName("non-positive autosave interval is rejected")
    void autosaveInterval_mustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> SongFolderConfig.defaults(tempDir).withAutosaveInterval(Duration.ZERO));
    }

    @Test
    @DisplayName("autosave interval longer than a day is rejected")
    void autosaveInterval_tooLong() {
        assertThrows(IllegalArgumentException.class,
            () -> SongFolderConfig.defaults(tempDir).withAutosaveInterval(Duration.ofDays(2)));
    }

    @Nested
    @DisplayName("Loader")
    class Loader {

        @Test
        @DisplayName("defaults when no config file exists")
        void load_noFile_defaults() {
            SongFolderConfig config = SongFolderConfigLoader.load(tempDir);

            assertEquals(Duration.ofSeconds(5), config.autosaveInterval());
            assertEquals(ReshufflePolicy.KEEP_CURRENT_FIRST, config.reshufflePolicy());
        }

        @Test
        @DisplayName("save and load round-trip works")
        void saveAndLoad_roundTrip() throws Exception {
            SongFolderConfig config = SongFolderConfig.defaults(tempDir)
                .withAutosaveInterval(Duration.ofSeconds(30))
                .withReshufflePolicy(ReshufflePolicy.RESET_TO_START);

            SongFolderConfigLoader.save(config);

            assertEquals(config, SongFolderConfigLoader.load(tempDir));
        }

        @Test
        @DisplayName("unparseable file falls back to defaults")
        void load_garbage_defaults() throws Exception {
            Files.writeString(tempDir.resolve("config.json"), "{{{");

            assertEquals(SongFolderConfig.defaults(tempDir), SongFolderConfigLoader.load(tempDir));
        }

        @Test
        @DisplayName("bad individual values are ignored")
        void load_badValues_ignored() throws Exception {
            Files.writeString(tempDir.resolve("config.json"),
                "{\"autosaveIntervalSeconds\": -3, \"reshufflePolicy\": \"sideways\"}");

            assertEquals(SongFolderConfig.defaults(tempDir), SongFolderConfigLoader.load(tempDir));
        }

        @Test
        @DisplayName("huge autosave interval is ignored")
        void load_hugeInterval_ignored() throws Exception {
            Files.writeString(tempDir.resolve("config.json"),
                "{\"autosaveIntervalSeconds\": " + Long.MAX_VALUE + "}");

            SongFolderConfig config = SongFolderConfigLoader.load(tempDir);

            assertEquals(SongFolderConfig.DEFAULT_AUTOSAVE_INTERVAL, config.autosaveInterval());
            assertEquals(5_000, config.autosaveInterval().toMillis());
        }

        @Test
        @DisplayName("policy names accept dashes and any case")
        void parsePolicy() {
            assertEquals(ReshufflePolicy.RESET_TO_START, SongFolderConfigLoader.parsePolicy("reset-to-start"));
            assertEquals(ReshufflePolicy.KEEP_CURRENT_FIRST, SongFolderConfigLoader.parsePolicy("KEEP_CURRENT_FIRST"));
            assertEquals("keep-current-first", SongFolderConfigLoader.policyName(ReshufflePolicy.KEEP_CURRENT_FIRST));
            assertThrows(IllegalArgumentException.class, () -> SongFolderConfigLoader.parsePolicy("random"));
        }
    }
}
