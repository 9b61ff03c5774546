package io.surfworks.songfolder.state.config;

import io.surfworks.songfolder.state.ReshufflePolicy;
import io.surfworks.songfolder.state.StateStore;
import io.surfworks.songfolder.state.lock.FileLockCoordinator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a SongFolder instance.
 *
 * <p>The state directory is resolved in order of precedence:
 * <ol>
 *   <li>{@code SONGFOLDER_HOME} environment variable</li>
 *   <li>{@code $XDG_CONFIG_HOME/songfolder}</li>
 *   <li>{@code ~/.config/songfolder}</li>
 * </ol>
 * The remaining settings come from {@code config.json} in that directory, see
 * {@link SongFolderConfigLoader}.
 *
 * @param stateDir          directory holding state, lock and config files
 * @param autosaveInterval  period of the autosave timer
 * @param reshufflePolicy   what reshuffle does to the playing track
 */
public record SongFolderConfig(
    Path stateDir,
    Duration autosaveInterval,
    ReshufflePolicy reshufflePolicy
) {

    /** Environment variable overriding the state directory */
    public static final String ENV_HOME = "SONGFOLDER_HOME";

    /** Config file name */
    public static final String CONFIG_FILE = "config.json";

    /** Default autosave period */
    public static final Duration DEFAULT_AUTOSAVE_INTERVAL = Duration.ofSeconds(5);

    /** Longest accepted autosave period */
    public static final Duration MAX_AUTOSAVE_INTERVAL = Duration.ofDays(1);

    /** Default reshuffle behaviour */
    public static final ReshufflePolicy DEFAULT_RESHUFFLE_POLICY = ReshufflePolicy.KEEP_CURRENT_FIRST;

    public SongFolderConfig {
        Objects.requireNonNull(stateDir, "stateDir cannot be null");
        Objects.requireNonNull(autosaveInterval, "autosaveInterval cannot be null");
        Objects.requireNonNull(reshufflePolicy, "reshufflePolicy cannot be null");

        if (autosaveInterval.isNegative() || autosaveInterval.isZero()) {
            throw new IllegalArgumentException("autosaveInterval must be positive: " + autosaveInterval);
        }
        if (autosaveInterval.compareTo(MAX_AUTOSAVE_INTERVAL) > 0) {
            throw new IllegalArgumentException("autosaveInterval cannot exceed " + MAX_AUTOSAVE_INTERVAL
                + ": " + autosaveInterval);
        }
    }

    /**
     * Defaults with the state directory resolved from the process environment.
     */
    public static SongFolderConfig defaults() {
        return defaults(resolveStateDir(System.getenv(), System.getProperty("user.home")));
    }

    /**
     * Defaults for an explicit state directory.
     */
    public static SongFolderConfig defaults(Path stateDir) {
        return new SongFolderConfig(stateDir, DEFAULT_AUTOSAVE_INTERVAL, DEFAULT_RESHUFFLE_POLICY);
    }

    /**
     * Resolve the state directory from environment values.
     *
     * @param env      environment variables
     * @param userHome the user's home directory
     */
    public static Path resolveStateDir(Map<String, String> env, String userHome) {
        String home = env.get(ENV_HOME);
        if (home != null && !home.isBlank()) {
            return Path.of(home);
        }
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null && !configHome.isBlank()) {
            return Path.of(configHome, "songfolder");
        }
        return Path.of(userHome, ".config", "songfolder");
    }

    public Path stateFile() {
        return stateDir.resolve(StateStore.STATE_FILE);
    }

    public Path lockFile() {
        return stateDir.resolve(FileLockCoordinator.LOCK_FILE);
    }

    public Path configFile() {
        return stateDir.resolve(CONFIG_FILE);
    }

    /**
     * Returns a new config with the specified state directory.
     */
    public SongFolderConfig withStateDir(Path dir) {
        return new SongFolderConfig(dir, autosaveInterval, reshufflePolicy);
    }

    /**
     * Returns a new config with the specified autosave interval.
     */
    public SongFolderConfig withAutosaveInterval(Duration interval) {
        return new SongFolderConfig(stateDir, interval, reshufflePolicy);
    }

    /**
     * Returns a new config with the specified reshuffle policy.
     */
    public SongFolderConfig withReshufflePolicy(ReshufflePolicy policy) {
        return new SongFolderConfig(stateDir, autosaveInterval, policy);
    }
}
