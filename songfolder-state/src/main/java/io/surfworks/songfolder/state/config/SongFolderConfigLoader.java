package io.surfworks.songfolder.state.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.songfolder.state.ReshufflePolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves {@link SongFolderConfig}.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Config file ({@code <stateDir>/config.json})</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Example file:
 * <pre>{@code
 * {
 *   "autosaveIntervalSeconds": 5,
 *   "reshufflePolicy": "keep-current-first"
 * }
 * }</pre>
 *
 * <p>A config file that cannot be parsed is ignored with a warning; a bad config
 * never prevents startup.
 */
public final class SongFolderConfigLoader {

    private static final Logger LOG = Logger.getLogger(SongFolderConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private SongFolderConfigLoader() {
    }

    /**
     * Loads configuration for the state directory resolved from the environment.
     */
    public static SongFolderConfig load() {
        return load(SongFolderConfig.defaults().stateDir());
    }

    /**
     * Loads configuration for a specific state directory.
     *
     * @param stateDir the state directory
     * @return the loaded configuration
     */
    public static SongFolderConfig load(Path stateDir) {
        SongFolderConfig config = SongFolderConfig.defaults(stateDir);
        Path configFile = config.configFile();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration into its state directory.
     *
     * @param config the configuration to save
     * @throws IOException if saving fails
     */
    public static void save(SongFolderConfig config) throws IOException {
        Files.createDirectories(config.stateDir());

        ObjectNode root = JSON.createObjectNode();
        root.put("autosaveIntervalSeconds", config.autosaveInterval().toSeconds());
        root.put("reshufflePolicy", policyName(config.reshufflePolicy()));

        JSON.writerWithDefaultPrettyPrinter().writeValue(config.configFile().toFile(), root);
    }

    /**
     * Parse a policy name such as {@code keep-current-first} or {@code RESET_TO_START}.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ReshufflePolicy parsePolicy(String name) {
        return ReshufflePolicy.valueOf(name.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    static String policyName(ReshufflePolicy policy) {
        return policy.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static SongFolderConfig loadFromFile(Path configFile, SongFolderConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring " + configFile + ": not a JSON object");
                return base;
            }

            SongFolderConfig config = base;

            if (root.has("autosaveIntervalSeconds")) {
                long seconds = root.get("autosaveIntervalSeconds").asLong(0);
                if (seconds <= 0) {
                    LOG.warning("Ignoring non-positive autosaveIntervalSeconds in " + configFile);
                } else if (seconds > SongFolderConfig.MAX_AUTOSAVE_INTERVAL.toSeconds()) {
                    LOG.warning("Ignoring autosaveIntervalSeconds above "
                        + SongFolderConfig.MAX_AUTOSAVE_INTERVAL.toSeconds() + " in " + configFile);
                } else {
                    config = config.withAutosaveInterval(Duration.ofSeconds(seconds));
                }
            }

            if (root.has("reshufflePolicy")) {
                try {
                    config = config.withReshufflePolicy(parsePolicy(root.get("reshufflePolicy").asText()));
                } catch (IllegalArgumentException e) {
                    LOG.warning("Ignoring unknown reshufflePolicy in " + configFile + ": " + e.getMessage());
                }
            }

            return config;

        } catch (IOException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable config " + configFile, e);
            return base;
        }
    }
}
