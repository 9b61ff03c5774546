package io.surfworks.songfolder.state;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes {@link AppState} as a single JSON document.
 *
 * <p>Stores state in {@code <stateDir>/state.json}. Saves never modify that file in
 * place: the document is written to a temporary file in the same directory, forced
 * to disk, then moved over the target. A reader therefore always sees either the
 * previous complete document or the new one.
 */
public class StateStore {

    private static final Logger LOG = Logger.getLogger(StateStore.class.getName());

    public static final String STATE_FILE = "state.json";

    static final String TEMP_PREFIX = "state-";
    static final String TEMP_SUFFIX = ".tmp";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .create();

    private final Path stateDir;
    private final Path stateFile;

    public StateStore(Path stateDir) {
        this.stateDir = stateDir;
        this.stateFile = stateDir.resolve(STATE_FILE);
    }

    public Path stateFile() {
        return stateFile;
    }

    /**
     * Check if a state file has been written.
     */
    public boolean exists() {
        return Files.exists(stateFile);
    }

    /**
     * Load the stored state.
     *
     * @return the stored state, or a fresh default state if none was ever saved
     * @throws StateLoadException if the file is unreadable, not JSON, or violates the schema
     */
    public AppState load() throws StateLoadException {
        if (!Files.exists(stateFile)) {
            return new AppState();
        }

        String json;
        try {
            json = Files.readString(stateFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StateLoadException("Cannot read " + stateFile, e);
        }

        StoredState stored;
        try {
            stored = GSON.fromJson(json, StoredState.class);
        } catch (JsonParseException e) {
            throw new StateLoadException("Malformed state document " + stateFile, e);
        }
        if (stored == null) {
            throw new StateLoadException("Empty state document " + stateFile);
        }
        return toAppState(stored);
    }

    /**
     * Write the full state atomically.
     *
     * @throws StateSaveException if the document could not be written; the previous
     *                            file is untouched and no temporary file is left behind
     */
    public void save(AppState state) throws StateSaveException {
        byte[] bytes = GSON.toJson(toStored(state)).getBytes(StandardCharsets.UTF_8);

        Path temp = null;
        try {
            Files.createDirectories(stateDir);
            temp = Files.createTempFile(stateDir, TEMP_PREFIX, TEMP_SUFFIX);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            commit(temp, stateFile);
            temp = null;
        } catch (IOException e) {
            throw new StateSaveException("Failed to save state to " + stateFile, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
        syncDirectory();
    }

    /**
     * Move a fully written temporary file over the state file.
     */
    protected void commit(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.fine("Atomic move not supported in " + stateDir + ", falling back to replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Delete temporary files left behind by an interrupted save.
     *
     * <p>Only the writer instance should call this; a concurrent writer's temp file
     * would otherwise be removed mid-save.
     *
     * @return number of files deleted
     */
    public int deleteStaleTempFiles() {
        if (!Files.isDirectory(stateDir)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> stale = Files.newDirectoryStream(stateDir, TEMP_PREFIX + "*" + TEMP_SUFFIX)) {
            for (Path path : stale) {
                if (deleteQuietly(path)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not list " + stateDir + " for stale temp files", e);
        }
        if (deleted > 0) {
            LOG.info("Removed " + deleted + " stale temp file(s) from " + stateDir);
        }
        return deleted;
    }

    // ========== Mapping ==========

    private AppState toAppState(StoredState stored) throws StateLoadException {
        int volume = stored.volume != null ? stored.volume : AppState.DEFAULT_VOLUME;
        if (volume < AppState.MIN_VOLUME || volume > AppState.MAX_VOLUME) {
            throw new StateLoadException("volume out of range: " + volume);
        }

        double zoom = stored.zoomLevel != null ? stored.zoomLevel : AppState.DEFAULT_ZOOM;
        if (!(zoom >= AppState.MIN_ZOOM && zoom <= AppState.MAX_ZOOM)) {
            throw new StateLoadException("zoom_level out of range: " + zoom);
        }

        List<String> recent = stored.recentFolders != null ? stored.recentFolders : List.of();
        if (recent.contains(null)) {
            throw new StateLoadException("recent_folders contains null");
        }
        RecentFolders recentFolders = RecentFolders.of(recent);
        if (recentFolders.size() != recent.size()) {
            LOG.warning("Normalized recent_folders: dropped " + (recent.size() - recentFolders.size()) + " entries");
        }

        Map<String, PlaylistState> playlists = new LinkedHashMap<>();
        if (stored.playlists != null) {
            for (Map.Entry<String, StoredPlaylist> entry : stored.playlists.entrySet()) {
                String folder = entry.getKey();
                if (folder == null || folder.isBlank()) {
                    throw new StateLoadException("playlists contains a blank folder key");
                }
                playlists.put(folder, toPlaylistState(folder, entry.getValue()));
            }
        }

        return new AppState(recentFolders, playlists, volume, zoom);
    }

    private static PlaylistState toPlaylistState(String folder, StoredPlaylist stored) throws StateLoadException {
        if (stored == null) {
            throw new StateLoadException("playlist for " + folder + " is null");
        }
        int currentIndex = stored.currentIndex != null ? stored.currentIndex : 0;
        if (currentIndex < 0) {
            throw new StateLoadException("current_index of " + folder + " is negative: " + currentIndex);
        }
        long position = stored.playbackPositionMs != null ? stored.playbackPositionMs : 0L;
        if (position < 0) {
            throw new StateLoadException("playback_position_ms of " + folder + " is negative: " + position);
        }

        List<Integer> order = stored.shuffleOrder;
        if (order != null && !Permutations.isPermutation(order, order.size())) {
            LOG.warning("Discarding invalid shuffle_order of " + folder + ": " + order);
            order = null;
        }

        boolean loop = stored.loopEnabled != null && stored.loopEnabled;
        return new PlaylistState(currentIndex, order, loop, position);
    }

    private static StoredState toStored(AppState state) {
        StoredState stored = new StoredState();
        stored.recentFolders = new ArrayList<>(state.recentFolders().asList());
        stored.playlists = new LinkedHashMap<>();
        state.playlists().forEach((folder, playlist) -> {
            StoredPlaylist sp = new StoredPlaylist();
            sp.currentIndex = playlist.currentIndex();
            sp.shuffleOrder = playlist.shuffleOrder();
            sp.loopEnabled = playlist.loopEnabled();
            sp.playbackPositionMs = playlist.playbackPositionMs();
            stored.playlists.put(folder, sp);
        });
        stored.volume = state.volume();
        stored.zoomLevel = state.zoomLevel();
        return stored;
    }

    private void syncDirectory() {
        // Makes the rename itself durable; not supported on every platform
        try (FileChannel dir = FileChannel.open(stateDir, StandardOpenOption.READ)) {
            dir.force(true);
        } catch (IOException | UnsupportedOperationException e) {
            LOG.log(Level.FINE, "Directory sync not available for " + stateDir, e);
        }
    }

    private static boolean deleteQuietly(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not delete temp file " + path, e);
            return false;
        }
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class StoredState {
        @SerializedName("recent_folders")
        List<String> recentFolders;
        Map<String, StoredPlaylist> playlists;
        Integer volume;
        @SerializedName("zoom_level")
        Double zoomLevel;
    }

    private static class StoredPlaylist {
        @SerializedName("current_index")
        Integer currentIndex;
        @SerializedName("shuffle_order")
        List<Integer> shuffleOrder;
        @SerializedName("loop_enabled")
        Boolean loopEnabled;
        @SerializedName("playback_position_ms")
        Long playbackPositionMs;
    }
}
