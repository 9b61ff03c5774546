package io.surfworks.songfolder.state;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything SongFolder persists: recent folders, per-folder playlist state,
 * volume and zoom.
 *
 * <p>Not thread-safe. One instance is owned by the player session and mutated on
 * its dispatch thread; persistence works on {@link #copy()} snapshots.
 *
 * <p>Every mutation made through this class bumps {@link #revision()}. Changes made
 * directly on a {@link PlaylistState} must be followed by {@link #markModified()}.
 */
public final class AppState {

    public static final int MIN_VOLUME = 0;
    public static final int MAX_VOLUME = 100;
    public static final int DEFAULT_VOLUME = 100;

    public static final double MIN_ZOOM = 0.5;
    public static final double MAX_ZOOM = 2.0;
    public static final double DEFAULT_ZOOM = 1.0;
    public static final double ZOOM_STEP = 0.1;

    private final RecentFolders recentFolders;
    private final Map<String, PlaylistState> playlists;
    private int volume;
    private double zoomLevel;
    private long revision;

    /**
     * Fresh default state: nothing opened, full volume, 100% zoom.
     */
    public AppState() {
        this(new RecentFolders(), new LinkedHashMap<>(), DEFAULT_VOLUME, DEFAULT_ZOOM);
    }

    AppState(RecentFolders recentFolders, Map<String, PlaylistState> playlists, int volume, double zoomLevel) {
        this.recentFolders = Objects.requireNonNull(recentFolders, "recentFolders cannot be null");
        this.playlists = new LinkedHashMap<>(playlists);
        this.volume = clampVolume(volume);
        this.zoomLevel = clampZoom(zoomLevel);
    }

    /**
     * The identity under which a folder's state is stored: its absolute,
     * normalized path string.
     */
    public static String folderKey(Path folder) {
        return folder.toAbsolutePath().normalize().toString();
    }

    // ========== Folders and playlists ==========

    /**
     * Record that a folder was opened: move it to the front of the recent list and
     * create its playlist state on first use.
     *
     * @return the folder's playlist state
     */
    public PlaylistState openFolder(String folderKey) {
        recentFolders.add(folderKey);
        PlaylistState state = playlists.computeIfAbsent(folderKey, k -> new PlaylistState());
        markModified();
        return state;
    }

    /**
     * Remove a folder from the recent list. Its playlist state is kept.
     *
     * @return true if the folder was listed
     */
    public boolean forgetFolder(String folderKey) {
        boolean removed = recentFolders.remove(folderKey);
        if (removed) {
            markModified();
        }
        return removed;
    }

    /**
     * Read-only view of the recent folders. Use {@link #openFolder} and
     * {@link #forgetFolder} to change it.
     */
    public RecentFolders recentFolders() {
        return recentFolders.copy();
    }

    public Optional<PlaylistState> findPlaylist(String folderKey) {
        return Optional.ofNullable(playlists.get(folderKey));
    }

    /**
     * Unmodifiable view of all playlist states keyed by folder.
     */
    public Map<String, PlaylistState> playlists() {
        return Collections.unmodifiableMap(playlists);
    }

    // ========== Volume ==========

    public int volume() {
        return volume;
    }

    /**
     * Set the volume, clamped to 0-100.
     *
     * @return the volume actually stored
     */
    public int setVolume(int volume) {
        int clamped = clampVolume(volume);
        if (clamped != this.volume) {
            this.volume = clamped;
            markModified();
        }
        return this.volume;
    }

    public int adjustVolume(int delta) {
        return setVolume(volume + delta);
    }

    // ========== Zoom ==========

    public double zoomLevel() {
        return zoomLevel;
    }

    /**
     * Set the zoom level, clamped to 0.5-2.0 and rounded to two decimals so that
     * repeated steps do not drift.
     *
     * @return the zoom level actually stored
     */
    public double setZoomLevel(double zoomLevel) {
        double clamped = clampZoom(zoomLevel);
        if (clamped != this.zoomLevel) {
            this.zoomLevel = clamped;
            markModified();
        }
        return this.zoomLevel;
    }

    public double zoomIn() {
        return setZoomLevel(zoomLevel + ZOOM_STEP);
    }

    public double zoomOut() {
        return setZoomLevel(zoomLevel - ZOOM_STEP);
    }

    public double resetZoom() {
        return setZoomLevel(DEFAULT_ZOOM);
    }

    // ========== Revision tracking ==========

    /**
     * In-memory modification counter. Not persisted.
     */
    public long revision() {
        return revision;
    }

    public void markModified() {
        revision++;
    }

    /**
     * Deep copy carrying the same revision.
     */
    public AppState copy() {
        Map<String, PlaylistState> copies = new LinkedHashMap<>();
        playlists.forEach((folder, state) -> copies.put(folder, state.copy()));
        AppState copy = new AppState(recentFolders.copy(), copies, volume, zoomLevel);
        copy.revision = revision;
        return copy;
    }

    static int clampVolume(int volume) {
        return Math.max(MIN_VOLUME, Math.min(MAX_VOLUME, volume));
    }

    static double clampZoom(double zoom) {
        if (Double.isNaN(zoom)) {
            return DEFAULT_ZOOM;
        }
        double clamped = Math.max(MIN_ZOOM, Math.min(MAX_ZOOM, zoom));
        return Math.round(clamped * 100.0) / 100.0;
    }

    /**
     * Semantic equality; the revision counter is ignored.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppState)) return false;
        AppState that = (AppState) o;
        return volume == that.volume
            && Double.compare(zoomLevel, that.zoomLevel) == 0
            && recentFolders.equals(that.recentFolders)
            && playlists.equals(that.playlists);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recentFolders, playlists, volume, zoomLevel);
    }

    @Override
    public String toString() {
        return "AppState[recentFolders=" + recentFolders
            + ", playlists=" + playlists.size()
            + ", volume=" + volume
            + ", zoomLevel=" + zoomLevel + "]";
    }
}
