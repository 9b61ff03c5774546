package io.surfworks.songfolder.state;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Ordering state machine for one opened folder.
 *
 * <p>Binds a folder's {@link PlaylistState} to the tracks found by the latest scan
 * (<em>natural order</em>) and implements shuffle, stepping, looping and track
 * selection on top of it. All changes are written through to the bound state.
 *
 * <p>A playlist built with {@link #unavailable} stands for a folder that could not
 * be scanned. It has no tracks and ignores every mutation, so the stored state
 * survives until the folder can be read again.
 *
 * <p>Not thread-safe; used on the session's dispatch thread only.
 */
public final class Playlist {

    private static final Logger LOG = Logger.getLogger(Playlist.class.getName());

    private final String folderKey;
    private final List<Path> tracks;
    private final PlaylistState state;
    private final Random random;
    private final ReshufflePolicy reshufflePolicy;
    private final boolean available;

    private Playlist(String folderKey, List<Path> tracks, PlaylistState state, Random random,
                     ReshufflePolicy reshufflePolicy, boolean available) {
        this.folderKey = Objects.requireNonNull(folderKey, "folderKey cannot be null");
        this.tracks = List.copyOf(tracks);
        this.state = Objects.requireNonNull(state, "state cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.reshufflePolicy = Objects.requireNonNull(reshufflePolicy, "reshufflePolicy cannot be null");
        this.available = available;
    }

    /**
     * Bind a freshly scanned folder to its stored state, repairing the state where
     * it no longer fits the track count.
     */
    public static Playlist open(String folderKey, List<Path> tracks, PlaylistState state,
                                Random random, ReshufflePolicy reshufflePolicy) {
        Playlist playlist = new Playlist(folderKey, tracks, state, random, reshufflePolicy, true);
        playlist.reconcile();
        return playlist;
    }

    /**
     * A playlist for a folder that is missing or unreadable.
     */
    public static Playlist unavailable(String folderKey, PlaylistState state,
                                       Random random, ReshufflePolicy reshufflePolicy) {
        return new Playlist(folderKey, List.of(), state, random, reshufflePolicy, false);
    }

    /**
     * Make the stored state consistent with the current track count: discard a
     * shuffle order that is not a permutation of the tracks and clamp the current
     * index into range.
     *
     * @return true if the stored state was changed
     */
    boolean reconcile() {
        boolean changed = false;
        int n = tracks.size();

        List<Integer> order = state.shuffleOrder();
        if (order != null && !Permutations.isPermutation(order, n)) {
            LOG.warning("Discarding shuffle order of " + folderKey + ": not a permutation of " + n + " tracks");
            state.setShuffleOrder(null);
            changed = true;
        }

        int maxIndex = Math.max(0, n - 1);
        if (state.currentIndex() > maxIndex) {
            state.setCurrentIndex(maxIndex);
            state.setPlaybackPositionMs(0);
            changed = true;
        }
        return changed;
    }

    // ========== Queries ==========

    public String folderKey() {
        return folderKey;
    }

    public boolean isAvailable() {
        return available;
    }

    public PlaylistState state() {
        return state;
    }

    public int trackCount() {
        return tracks.size();
    }

    public boolean isEmpty() {
        return tracks.isEmpty();
    }

    public PlaybackMode mode() {
        return state.mode();
    }

    public ReshufflePolicy reshufflePolicy() {
        return reshufflePolicy;
    }

    /**
     * Tracks in natural order.
     */
    public List<Path> tracks() {
        return tracks;
    }

    /**
     * Natural-order indices in the order they are played.
     */
    public List<Integer> displayOrder() {
        List<Integer> order = state.shuffleOrder();
        return order != null ? order : Permutations.identity(tracks.size());
    }

    /**
     * Natural-order index of the track at a display position.
     */
    public int naturalIndexAt(int displayPosition) {
        checkDisplayPosition(displayPosition);
        List<Integer> order = state.shuffleOrder();
        return order != null ? order.get(displayPosition) : displayPosition;
    }

    public Path trackAt(int displayPosition) {
        return tracks.get(naturalIndexAt(displayPosition));
    }

    /**
     * The current track, empty when the playlist has no tracks.
     */
    public Optional<Path> currentTrack() {
        if (tracks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(trackAt(state.currentIndex()));
    }

    /**
     * All tracks in display order.
     */
    public List<PlaylistEntry> entries() {
        return filter("");
    }

    /**
     * Tracks in display order whose file name contains {@code query},
     * case-insensitively. A blank query matches everything.
     */
    public List<PlaylistEntry> filter(String query) {
        String needle = query == null ? "" : query.strip().toLowerCase(Locale.ROOT);
        List<Integer> order = displayOrder();
        List<PlaylistEntry> entries = new ArrayList<>();
        for (int pos = 0; pos < order.size(); pos++) {
            int natural = order.get(pos);
            Path track = tracks.get(natural);
            PlaylistEntry entry = new PlaylistEntry(pos, natural, track, pos == state.currentIndex());
            if (needle.isEmpty() || entry.name().toLowerCase(Locale.ROOT).contains(needle)) {
                entries.add(entry);
            }
        }
        return entries;
    }

    // ========== Transitions ==========

    /**
     * Switch shuffle on or off while keeping the same track current.
     *
     * <p>Turning shuffle on places the current track first in a fresh permutation.
     * Turning it off moves the current index to the track's natural position.
     *
     * @return true if the mode changed
     */
    public boolean setShuffle(boolean enabled) {
        if (!available || enabled == (state.mode() == PlaybackMode.SHUFFLE)) {
            return false;
        }
        int n = tracks.size();
        if (enabled) {
            if (n == 0) {
                state.setShuffleOrder(List.of());
            } else {
                int playing = naturalIndexAt(state.currentIndex());
                state.setShuffleOrder(Permutations.shuffledWithFirst(n, playing, random));
            }
            state.setCurrentIndex(0);
        } else {
            int playing = n == 0 ? 0 : naturalIndexAt(state.currentIndex());
            state.setShuffleOrder(null);
            state.setCurrentIndex(playing);
        }
        return true;
    }

    /**
     * Generate a new shuffle order according to the {@link ReshufflePolicy}.
     * Does nothing in straight mode.
     *
     * @return true if a new order was generated
     */
    public boolean reshuffle() {
        if (!available || state.mode() != PlaybackMode.SHUFFLE) {
            return false;
        }
        int n = tracks.size();
        if (n == 0) {
            return false;
        }
        switch (reshufflePolicy) {
            case KEEP_CURRENT_FIRST -> {
                int playing = naturalIndexAt(state.currentIndex());
                state.setShuffleOrder(Permutations.shuffledWithFirst(n, playing, random));
            }
            case RESET_TO_START -> {
                state.setShuffleOrder(Permutations.shuffled(n, random));
                state.setPlaybackPositionMs(0);
            }
        }
        state.setCurrentIndex(0);
        return true;
    }

    /**
     * Advance one track in display order, wrapping to the start when looping.
     */
    public StepResult next() {
        if (!available || tracks.isEmpty()) {
            return StepResult.EMPTY;
        }
        int next = state.currentIndex() + 1;
        if (next < tracks.size()) {
            moveTo(next);
            return StepResult.MOVED;
        }
        if (state.loopEnabled()) {
            moveTo(0);
            return StepResult.WRAPPED;
        }
        return StepResult.END_OF_PLAYLIST;
    }

    /**
     * Go back one track in display order, wrapping to the end when looping.
     */
    public StepResult previous() {
        if (!available || tracks.isEmpty()) {
            return StepResult.EMPTY;
        }
        int previous = state.currentIndex() - 1;
        if (previous >= 0) {
            moveTo(previous);
            return StepResult.MOVED;
        }
        if (state.loopEnabled()) {
            moveTo(tracks.size() - 1);
            return StepResult.WRAPPED;
        }
        return StepResult.END_OF_PLAYLIST;
    }

    /**
     * Make the track at a display position current. The playback position resets
     * unless the position is already current.
     *
     * @return true if the current index changed
     * @throws IllegalArgumentException if the position is out of range
     */
    public boolean select(int displayPosition) {
        if (!available) {
            return false;
        }
        checkDisplayPosition(displayPosition);
        if (displayPosition == state.currentIndex()) {
            return false;
        }
        moveTo(displayPosition);
        return true;
    }

    /**
     * Record the playback position within the current track.
     *
     * @return true if the stored position changed
     */
    public boolean updatePosition(long positionMs) {
        if (positionMs < 0) {
            throw new IllegalArgumentException("position cannot be negative: " + positionMs);
        }
        if (!available || positionMs == state.playbackPositionMs()) {
            return false;
        }
        state.setPlaybackPositionMs(positionMs);
        return true;
    }

    /**
     * Flip looping.
     *
     * @return the new loop setting
     */
    public boolean toggleLoop() {
        if (available) {
            state.setLoopEnabled(!state.loopEnabled());
        }
        return state.loopEnabled();
    }

    private void moveTo(int displayPosition) {
        state.setCurrentIndex(displayPosition);
        state.setPlaybackPositionMs(0);
    }

    private void checkDisplayPosition(int displayPosition) {
        if (displayPosition < 0 || displayPosition >= tracks.size()) {
            throw new IllegalArgumentException(
                "Track position " + displayPosition + " out of range for " + tracks.size() + " tracks");
        }
    }
}
