package io.surfworks.songfolder.state;

import java.util.List;
import java.util.Objects;

/**
 * Persisted playback state of one folder.
 *
 * <p>{@code currentIndex} indexes the <em>display order</em>: natural order in
 * straight mode, {@code shuffleOrder} in shuffle mode. Consistency with the
 * folder's current track count is restored by {@link Playlist} after each scan;
 * this class only enforces non-negativity.
 */
public final class PlaylistState {

    private int currentIndex;
    private List<Integer> shuffleOrder;
    private boolean loopEnabled;
    private long playbackPositionMs;

    /**
     * State for a folder opened for the first time: first track, straight order,
     * no looping, start of track.
     */
    public PlaylistState() {
        this(0, null, false, 0);
    }

    public PlaylistState(int currentIndex, List<Integer> shuffleOrder, boolean loopEnabled, long playbackPositionMs) {
        setCurrentIndex(currentIndex);
        setShuffleOrder(shuffleOrder);
        setLoopEnabled(loopEnabled);
        setPlaybackPositionMs(playbackPositionMs);
    }

    public int currentIndex() {
        return currentIndex;
    }

    public void setCurrentIndex(int currentIndex) {
        if (currentIndex < 0) {
            throw new IllegalArgumentException("currentIndex cannot be negative: " + currentIndex);
        }
        this.currentIndex = currentIndex;
    }

    /**
     * The shuffle permutation, or null in straight mode.
     */
    public List<Integer> shuffleOrder() {
        return shuffleOrder;
    }

    /**
     * Set the shuffle permutation; null switches to straight mode.
     */
    public void setShuffleOrder(List<Integer> shuffleOrder) {
        this.shuffleOrder = shuffleOrder != null ? List.copyOf(shuffleOrder) : null;
    }

    public PlaybackMode mode() {
        return shuffleOrder != null ? PlaybackMode.SHUFFLE : PlaybackMode.STRAIGHT;
    }

    public boolean loopEnabled() {
        return loopEnabled;
    }

    public void setLoopEnabled(boolean loopEnabled) {
        this.loopEnabled = loopEnabled;
    }

    public long playbackPositionMs() {
        return playbackPositionMs;
    }

    public void setPlaybackPositionMs(long playbackPositionMs) {
        if (playbackPositionMs < 0) {
            throw new IllegalArgumentException("playbackPositionMs cannot be negative: " + playbackPositionMs);
        }
        this.playbackPositionMs = playbackPositionMs;
    }

    public PlaylistState copy() {
        return new PlaylistState(currentIndex, shuffleOrder, loopEnabled, playbackPositionMs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlaylistState)) return false;
        PlaylistState that = (PlaylistState) o;
        return currentIndex == that.currentIndex
            && loopEnabled == that.loopEnabled
            && playbackPositionMs == that.playbackPositionMs
            && Objects.equals(shuffleOrder, that.shuffleOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(currentIndex, shuffleOrder, loopEnabled, playbackPositionMs);
    }

    @Override
    public String toString() {
        return "PlaylistState[currentIndex=" + currentIndex
            + ", shuffleOrder=" + shuffleOrder
            + ", loopEnabled=" + loopEnabled
            + ", playbackPositionMs=" + playbackPositionMs + "]";
    }
}
