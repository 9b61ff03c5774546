package io.surfworks.songfolder.state;

/**
 * What happens to the playing track when a shuffled playlist is reshuffled.
 */
public enum ReshufflePolicy {

    /**
     * The playing track is placed first in the new order and keeps playing.
     */
    KEEP_CURRENT_FIRST,

    /**
     * The new order is fully random and playback moves to its first track
     * from the beginning.
     */
    RESET_TO_START
}
