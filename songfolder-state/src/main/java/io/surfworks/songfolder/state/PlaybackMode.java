package io.surfworks.songfolder.state;

/**
 * Ordering mode of a playlist.
 */
public enum PlaybackMode {
    /** Tracks play in natural (folder scan) order */
    STRAIGHT,

    /** Tracks play in a stored random permutation of natural order */
    SHUFFLE
}
