package io.surfworks.songfolder.state;

/**
 * Outcome of a next/previous step through the display order.
 */
public enum StepResult {
    /** Moved to the adjacent track */
    MOVED,

    /** Stepped past a boundary and wrapped around because looping is on */
    WRAPPED,

    /** Already at the boundary with looping off; position unchanged */
    END_OF_PLAYLIST,

    /** The playlist has no tracks */
    EMPTY;

    /**
     * Returns true if the current track changed.
     */
    public boolean moved() {
        return this == MOVED || this == WRAPPED;
    }
}
