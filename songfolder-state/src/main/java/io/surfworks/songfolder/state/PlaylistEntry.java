package io.surfworks.songfolder.state;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One row of a playlist as presented: where it sits in display order, which
 * natural-order track it is, and whether it is the current track.
 *
 * @param displayPosition position in display order
 * @param naturalIndex    index in natural (scan) order
 * @param track           the media file
 * @param current         whether this is the current track
 */
public record PlaylistEntry(int displayPosition, int naturalIndex, Path track, boolean current) {

    public PlaylistEntry {
        Objects.requireNonNull(track, "track cannot be null");
    }

    /**
     * File name for display.
     */
    public String name() {
        Path name = track.getFileName();
        return name != null ? name.toString() : track.toString();
    }
}
