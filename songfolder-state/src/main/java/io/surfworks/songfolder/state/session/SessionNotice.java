package io.surfworks.songfolder.state.session;

import java.util.Objects;

/**
 * A passive, non-blocking message for the user.
 *
 * @param kind    category
 * @param message human-readable text
 */
public record SessionNotice(Kind kind, String message) {

    public enum Kind {
        /** Another instance owns the state; changes will not be saved */
        READ_ONLY,

        /** The state file was corrupt and defaults are in use */
        LOAD_FAILED,

        /** A save failed; it will be retried */
        SAVE_FAILED,

        /** A remembered folder is missing or unreadable */
        FOLDER_NOT_FOUND,

        /** Playback reached the end of a non-looping playlist */
        END_OF_PLAYLIST
    }

    public SessionNotice {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }
}
