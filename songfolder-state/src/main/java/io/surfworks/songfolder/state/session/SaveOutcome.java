package io.surfworks.songfolder.state.session;

/**
 * What a save request resulted in.
 */
public enum SaveOutcome {
    /** Written to disk synchronously */
    SAVED,

    /** Handed to the save thread */
    SCHEDULED,

    /** Merged into a save that is already pending or running */
    COALESCED,

    /** Nothing changed since the last save */
    SKIPPED_CLEAN,

    /** This instance is a reader and never saves */
    SKIPPED_READ_ONLY,

    /** The write failed; the previous file is intact */
    FAILED
}
