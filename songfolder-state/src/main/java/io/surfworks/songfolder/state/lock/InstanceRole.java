package io.surfworks.songfolder.state.lock;

/**
 * Role of this process with respect to the shared state file.
 */
public enum InstanceRole {
    /** Holds the instance lock; the only process allowed to save */
    WRITER,

    /** Another process holds the lock; saves are suppressed */
    READER;

    /**
     * Returns true if this role may write the state file.
     */
    public boolean canSave() {
        return this == WRITER;
    }
}
