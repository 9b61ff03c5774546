package io.surfworks.songfolder.state;

/**
 * The state could not be written. The previous state file is left as it was.
 */
public class StateSaveException extends Exception {

    public StateSaveException(String message) {
        super(message);
    }

    public StateSaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
