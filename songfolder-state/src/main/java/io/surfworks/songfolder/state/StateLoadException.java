package io.surfworks.songfolder.state;

/**
 * The state file exists but cannot be read, parsed or validated.
 */
public class StateLoadException extends Exception {

    public StateLoadException(String message) {
        super(message);
    }

    public StateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
