package io.surfworks.songfolder.media;

import java.nio.file.Path;

/**
 * Thrown when a folder cannot be scanned because it is missing, is not a directory,
 * or cannot be listed.
 */
public class FolderNotFoundException extends Exception {

    private final Path folder;

    public FolderNotFoundException(Path folder, String message) {
        super(message);
        this.folder = folder;
    }

    public FolderNotFoundException(Path folder, String message, Throwable cause) {
        super(message, cause);
        this.folder = folder;
    }

    /**
     * The folder that could not be scanned.
     */
    public Path folder() {
        return folder;
    }
}
