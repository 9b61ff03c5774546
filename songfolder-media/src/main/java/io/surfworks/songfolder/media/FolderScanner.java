package io.surfworks.songfolder.media;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns a directory into the ordered list of playable tracks it contains.
 *
 * <p>The returned order is the playlist's <em>natural order</em>: it must be stable
 * for an unchanged directory, since persisted playlist positions and shuffle orders
 * are indices into it.
 */
public interface FolderScanner {

    /**
     * Scan a folder for media files.
     *
     * @param folder the directory to scan (not descended into)
     * @return media files in natural order, possibly empty
     * @throws FolderNotFoundException if the folder is missing or unreadable
     */
    List<Path> scan(Path folder) throws FolderNotFoundException;
}
