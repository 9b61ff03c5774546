package io.surfworks.songfolder.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans a local directory for media files, top level only.
 *
 * <p>Files are filtered through {@link MediaExtensions} and ordered by
 * {@link NaturalOrderComparator} on their file names.
 */
public final class LocalFolderScanner implements FolderScanner {

    private static final Logger LOG = Logger.getLogger(LocalFolderScanner.class.getName());

    private static final Comparator<Path> BY_NAME = Comparator.comparing(
        (Path p) -> p.getFileName().toString(), NaturalOrderComparator.INSTANCE);

    @Override
    public List<Path> scan(Path folder) throws FolderNotFoundException {
        if (!Files.isDirectory(folder)) {
            throw new FolderNotFoundException(folder, "Folder not found: " + folder);
        }

        try (Stream<Path> entries = Files.list(folder)) {
            List<Path> tracks = entries
                .filter(Files::isRegularFile)
                .filter(MediaExtensions::isMedia)
                .sorted(BY_NAME)
                .collect(Collectors.toList());
            LOG.fine("Scanned " + folder + ": " + tracks.size() + " tracks");
            return tracks;
        } catch (IOException e) {
            throw new FolderNotFoundException(folder, "Cannot read folder: " + folder, e);
        }
    }
}
