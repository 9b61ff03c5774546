package io.surfworks.songfolder.media;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Allow-list of file extensions that are treated as playable media.
 *
 * <p>Matching is case-insensitive and looks only at the text after the last dot
 * of the file name.
 */
public final class MediaExtensions {

    /** Supported audio extensions, lower case with leading dot. */
    public static final Set<String> AUDIO = Set.of(
        ".mp3", ".wav", ".flac", ".aac", ".ogg", ".wma", ".m4a", ".opus", ".aiff"
    );

    /** Supported video extensions, lower case with leading dot. */
    public static final Set<String> VIDEO = Set.of(
        ".mp4", ".mkv", ".avi", ".mov", ".wmv", ".flv", ".webm", ".m4v", ".mpeg", ".mpg"
    );

    private MediaExtensions() {}

    /**
     * Check if a file name carries a supported media extension.
     */
    public static boolean isMedia(String fileName) {
        String ext = extensionOf(fileName);
        return AUDIO.contains(ext) || VIDEO.contains(ext);
    }

    /**
     * Check if a path's file name carries a supported media extension.
     */
    public static boolean isMedia(Path path) {
        Path name = path.getFileName();
        return name != null && isMedia(name.toString());
    }

    /**
     * Check if a file name is an audio file.
     */
    public static boolean isAudio(String fileName) {
        return AUDIO.contains(extensionOf(fileName));
    }

    /**
     * Lower-cased extension including the dot, or an empty string if there is none.
     *
     * <p>A leading dot alone (".mp3" as a whole name) counts as a hidden file with
     * no extension.
     */
    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
