package io.surfworks.songfolder.media;

import java.nio.file.Path;

/**
 * Transport controls of a media-playback engine.
 *
 * <p>Implementations own the decoding and output device. Callbacks are delivered on
 * an engine-owned thread; listeners must hand work off rather than mutate shared
 * state directly.
 */
public interface PlaybackEngine extends AutoCloseable {

    /**
     * Start playing a file from the given position.
     *
     * @param track the media file
     * @param startPositionMs where to start, in milliseconds
     * @return true if playback started
     */
    boolean play(Path track, long startPositionMs);

    /**
     * Load a file paused at the given position, ready for {@link #resume()}.
     *
     * @return true if the file was loaded
     */
    boolean load(Path track, long startPositionMs);

    void pause();

    void resume();

    /**
     * Stop playback and unload the current file.
     */
    void stop();

    /**
     * Seek within the current file. Values outside {@code [0, length]} are clamped.
     */
    void seek(long positionMs);

    /**
     * Set output volume; values outside 0-100 are clamped.
     */
    void setVolume(int volume);

    int getVolume();

    /**
     * Current position in milliseconds, or -1 if nothing is loaded.
     */
    long positionMs();

    /**
     * Length of the current file in milliseconds, or -1 if unknown.
     */
    long lengthMs();

    boolean isPlaying();

    /**
     * The file currently loaded, or null.
     */
    Path currentTrack();

    /**
     * Register the callback fired when the current file plays to its end.
     *
     * @param listener callback, or null to clear
     */
    void setEndOfTrackListener(Runnable listener);

    /**
     * Release engine resources. Does not throw.
     */
    @Override
    void close();
}
