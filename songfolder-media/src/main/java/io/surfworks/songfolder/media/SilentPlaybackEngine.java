package io.surfworks.songfolder.media;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * A playback engine that keeps transport state without producing any sound.
 *
 * <p>Used by the headless front end and by tests. Time does not advance on its
 * own; callers move it with {@link #advance(long)}, and reaching the track length
 * fires the end-of-track listener. When no length is known the track never ends.
 */
public class SilentPlaybackEngine implements PlaybackEngine {

    private static final Logger LOG = Logger.getLogger(SilentPlaybackEngine.class.getName());

    private Path track;
    private long positionMs = -1;
    private long lengthMs = -1;
    private long defaultLengthMs;
    private boolean playing;
    private int volume = 100;
    private Runnable endOfTrackListener;

    public SilentPlaybackEngine() {
        this(-1);
    }

    /**
     * @param defaultLengthMs length reported for every loaded track, or -1 for unknown
     */
    public SilentPlaybackEngine(long defaultLengthMs) {
        this.defaultLengthMs = defaultLengthMs;
    }

    @Override
    public synchronized boolean play(Path track, long startPositionMs) {
        if (!load(track, startPositionMs)) {
            return false;
        }
        playing = true;
        return true;
    }

    @Override
    public synchronized boolean load(Path track, long startPositionMs) {
        if (track == null || !Files.exists(track)) {
            LOG.fine("Cannot load missing track " + track);
            return false;
        }
        this.track = track;
        this.lengthMs = defaultLengthMs;
        this.playing = false;
        this.positionMs = clamp(startPositionMs);
        return true;
    }

    @Override
    public synchronized void pause() {
        playing = false;
    }

    @Override
    public synchronized void resume() {
        if (track != null) {
            playing = true;
        }
    }

    @Override
    public synchronized void stop() {
        track = null;
        playing = false;
        positionMs = -1;
        lengthMs = -1;
    }

    @Override
    public synchronized void seek(long positionMs) {
        if (track != null) {
            this.positionMs = clamp(positionMs);
        }
    }

    @Override
    public synchronized void setVolume(int volume) {
        this.volume = Math.max(0, Math.min(100, volume));
    }

    @Override
    public synchronized int getVolume() {
        return volume;
    }

    @Override
    public synchronized long positionMs() {
        return positionMs;
    }

    @Override
    public synchronized long lengthMs() {
        return lengthMs;
    }

    @Override
    public synchronized boolean isPlaying() {
        return playing;
    }

    @Override
    public synchronized Path currentTrack() {
        return track;
    }

    @Override
    public synchronized void setEndOfTrackListener(Runnable listener) {
        this.endOfTrackListener = listener;
    }

    /**
     * Set the length reported for tracks loaded from now on.
     */
    public synchronized void setDefaultLengthMs(long lengthMs) {
        this.defaultLengthMs = lengthMs;
    }

    /**
     * Move the playback clock forward while playing.
     *
     * <p>If this reaches the end of the track, playback stops and the end-of-track
     * listener fires (outside the engine's monitor).
     */
    public void advance(long deltaMs) {
        Runnable listener = null;
        synchronized (this) {
            if (!playing || track == null) {
                return;
            }
            positionMs += deltaMs;
            if (lengthMs >= 0 && positionMs >= lengthMs) {
                positionMs = lengthMs;
                playing = false;
                listener = endOfTrackListener;
            }
        }
        if (listener != null) {
            listener.run();
        }
    }

    @Override
    public synchronized void close() {
        stop();
        endOfTrackListener = null;
    }

    private long clamp(long value) {
        long clamped = Math.max(0, value);
        if (lengthMs >= 0) {
            clamped = Math.min(clamped, lengthMs);
        }
        return clamped;
    }
}
