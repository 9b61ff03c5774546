package io.surfworks.songfolder.state.session;

import io.surfworks.songfolder.media.FolderNotFoundException;
import io.surfworks.songfolder.media.FolderScanner;
import io.surfworks.songfolder.media.LocalFolderScanner;
import io.surfworks.songfolder.media.PlaybackEngine;
import io.surfworks.songfolder.state.AppState;
import io.surfworks.songfolder.state.PlaybackMode;
import io.surfworks.songfolder.state.Playlist;
import io.surfworks.songfolder.state.PlaylistEntry;
import io.surfworks.songfolder.state.PlaylistState;
import io.surfworks.songfolder.state.ReshufflePolicy;
import io.surfworks.songfolder.state.StateLoadException;
import io.surfworks.songfolder.state.StateStore;
import io.surfworks.songfolder.state.StepResult;
import io.surfworks.songfolder.state.config.SongFolderConfig;
import io.surfworks.songfolder.state.lock.FileLockCoordinator;
import io.surfworks.songfolder.state.lock.LockAcquisition;
import io.surfworks.songfolder.state.lock.LockCoordinator;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the application state of one running instance and applies events to it.
 *
 * <p>Usage:
 * <pre>{@code
 * try (PlayerSession session = PlayerSession.create(config, engine)) {
 *     LockAcquisition lock = session.start(true);
 *     if (!lock.isWriter()) {
 *         showReadOnlyBadge();
 *     }
 *     session.send(new PlayerEvent.OpenFolder(Path.of("/music/album")));
 *     session.send(new PlayerEvent.SetShuffle(true));
 * }
 * }</pre>
 *
 * <p>Startup decides the instance role once, loads the state (falling back to
 * defaults if the file is corrupt) and starts the autosave timer. Every event,
 * including timer ticks and end-of-track callbacks, is applied on a single dispatch
 * thread. Closing cancels the timer, captures the playback position, performs a final
 * synchronous save and only then releases the instance lock.
 */
public final class PlayerSession implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PlayerSession.class.getName());

    private static final long CLOSE_TIMEOUT_SECONDS = 30;

    private final SongFolderConfig config;
    private final StateStore store;
    private final LockCoordinator lockCoordinator;
    private final FolderScanner scanner;
    private final PlaybackEngine engine;
    private final Random random;
    private final EventDispatcher dispatcher = new EventDispatcher();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    // Confined to the dispatch thread once started
    private AppState state;
    private Playlist active;
    private Autosaver autosaver;

    private volatile LockAcquisition lock;
    private volatile SaveOutcome finalSave;
    private volatile boolean started;
    private boolean closed;

    public PlayerSession(SongFolderConfig config, StateStore store, LockCoordinator lockCoordinator,
                         FolderScanner scanner, PlaybackEngine engine, Random random) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.lockCoordinator = Objects.requireNonNull(lockCoordinator, "lockCoordinator cannot be null");
        this.scanner = Objects.requireNonNull(scanner, "scanner cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Session with the standard collaborators: state and lock files in the
     * configured directory and a local folder scanner.
     */
    public static PlayerSession create(SongFolderConfig config, PlaybackEngine engine) {
        return new PlayerSession(
            config,
            new StateStore(config.stateDir()),
            new FileLockCoordinator(config.lockFile()),
            new LocalFolderScanner(),
            engine,
            new Random()
        );
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    // ========== Lifecycle ==========

    /**
     * Acquire the instance role, load state and start autosave.
     *
     * @param reopenLastFolder whether to open the most recent folder
     * @return the role decision
     * @throws IllegalStateException if already started
     */
    public synchronized LockAcquisition start(boolean reopenLastFolder) {
        if (started) {
            throw new IllegalStateException("Session already started");
        }
        started = true;
        return await(dispatcher.submit(() -> initialize(reopenLastFolder)));
    }

    /**
     * The role decided at start, or null before {@link #start}.
     */
    public LockAcquisition lock() {
        return lock;
    }

    /**
     * Outcome of the save performed by {@link #close()}, or null if not closed yet.
     */
    public SaveOutcome finalSave() {
        return finalSave;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (!started) {
                engine.close();
                lockCoordinator.close();
                return;
            }
        }

        try {
            finalSave = dispatcher.submit(this::shutdown).get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finalSave = SaveOutcome.FAILED;
        } catch (ExecutionException | TimeoutException e) {
            LOG.log(Level.WARNING, "Final save did not complete", e);
            finalSave = SaveOutcome.FAILED;
        } finally {
            dispatcher.close();
            if (autosaver != null) {
                autosaver.close();
            }
            engine.close();
            // Released last: another instance may only become writer after the final save
            lockCoordinator.close();
        }
        LOG.fine("Session closed, final save " + finalSave);
    }

    // ========== Events ==========

    /**
     * Queue an event.
     *
     * @return future completed with the event's result once applied
     * @throws IllegalStateException if the session was not started
     */
    public CompletableFuture<EventResult> post(PlayerEvent event) {
        Objects.requireNonNull(event, "event cannot be null");
        if (!started) {
            throw new IllegalStateException("Session not started");
        }
        return dispatcher.submit(() -> apply(event));
    }

    /**
     * Apply an event and wait for its result.
     *
     * @throws IllegalArgumentException if the event is invalid for the current
     *                                  playlist, e.g. a track position out of range
     */
    public EventResult send(PlayerEvent event) {
        if (dispatcher.isDispatchThread()) {
            return apply(event);
        }
        return await(post(event));
    }

    /**
     * Current view for rendering.
     */
    public SessionSnapshot snapshot() {
        return call(this::buildSnapshot);
    }

    /**
     * Active playlist entries whose name contains {@code query}.
     */
    public List<PlaylistEntry> filter(String query) {
        return call(() -> active != null ? active.filter(query) : List.<PlaylistEntry>of());
    }

    /**
     * Deep copy of the application state.
     */
    public AppState appState() {
        return call(() -> state.copy());
    }

    // ========== Dispatch-thread internals ==========

    private LockAcquisition initialize(boolean reopenLastFolder) {
        lock = lockCoordinator.acquire();
        state = loadState();

        if (lock.isWriter()) {
            store.deleteStaleTempFiles();
        } else {
            notify(SessionNotice.Kind.READ_ONLY, lock.degraded()
                ? "Instance locking is unavailable; changes will not be saved"
                : "Another instance is already running; changes will not be saved");
        }

        autosaver = new Autosaver(store, lock.isWriter(), state.revision(),
            e -> notify(SessionNotice.Kind.SAVE_FAILED, "Could not save state: " + e.getMessage()));

        engine.setVolume(state.volume());
        engine.setEndOfTrackListener(this::onEndOfTrack);
        autosaver.startPeriodic(config.autosaveInterval(), this::onTimerTick);

        if (reopenLastFolder) {
            state.recentFolders().mostRecent().ifPresent(folder -> openFolder(Path.of(folder)));
        }
        LOG.fine("Session started as " + lock.role());
        return lock;
    }

    private AppState loadState() {
        try {
            return store.load();
        } catch (StateLoadException e) {
            LOG.log(Level.WARNING, "State file unusable, starting from defaults", e);
            notify(SessionNotice.Kind.LOAD_FAILED, "Saved state could not be read: " + e.getMessage());
            return new AppState();
        }
    }

    private SaveOutcome shutdown() {
        autosaver.stopPeriodic();
        engine.setEndOfTrackListener(null);
        capturePosition();
        return autosaver.saveNow(state);
    }

    private EventResult apply(PlayerEvent event) {
        if (event instanceof PlayerEvent.OpenFolder e) {
            return openFolder(e.folder());
        }
        if (event instanceof PlayerEvent.SelectTrack e) {
            return selectTrack(e.displayPosition());
        }
        if (event instanceof PlayerEvent.UpdatePosition e) {
            return updatePosition(e.positionMs());
        }
        if (event instanceof PlayerEvent.SetShuffle e) {
            return setShuffle(e.enabled());
        }
        if (event instanceof PlayerEvent.Reshuffle) {
            return reshuffle();
        }
        if (event instanceof PlayerEvent.ToggleLoop) {
            return toggleLoop();
        }
        if (event instanceof PlayerEvent.Next) {
            return step(true);
        }
        if (event instanceof PlayerEvent.EndOfTrack) {
            return endOfTrack();
        }
        if (event instanceof PlayerEvent.Previous) {
            return step(false);
        }
        if (event instanceof PlayerEvent.SetVolume e) {
            return setVolume(e.volume());
        }
        if (event instanceof PlayerEvent.AdjustVolume e) {
            return setVolume(state.volume() + e.delta());
        }
        if (event instanceof PlayerEvent.Zoom e) {
            return zoom(e.change());
        }
        if (event instanceof PlayerEvent.TogglePause) {
            return togglePause();
        }
        if (event instanceof PlayerEvent.SeekRelative e) {
            return seekRelative(e.seconds());
        }
        if (event instanceof PlayerEvent.RestartTrack) {
            return seekTo(0);
        }
        if (event instanceof PlayerEvent.ForgetFolder e) {
            return forgetFolder(e.folder());
        }
        if (event instanceof PlayerEvent.AutosaveTick) {
            boolean captured = capturePosition();
            return new EventResult(captured, null, autosaver.saveIfDirty(state));
        }
        throw new IllegalArgumentException("Unhandled event: " + event);
    }

    private EventResult openFolder(Path folder) {
        String key = AppState.folderKey(folder);
        PlaylistState playlistState = state.openFolder(key);
        ReshufflePolicy policy = config.reshufflePolicy();

        try {
            List<Path> tracks = scanner.scan(Path.of(key));
            active = Playlist.open(key, tracks, playlistState, random, policy);
        } catch (FolderNotFoundException e) {
            LOG.warning(e.getMessage());
            active = Playlist.unavailable(key, playlistState, random, policy);
            notify(SessionNotice.Kind.FOLDER_NOT_FOUND, e.getMessage());
        }

        engine.stop();
        active.currentTrack().ifPresent(track -> engine.load(track, playlistState.playbackPositionMs()));
        return EventResult.changed(autosaver.requestSave(state));
    }

    private EventResult selectTrack(int displayPosition) {
        if (active == null) {
            return EventResult.unchanged();
        }
        boolean changed = active.select(displayPosition);
        active.currentTrack().ifPresent(track -> engine.play(track, active.state().playbackPositionMs()));
        if (!changed) {
            return EventResult.unchanged();
        }
        state.markModified();
        return EventResult.changed(autosaver.requestSave(state));
    }

    private EventResult updatePosition(long positionMs) {
        if (active == null || !active.updatePosition(positionMs)) {
            return EventResult.unchanged();
        }
        state.markModified();
        return EventResult.changed(null);
    }

    private EventResult setShuffle(boolean enabled) {
        if (active == null || !active.setShuffle(enabled)) {
            return EventResult.unchanged();
        }
        state.markModified();
        return EventResult.changed(autosaver.requestSave(state));
    }

    private EventResult reshuffle() {
        if (active == null || !active.reshuffle()) {
            return EventResult.unchanged();
        }
        state.markModified();
        if (active.reshufflePolicy() == ReshufflePolicy.RESET_TO_START) {
            active.currentTrack().ifPresent(track -> engine.play(track, 0));
        }
        return EventResult.changed(autosaver.requestSave(state));
    }

    private EventResult toggleLoop() {
        if (active == null || !active.isAvailable()) {
            return EventResult.unchanged();
        }
        active.toggleLoop();
        state.markModified();
        return EventResult.changed(autosaver.requestSave(state));
    }

    private EventResult step(boolean forward) {
        if (active == null) {
            return EventResult.stepped(StepResult.EMPTY, null);
        }
        StepResult step = forward ? active.next() : active.previous();
        if (step.moved()) {
            state.markModified();
            active.currentTrack().ifPresent(track -> engine.play(track, 0));
            return EventResult.stepped(step, autosaver.requestSave(state));
        }
        if (step == StepResult.END_OF_PLAYLIST) {
            notify(SessionNotice.Kind.END_OF_PLAYLIST, forward
                ? "Reached the end of the playlist"
                : "Already at the start of the playlist");
        }
        return EventResult.stepped(step, null);
    }

    /**
     * Advance after the engine finished a track. At the end of a non-looping
     * playlist the engine is stopped and the last track is stored at position 0,
     * so a later session does not resume at its very end.
     */
    private EventResult endOfTrack() {
        EventResult result = step(true);
        if (result.step() != StepResult.END_OF_PLAYLIST) {
            return result;
        }
        engine.stop();
        if (!active.updatePosition(0)) {
            return result;
        }
        state.markModified();
        return new EventResult(true, StepResult.END_OF_PLAYLIST, autosaver.requestSave(state));
    }

    private EventResult setVolume(int volume) {
        int before = state.volume();
        int after = state.setVolume(volume);
        engine.setVolume(after);
        return before != after ? EventResult.changed(null) : EventResult.unchanged();
    }

    private EventResult zoom(PlayerEvent.ZoomChange change) {
        double before = state.zoomLevel();
        double after = switch (change) {
            case IN -> state.zoomIn();
            case OUT -> state.zoomOut();
            case RESET -> state.resetZoom();
        };
        return before != after ? EventResult.changed(null) : EventResult.unchanged();
    }

    private EventResult togglePause() {
        if (engine.currentTrack() == null) {
            return EventResult.unchanged();
        }
        if (engine.isPlaying()) {
            engine.pause();
        } else {
            engine.resume();
        }
        return EventResult.unchanged();
    }

    private EventResult seekRelative(int seconds) {
        long position = engine.positionMs();
        if (engine.currentTrack() == null || position < 0) {
            return EventResult.unchanged();
        }
        long target = Math.max(0, position + seconds * 1000L);
        long length = engine.lengthMs();
        if (length >= 0) {
            target = Math.min(target, length);
        }
        return seekTo(target);
    }

    private EventResult seekTo(long positionMs) {
        if (engine.currentTrack() == null) {
            return EventResult.unchanged();
        }
        engine.seek(positionMs);
        return capturePosition() ? EventResult.changed(null) : EventResult.unchanged();
    }

    private EventResult forgetFolder(Path folder) {
        if (!state.forgetFolder(AppState.folderKey(folder))) {
            return EventResult.unchanged();
        }
        return EventResult.changed(autosaver.requestSave(state));
    }

    /**
     * Copy the engine's position into the active playlist if the engine is on the
     * playlist's current track.
     *
     * @return true if the stored position changed
     */
    private boolean capturePosition() {
        if (active == null || !active.isAvailable()) {
            return false;
        }
        Path loaded = engine.currentTrack();
        Optional<Path> current = active.currentTrack();
        long position = engine.positionMs();
        if (loaded == null || position < 0 || current.isEmpty() || !current.get().equals(loaded)) {
            return false;
        }
        if (active.updatePosition(position)) {
            state.markModified();
            return true;
        }
        return false;
    }

    private SessionSnapshot buildSnapshot() {
        LockAcquisition role = lock;
        if (active == null) {
            return new SessionSnapshot(role.role(), role.degraded(), null, false, PlaybackMode.STRAIGHT,
                false, 0, 0, List.of(), state.volume(), state.zoomLevel(),
                state.recentFolders().asList(), engine.isPlaying());
        }
        PlaylistState ps = active.state();
        return new SessionSnapshot(role.role(), role.degraded(), active.folderKey(), active.isAvailable(),
            ps.mode(), ps.loopEnabled(), ps.currentIndex(), ps.playbackPositionMs(), active.entries(),
            state.volume(), state.zoomLevel(), state.recentFolders().asList(), engine.isPlaying());
    }

    private void onEndOfTrack() {
        submitQuietly(new PlayerEvent.EndOfTrack());
    }

    private void onTimerTick() {
        submitQuietly(new PlayerEvent.AutosaveTick());
    }

    private void submitQuietly(PlayerEvent event) {
        post(event).whenComplete((result, error) -> {
            if (error != null) {
                LOG.log(Level.FINE, "Background event " + event + " not applied", error);
            }
        });
    }

    private void notify(SessionNotice.Kind kind, String message) {
        SessionNotice notice = new SessionNotice(kind, message);
        for (SessionListener listener : listeners) {
            try {
                listener.onNotice(notice);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Session listener failed", e);
            }
        }
    }

    private <T> T call(Callable<T> task) {
        if (!started) {
            throw new IllegalStateException("Session not started");
        }
        if (dispatcher.isDispatchThread()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        return await(dispatcher.submit(task));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
