package io.surfworks.songfolder.state.session;

import io.surfworks.songfolder.state.AppState;
import io.surfworks.songfolder.state.StateSaveException;
import io.surfworks.songfolder.state.StateStore;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists {@link AppState} for a writer instance: on request, on a fixed timer, and
 * once more at shutdown.
 *
 * <p>Saves are single-flight. Requests hand a deep copy of the state to one save
 * thread; a request that arrives while a save is running replaces whatever copy is
 * still waiting, so at most one save runs and at most one is pending. Every write,
 * background or synchronous, holds the same lock, and a copy older than the last
 * one written is dropped, so a late background save can never overwrite newer state.
 *
 * <p>A reader instance gets an Autosaver that never writes.
 */
public final class Autosaver implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(Autosaver.class.getName());

    private final StateStore store;
    private final boolean writer;
    private final Consumer<StateSaveException> failureHandler;

    private final ExecutorService saveExecutor;
    private final ScheduledExecutorService timer;
    private final AtomicReference<Snapshot> pending = new AtomicReference<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile long lastSavedRevision;
    private ScheduledFuture<?> periodicTask;

    /**
     * @param store           where to write
     * @param writer          whether this instance holds the writer role
     * @param initialRevision revision of the state as loaded, considered clean
     * @param failureHandler  told about every failed save
     */
    public Autosaver(StateStore store, boolean writer, long initialRevision,
                     Consumer<StateSaveException> failureHandler) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.writer = writer;
        this.lastSavedRevision = initialRevision;
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler cannot be null");
        this.saveExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "songfolder-save");
            t.setDaemon(true);
            return t;
        });
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "songfolder-autosave");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isWriter() {
        return writer;
    }

    /**
     * Returns true if the state changed since it was last written.
     */
    public boolean isDirty(AppState state) {
        return state.revision() != lastSavedRevision;
    }

    public long lastSavedRevision() {
        return lastSavedRevision;
    }

    /**
     * Save in the background regardless of dirtiness. Call on the thread that owns
     * {@code state}.
     */
    public SaveOutcome requestSave(AppState state) {
        if (!writer) {
            return SaveOutcome.SKIPPED_READ_ONLY;
        }
        Snapshot previous = pending.getAndSet(new Snapshot(state.copy(), state.revision()));
        if (draining.compareAndSet(false, true)) {
            saveExecutor.execute(this::drain);
            return SaveOutcome.SCHEDULED;
        }
        LOG.finer(previous != null ? "Replaced pending save" : "Save queued behind running save");
        return SaveOutcome.COALESCED;
    }

    /**
     * Save in the background if the state changed since the last write.
     */
    public SaveOutcome saveIfDirty(AppState state) {
        if (!writer) {
            return SaveOutcome.SKIPPED_READ_ONLY;
        }
        if (!isDirty(state)) {
            return SaveOutcome.SKIPPED_CLEAN;
        }
        return requestSave(state);
    }

    /**
     * Save on the calling thread, after any running background save finishes. Any
     * pending background copy is superseded.
     */
    public SaveOutcome saveNow(AppState state) {
        if (!writer) {
            return SaveOutcome.SKIPPED_READ_ONLY;
        }
        pending.set(null);
        return write(new Snapshot(state.copy(), state.revision())) ? SaveOutcome.SAVED : SaveOutcome.FAILED;
    }

    /**
     * Start running {@code tick} at a fixed rate. The tick should post to the
     * dispatcher rather than touch state itself.
     */
    public synchronized void startPeriodic(Duration interval, Runnable tick) {
        stopPeriodic();
        long millis = interval.toMillis();
        periodicTask = timer.scheduleAtFixedRate(() -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Autosave tick failed", e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        LOG.fine("Autosave every " + interval);
    }

    public synchronized void stopPeriodic() {
        if (periodicTask != null) {
            periodicTask.cancel(false);
            periodicTask = null;
        }
    }

    /**
     * Stop the timer and wait for a running background save to complete.
     */
    @Override
    public void close() {
        stopPeriodic();
        timer.shutdownNow();
        saveExecutor.shutdown();
        try {
            if (!saveExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warning("Save thread did not terminate gracefully");
                saveExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            saveExecutor.shutdownNow();
        }
    }

    private void drain() {
        while (true) {
            Snapshot next = pending.getAndSet(null);
            if (next == null) {
                draining.set(false);
                // A request may have slipped in after the getAndSet but before the flag cleared
                if (pending.get() != null && draining.compareAndSet(false, true)) {
                    continue;
                }
                return;
            }
            write(next);
        }
    }

    private boolean write(Snapshot snapshot) {
        writeLock.lock();
        try {
            if (snapshot.revision < lastSavedRevision) {
                LOG.finer("Dropping stale save of revision " + snapshot.revision);
                return true;
            }
            store.save(snapshot.state);
            lastSavedRevision = snapshot.revision;
            LOG.fine("Saved state revision " + snapshot.revision);
            return true;
        } catch (StateSaveException e) {
            LOG.log(Level.WARNING, "Could not save state; will retry on next trigger", e);
            failureHandler.accept(e);
            return false;
        } catch (RuntimeException e) {
            // Keep the save thread alive; the next trigger retries
            LOG.log(Level.SEVERE, "Unexpected error saving state", e);
            failureHandler.accept(new StateSaveException("Unexpected error saving state", e));
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    private record Snapshot(AppState state, long revision) {
    }
}
