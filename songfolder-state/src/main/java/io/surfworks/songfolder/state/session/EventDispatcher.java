package io.surfworks.songfolder.state.session;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single ordered queue on which all application-state mutations run.
 *
 * <p>Tasks execute one at a time on one thread, in submission order, so state they
 * touch needs no locking.
 */
public final class EventDispatcher implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(EventDispatcher.class.getName());

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ExecutorService executor;
    private volatile Thread dispatchThread;

    public EventDispatcher() {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "songfolder-dispatch");
            t.setDaemon(true);
            dispatchThread = t;
            return t;
        });
    }

    /**
     * Queue a task.
     *
     * @return a future completed with the task's result, or exceptionally with
     *         whatever it threw, or with {@link RejectedExecutionException} once
     *         the dispatcher is closed
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(task.call());
                } catch (Exception e) {
                    LOG.log(Level.FINE, "Dispatched task failed", e);
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Returns true if the caller is running on the dispatch thread.
     */
    public boolean isDispatchThread() {
        return Thread.currentThread() == dispatchThread;
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /**
     * Stop accepting tasks and wait for queued ones to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warning("Dispatch thread did not terminate gracefully");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
