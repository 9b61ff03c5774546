package io.surfworks.songfolder.state.lock;

/**
 * Decides once per process whether this instance is the single writer of the
 * shared state.
 *
 * <p>Implementations must tie the writer role to the process lifetime: if the
 * process exits, cleanly or not, another process can become writer without any
 * cleanup. The decision is never revised; there is no promotion from reader to
 * writer.
 */
public interface LockCoordinator extends AutoCloseable {

    /**
     * Attempt the lock without blocking.
     *
     * <p>The first call decides the role; later calls return the same result.
     *
     * @return the acquisition outcome, never null
     */
    LockAcquisition acquire();

    /**
     * Release the lock if held. The role reported by {@link #acquire()} does not
     * change. Does not throw.
     */
    @Override
    void close();
}
