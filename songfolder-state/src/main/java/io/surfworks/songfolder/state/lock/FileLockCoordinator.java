package io.surfworks.songfolder.state.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lock coordinator backed by an OS-level exclusive file lock.
 *
 * <p>The lock is taken on {@code state.lock} next to the state file with
 * {@link FileChannel#tryLock()}, which never waits. The operating system drops the
 * lock when the owning process dies, so a crashed writer leaves nothing to clean up.
 * The file's content is never read or written.
 *
 * <p>Within one JVM a second coordinator on the same file resolves to reader, the
 * same as a second process would. It does so without opening the file: on POSIX
 * systems closing any descriptor of a locked file drops the process's lock.
 */
public final class FileLockCoordinator implements LockCoordinator {

    private static final Logger LOG = Logger.getLogger(FileLockCoordinator.class.getName());

    public static final String LOCK_FILE = "state.lock";

    private static final Set<Path> HELD_IN_PROCESS = ConcurrentHashMap.newKeySet();

    private final Path lockFile;
    private final Path lockKey;

    private LockAcquisition acquisition;
    private FileChannel channel;
    private FileLock lock;

    /**
     * @param lockFile the lock resource; its parent directory is created if needed
     */
    public FileLockCoordinator(Path lockFile) {
        this.lockFile = lockFile;
        this.lockKey = lockFile.toAbsolutePath().normalize();
    }

    /**
     * Coordinator for the lock file inside a state directory.
     */
    public static FileLockCoordinator inDirectory(Path stateDir) {
        return new FileLockCoordinator(stateDir.resolve(LOCK_FILE));
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public synchronized LockAcquisition acquire() {
        if (acquisition != null) {
            return acquisition;
        }
        acquisition = tryAcquire();
        LOG.fine("Instance role " + acquisition.role() + ": " + acquisition.detail());
        return acquisition;
    }

    private LockAcquisition tryAcquire() {
        if (!HELD_IN_PROCESS.add(lockKey)) {
            return LockAcquisition.reader("This process already holds " + lockFile);
        }
        LockAcquisition result = tryOsLock();
        if (!result.isWriter()) {
            HELD_IN_PROCESS.remove(lockKey);
        }
        return result;
    }

    private LockAcquisition tryOsLock() {
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            lock = channel.tryLock();
            if (lock == null) {
                closeChannel();
                return LockAcquisition.reader("Another instance holds " + lockFile);
            }
            return LockAcquisition.writer("Holding " + lockFile);
        } catch (OverlappingFileLockException e) {
            closeChannel();
            return LockAcquisition.reader("This process already holds " + lockFile);
        } catch (IOException | UnsupportedOperationException e) {
            LOG.log(Level.WARNING, "Instance locking unavailable for " + lockFile + "; running read-only", e);
            closeChannel();
            return LockAcquisition.degraded("Locking unavailable: " + e.getMessage());
        }
    }

    /**
     * Returns true while the lock is held by this coordinator.
     */
    public synchronized boolean isHeld() {
        return lock != null && lock.isValid();
    }

    @Override
    public synchronized void close() {
        if (lock != null) {
            try {
                lock.release();
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to release " + lockFile, e);
            }
            lock = null;
            closeChannel();
            HELD_IN_PROCESS.remove(lockKey);
        }
    }

    private void closeChannel() {
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.log(Level.FINE, "Error closing lock channel", e);
            }
            channel = null;
        }
    }
}
