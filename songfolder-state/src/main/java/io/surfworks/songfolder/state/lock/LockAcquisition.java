package io.surfworks.songfolder.state.lock;

import java.util.Objects;

/**
 * Outcome of the one-time lock attempt.
 *
 * @param role     the role assigned to this process
 * @param degraded true if the locking primitive itself failed and the role was
 *                 assigned without knowing whether another instance runs
 * @param detail   human-readable explanation
 */
public record LockAcquisition(InstanceRole role, boolean degraded, String detail) {

    public LockAcquisition {
        Objects.requireNonNull(role, "role cannot be null");
        Objects.requireNonNull(detail, "detail cannot be null");
        if (degraded && role == InstanceRole.WRITER) {
            throw new IllegalArgumentException("a degraded acquisition cannot grant the writer role");
        }
    }

    /**
     * Lock acquired.
     */
    public static LockAcquisition writer(String detail) {
        return new LockAcquisition(InstanceRole.WRITER, false, detail);
    }

    /**
     * Lock held elsewhere.
     */
    public static LockAcquisition reader(String detail) {
        return new LockAcquisition(InstanceRole.READER, false, detail);
    }

    /**
     * Locking unavailable; fall back to read-only.
     */
    public static LockAcquisition degraded(String detail) {
        return new LockAcquisition(InstanceRole.READER, true, detail);
    }

    public boolean isWriter() {
        return role == InstanceRole.WRITER;
    }
}
