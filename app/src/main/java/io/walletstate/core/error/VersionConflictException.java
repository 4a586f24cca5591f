package io.walletstate.core.error;

/**
 * Optimistic write lost a race: the stored version differs from the one the caller read.
 * Re-read and retry.
 */
public class VersionConflictException extends StateException {
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String key, long expectedVersion, long actualVersion) {
        super("Version conflict on " + key + ": expected " + expectedVersion + ", stored " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long expectedVersion() { return expectedVersion; }

    /** Stored version at the time of the check, -1 if the key was absent. */
    public long actualVersion() { return actualVersion; }
}
