package com.intenovation.mailsync;

/**
 * Classification of errors recorded during a synchronization run.
 */
public enum SyncErrorKind {
    /**
     * Timeouts, refused connections, dropped sockets - retried by the next cycle
     */
    TRANSIENT_NETWORK,

    /**
     * Two workers wrote the same folder or record - the item is skipped this cycle
     */
    CONCURRENCY_CONFLICT,

    /**
     * Duplicate identity without a resolvable survivor - all candidates were soft-deleted
     */
    DATA_INTEGRITY_ANOMALY,

    /**
     * The server lacks an optional extension - a fallback was used
     */
    PROTOCOL_CAPABILITY_MISSING,

    /**
     * A single network operation exceeded its time budget
     */
    TIMEOUT,

    /**
     * Anything else
     */
    FAILURE
}
