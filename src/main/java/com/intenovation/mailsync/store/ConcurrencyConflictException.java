package com.intenovation.mailsync.store;

import com.intenovation.mailsync.SyncErrorKind;

/**
 * Thrown when a transaction collides with a concurrent writer: a duplicate
 * mirror key, a folder rewritten since the transaction began, or an account
 * lock that could not be acquired in time.
 */
public class ConcurrencyConflictException extends StoreException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    @Override
    public SyncErrorKind getKind() {
        return SyncErrorKind.CONCURRENCY_CONFLICT;
    }
}
