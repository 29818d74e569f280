package com.intenovation.mailsync.store;

import java.util.concurrent.TimeUnit;

/**
 * Persistence for the server mirror, the local records and folder scan state.
 * <p>
 * All access goes through a {@link MailStateTransaction} scoped to one account.
 * Changes become visible to other transactions only on commit; a commit that
 * collides with a concurrent writer fails with a {@link ConcurrencyConflictException}.
 */
public interface MailStateStore {

    /**
     * Begin a transaction for an account
     *
     * @param accountId The account
     * @return A new transaction, to be committed or rolled back
     * @throws StoreException If the store is not usable
     */
    MailStateTransaction begin(String accountId) throws StoreException;

    /**
     * Acquire the single-writer lock for an account
     *
     * @param accountId The account
     * @param timeout How long to wait
     * @param unit The unit of the timeout
     * @return The held lock
     * @throws ConcurrencyConflictException If the lock is not available in time
     * @throws StoreException If the lock cannot be created
     * @throws InterruptedException If the thread is interrupted while waiting
     */
    AccountLock lockAccount(String accountId, long timeout, TimeUnit unit)
            throws StoreException, InterruptedException;
}
