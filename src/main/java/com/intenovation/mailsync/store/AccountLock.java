package com.intenovation.mailsync.store;

/**
 * An acquired per-account writer lock. Closing it releases the lock.
 */
public interface AccountLock extends AutoCloseable {

    @Override
    void close();
}
