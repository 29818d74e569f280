package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.MailSyncException;

/**
 * Stores fetched messages as local records. Each call is its own transaction and
 * never touches the link field of the server mirror; linking is left to the reconciler.
 */
public interface FetchExecutor {

    /**
     * Store a fetched message
     *
     * @param message The message
     * @return The id of the local record
     * @throws MailSyncException If the record cannot be stored
     */
    long insertFetched(FetchedMessage message) throws MailSyncException;
}
