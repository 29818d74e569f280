package com.intenovation.mailsync.store;

import com.intenovation.mailsync.MailSyncException;

/**
 * Thrown when the state store cannot read or write its data.
 */
public class StoreException extends MailSyncException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Exception cause) {
        super(message, cause);
    }
}
