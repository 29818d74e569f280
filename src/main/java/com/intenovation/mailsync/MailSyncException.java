package com.intenovation.mailsync;

import javax.mail.MessagingException;

/**
 * Base class for all exceptions raised by the synchronization engine.
 */
public class MailSyncException extends MessagingException {

    public MailSyncException(String message) {
        super(message);
    }

    public MailSyncException(String message, Exception cause) {
        super(message, cause);
    }

    /**
     * The kind of failure this exception represents
     *
     * @return The error kind used when the exception is recorded in a stats error list
     */
    public SyncErrorKind getKind() {
        return SyncErrorKind.FAILURE;
    }
}
