package com.intenovation.mailsync;

/**
 * A network problem that is expected to go away by itself.
 * The affected folder or message is left for the next scheduled cycle.
 */
public class TransientNetworkException extends MailSyncException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Exception cause) {
        super(message, cause);
    }

    @Override
    public SyncErrorKind getKind() {
        return SyncErrorKind.TRANSIENT_NETWORK;
    }
}
