package com.intenovation.mailsync;

import javax.mail.FolderClosedException;
import javax.mail.StoreClosedException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions onto {@link SyncErrorKind} values.
 */
public final class SyncErrors {

    private static final String[] TRANSIENT_KEYWORDS = {
            "timeout", "timed out", "connection", "network",
            "temporary", "unavailable", "try again",
            "rate limit", "too many requests", "socket",
            "ssl", "refused"
    };

    private static final String[] PERMANENT_KEYWORDS = {
            "authentication", "credentials", "password",
            "permission denied", "unauthorized", "forbidden",
            "access denied"
    };

    private SyncErrors() {
    }

    /**
     * Classify an exception
     *
     * @param e The exception
     * @return The error kind
     */
    public static SyncErrorKind classify(Throwable e) {
        if (e instanceof MailSyncException) {
            return ((MailSyncException) e).getKind();
        }
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TimeoutException || t instanceof SocketTimeoutException) {
                return SyncErrorKind.TIMEOUT;
            }
        }
        if (isTransient(e)) {
            return SyncErrorKind.TRANSIENT_NETWORK;
        }
        return SyncErrorKind.FAILURE;
    }

    /**
     * Whether an exception is worth retrying in a later cycle
     *
     * @param e The exception
     * @return true for network-level problems
     */
    public static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TransientNetworkException
                    || t instanceof FolderClosedException
                    || t instanceof StoreClosedException
                    || t instanceof ConnectException
                    || t instanceof SocketException
                    || t instanceof SocketTimeoutException
                    || t instanceof UnknownHostException) {
                return true;
            }
        }

        String text = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        for (String keyword : PERMANENT_KEYWORDS) {
            if (text.contains(keyword)) {
                return false;
            }
        }
        for (String keyword : TRANSIENT_KEYWORDS) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return e instanceof IOException;
    }

    /**
     * Build a folder-scoped error entry for an exception
     */
    public static SyncError folderError(String folder, Throwable e) {
        return SyncError.forFolder(classify(e), folder, describe(e));
    }

    /**
     * Build a message-scoped error entry for an exception
     */
    public static SyncError messageError(String folder, long uid, Throwable e) {
        return SyncError.forMessage(classify(e), folder, uid, describe(e));
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
