package com.intenovation.mailsync;

import java.util.Objects;

/**
 * One entry in the error list returned by a synchronization operation.
 * Errors are scoped to a folder, to a single message, or to the whole account.
 */
public final class SyncError {
    private final SyncErrorKind kind;
    private final String folder;
    private final Long uid;
    private final String message;

    public SyncError(SyncErrorKind kind, String folder, Long uid, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.folder = folder;
        this.uid = uid;
        this.message = message;
    }

    /**
     * Create an error scoped to a folder
     */
    public static SyncError forFolder(SyncErrorKind kind, String folder, String message) {
        return new SyncError(kind, folder, null, message);
    }

    /**
     * Create an error scoped to a single message
     */
    public static SyncError forMessage(SyncErrorKind kind, String folder, long uid, String message) {
        return new SyncError(kind, folder, uid, message);
    }

    /**
     * Create an error scoped to the whole account
     */
    public static SyncError forAccount(SyncErrorKind kind, String message) {
        return new SyncError(kind, null, null, message);
    }

    public SyncErrorKind getKind() {
        return kind;
    }

    public String getFolder() {
        return folder;
    }

    public Long getUid() {
        return uid;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind);
        if (folder != null) {
            sb.append(' ').append(folder);
            if (uid != null) {
                sb.append('/').append(uid);
            }
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
