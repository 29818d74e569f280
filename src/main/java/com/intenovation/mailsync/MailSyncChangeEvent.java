package com.intenovation.mailsync;

import java.util.EventObject;

/**
 * Event class for changes made by a synchronization session.
 */
public class MailSyncChangeEvent extends EventObject {
    public enum ChangeType {
        FOLDER_SCANNED,
        FOLDER_SKIPPED,
        MESSAGE_FETCHED,
        MESSAGE_MOVED,
        MESSAGE_DELETED,
        MUTATION_CONFIRMED,
        MUTATION_FAILED,
        THREADS_RESOLVED
    }

    private final ChangeType changeType;
    private final String accountId;
    private final Object changedItem;

    /**
     * Create a new change event.
     * @param source The session that made the change
     * @param changeType The type of change that occurred
     * @param accountId The account the change belongs to
     * @param changedItem The item that changed (folder name, local record, mutation result, etc.)
     */
    public MailSyncChangeEvent(Object source, ChangeType changeType, String accountId, Object changedItem) {
        super(source);
        this.changeType = changeType;
        this.accountId = accountId;
        this.changedItem = changedItem;
    }

    /**
     * Get the type of change that occurred.
     * @return The change type
     */
    public ChangeType getChangeType() {
        return changeType;
    }

    public String getAccountId() {
        return accountId;
    }

    /**
     * Get the item that changed.
     * @return The changed item
     */
    public Object getChangedItem() {
        return changedItem;
    }

    @Override
    public String toString() {
        return changeType + " " + accountId + ": " + changedItem;
    }
}
