package com.intenovation.mailsync;

/**
 * Interface for listeners that want to be notified of changes made by a synchronization session.
 */
public interface MailSyncChangeListener {
    /**
     * Called when a change occurs.
     * @param event The change event containing details of the change
     */
    void mailSyncChanged(MailSyncChangeEvent event);
}
