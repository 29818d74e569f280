package com.intenovation.mailsync;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Listener registry of one session. Listener failures are logged, never propagated.
 */
public class MailSyncEvents {
    private static final Logger LOGGER = Logger.getLogger(MailSyncEvents.class.getName());

    private final Object source;
    private final List<MailSyncChangeListener> listeners = new CopyOnWriteArrayList<>();

    public MailSyncEvents(Object source) {
        this.source = source;
    }

    /**
     * Add a listener to be notified of changes
     *
     * @param listener The listener to add
     */
    public void addChangeListener(MailSyncChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Remove a change listener
     *
     * @param listener The listener to remove
     */
    public void removeChangeListener(MailSyncChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Notify all listeners of a change
     */
    public void fire(MailSyncChangeEvent.ChangeType type, String accountId, Object changedItem) {
        if (listeners.isEmpty()) {
            return;
        }
        MailSyncChangeEvent event = new MailSyncChangeEvent(source, type, accountId, changedItem);
        for (MailSyncChangeListener listener : listeners) {
            try {
                listener.mailSyncChanged(event);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Error notifying listener", e);
            }
        }
    }
}
