package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.model.ServerMailRecord;

import javax.mail.MessagingException;

/**
 * Downloads a message and turns it into a {@link FetchedMessage}.
 */
public interface MessageMaterializer {

    /**
     * Materialize one message
     *
     * @param mailbox A connection with the row's folder selected
     * @param row The mirror row to fetch
     * @return The fetched message with encrypted payload
     * @throws MessagingException If the message cannot be fetched
     */
    FetchedMessage materialize(ImapMailbox mailbox, ServerMailRecord row) throws MessagingException;
}
