package com.intenovation.mailsync.imap;

import com.intenovation.mailsync.AccountSettings;

import javax.mail.MessagingException;

/**
 * Opens mailbox connections. Each folder worker gets its own connection.
 */
public interface ImapMailboxFactory {

    /**
     * Open a new connection for an account
     *
     * @param settings The connection settings of the account
     * @return A connected mailbox, to be closed by the caller
     * @throws MessagingException If the connection fails
     */
    ImapMailbox open(AccountSettings settings) throws MessagingException;
}
