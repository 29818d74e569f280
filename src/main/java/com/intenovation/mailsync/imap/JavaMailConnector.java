package com.intenovation.mailsync.imap;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncException;
import com.sun.mail.imap.IMAPStore;

import javax.mail.MessagingException;
import javax.mail.Session;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Opens {@link JavaMailImapMailbox} connections from account settings.
 */
public class JavaMailConnector implements ImapMailboxFactory {
    private static final Logger LOGGER = Logger.getLogger(JavaMailConnector.class.getName());

    private final MailSyncConfiguration configuration;

    public JavaMailConnector(MailSyncConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public ImapMailbox open(AccountSettings settings) throws MessagingException {
        if (settings.getHost() == null || settings.getHost().isEmpty()
                || settings.getUsername() == null || settings.getUsername().isEmpty()) {
            throw new MailSyncException("Missing required IMAP connection parameters for account "
                    + settings.getAccountId());
        }
        Session session = createSession(settings);
        String protocol = settings.isUseSSL() ? "imaps" : "imap";
        IMAPStore store = (IMAPStore) session.getStore(protocol);
        store.connect(settings.getHost(), settings.getPort(), settings.getUsername(), settings.getPassword());
        LOGGER.info("Connected to " + settings.getHost() + " for account " + settings.getAccountId());
        return new JavaMailImapMailbox(store);
    }

    /**
     * Create a JavaMail session for an account
     *
     * @param settings The account settings
     * @return A new session with host, port, SSL and timeouts set
     */
    Session createSession(AccountSettings settings) {
        String protocol = settings.isUseSSL() ? "imaps" : "imap";
        String prefix = "mail." + protocol + ".";
        String timeout = String.valueOf(configuration.getOperationTimeoutMs());

        Properties props = new Properties();
        props.setProperty("mail.store.protocol", protocol);
        props.setProperty(prefix + "host", settings.getHost());
        props.setProperty(prefix + "port", String.valueOf(settings.getPort()));
        props.setProperty(prefix + "user", settings.getUsername());
        props.setProperty(prefix + "ssl.enable", String.valueOf(settings.isUseSSL()));
        props.setProperty(prefix + "connectiontimeout", timeout);
        props.setProperty(prefix + "timeout", timeout);
        props.setProperty(prefix + "writetimeout", timeout);
        return Session.getInstance(props);
    }
}
