package com.intenovation.mailsync;

import java.util.Objects;

/**
 * Connection settings of one mail account.
 */
public final class AccountSettings {
    private final String accountId;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final boolean useSSL;

    /**
     * @param accountId The id the engine keys all state by
     * @param host The IMAP server hostname
     * @param port The IMAP server port, or 0 for the protocol default
     * @param username The username for authentication
     * @param password The password for authentication
     * @param useSSL Whether to use IMAPS
     */
    public AccountSettings(String accountId, String host, int port, String username, String password,
                           boolean useSSL) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.useSSL = useSSL;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getHost() {
        return host;
    }

    /**
     * The configured port, falling back to 993 for IMAPS and 143 for IMAP
     */
    public int getPort() {
        if (port > 0) {
            return port;
        }
        return useSSL ? 993 : 143;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean isUseSSL() {
        return useSSL;
    }

    @Override
    public String toString() {
        // no password
        return "AccountSettings[" + accountId + ", " + username + "@" + host + ":" + getPort()
                + (useSSL ? ", SSL" : "") + "]";
    }
}
