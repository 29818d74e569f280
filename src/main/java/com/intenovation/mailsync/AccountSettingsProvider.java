package com.intenovation.mailsync;

import javax.mail.MessagingException;

/**
 * Looks up the settings of an account, typically from the application's account registry.
 */
public interface AccountSettingsProvider {

    /**
     * Load the settings of an account
     *
     * @param accountId The account
     * @return The settings
     * @throws MessagingException If the account is unknown or cannot be loaded
     */
    AccountSettings load(String accountId) throws MessagingException;
}
