package com.intenovation.mailsync;

import javax.mail.MessagingException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Caches account settings for the lifetime of one {@link MailSyncSession}.
 * Nothing is shared between sessions; entries are dropped explicitly with
 * {@link #invalidate(String)} when an account changes.
 */
public class AccountSettingsCache {
    private static final Logger LOGGER = Logger.getLogger(AccountSettingsCache.class.getName());

    private final AccountSettingsProvider provider;
    private final Map<String, AccountSettings> settings = new ConcurrentHashMap<>();

    public AccountSettingsCache(AccountSettingsProvider provider) {
        this.provider = provider;
    }

    /**
     * Get the settings of an account, loading them on first use
     *
     * @param accountId The account
     * @return The settings
     * @throws MessagingException If the provider cannot load them
     */
    public AccountSettings get(String accountId) throws MessagingException {
        AccountSettings cached = settings.get(accountId);
        if (cached != null) {
            return cached;
        }
        AccountSettings loaded = provider.load(accountId);
        if (loaded == null) {
            throw new MailSyncException("Unknown account: " + accountId);
        }
        AccountSettings previous = settings.putIfAbsent(accountId, loaded);
        LOGGER.fine("Loaded settings for account " + accountId);
        return previous != null ? previous : loaded;
    }

    public void invalidate(String accountId) {
        settings.remove(accountId);
    }

    public void invalidateAll() {
        settings.clear();
    }

    /**
     * Number of cached accounts
     */
    public int size() {
        return settings.size();
    }
}
