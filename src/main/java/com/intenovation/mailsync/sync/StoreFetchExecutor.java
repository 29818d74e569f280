package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailEnvelope;
import com.intenovation.mailsync.model.MailFlags;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import com.intenovation.mailsync.store.StoreException;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link FetchExecutor} writing straight into a {@link MailStateStore}.
 * Storing the same message at the same key twice returns the existing record.
 */
public class StoreFetchExecutor implements FetchExecutor {
    private static final Logger LOGGER = Logger.getLogger(StoreFetchExecutor.class.getName());

    private final MailStateStore store;

    public StoreFetchExecutor(MailStateStore store) {
        this.store = store;
    }

    @Override
    public long insertFetched(FetchedMessage message) throws StoreException {
        MailKey key = message.getKey();
        MailEnvelope envelope = message.getEnvelope();
        try (MailStateTransaction tx = store.begin(key.getAccountId())) {
            Optional<LocalMailRecord> existing = tx.findLocal(key);
            if (existing.isPresent() && existing.get().getStableIdentity().equals(envelope.getStableIdentity())) {
                LOGGER.fine("Message at " + key + " is already stored as " + existing.get().getId());
                return existing.get().getId();
            }

            LocalMailRecord record = new LocalMailRecord(key.getAccountId(), key.getFolder(),
                    key.getUidValidity(), key.getUid(), envelope.getMessageId(), envelope.getInReplyTo(),
                    envelope.getContentHash(), message.getPayload(), message.getReceivedAt());
            record.setFlags(MailFlags.parse(message.getFlags()));
            long id = tx.insertLocal(record);
            tx.commit();
            LOGGER.fine("Stored " + key + " as local record " + id);
            return id;
        }
    }
}
