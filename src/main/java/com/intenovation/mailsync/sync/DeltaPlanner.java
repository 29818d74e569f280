package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailFlags;
import com.intenovation.mailsync.model.ServerMailRecord;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import com.intenovation.mailsync.store.StoreException;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Works out which mirror rows still need to be materialized locally.
 * <p>
 * A row is a candidate when no local record is linked to it, it passes the
 * {@link FetchFilter}, and its stable identity is not already held by a
 * non-deleted local record anywhere in the account. Among candidates sharing an
 * identity only the first in (folder, UIDVALIDITY, UID) order is proposed.
 */
public class DeltaPlanner {
    private static final Logger LOGGER = Logger.getLogger(DeltaPlanner.class.getName());

    private final MailStateStore store;

    public DeltaPlanner(MailStateStore store) {
        this.store = store;
    }

    /**
     * Compute the fetch delta
     *
     * @param accountId The account
     * @param filter The fetch filter
     * @return UIDs to fetch per folder, folders in name order and UIDs ascending
     * @throws StoreException If the state cannot be read
     */
    public Map<String, List<Long>> computeFetchDelta(String accountId, FetchFilter filter) throws StoreException {
        Map<String, List<Long>> delta = new LinkedHashMap<>();
        for (ServerMailRecord row : plan(accountId, filter)) {
            delta.computeIfAbsent(row.getFolder(), f -> new ArrayList<>()).add(row.getUid());
        }
        for (List<Long> uids : delta.values()) {
            uids.sort(null);
        }
        return delta;
    }

    /**
     * Compute the fetch delta as mirror rows
     *
     * @param accountId The account
     * @param filter The fetch filter
     * @return The rows to fetch in (folder, UIDVALIDITY, UID) order
     * @throws StoreException If the state cannot be read
     */
    public List<ServerMailRecord> plan(String accountId, FetchFilter filter) throws StoreException {
        List<ServerMailRecord> rows;
        Set<String> localIdentities = new HashSet<>();
        try (MailStateTransaction tx = store.begin(accountId)) {
            rows = tx.serverRecords();
            for (LocalMailRecord local : tx.localRecords(false)) {
                localIdentities.add(local.getStableIdentity());
            }
        }

        Date since = filter.getSince();
        Set<String> planned = new HashSet<>();
        List<ServerMailRecord> result = new ArrayList<>();
        int alreadyLocal = 0;
        for (ServerMailRecord row : rows) {
            if (row.getLinkedLocalId() != null || row.isDeleted()) {
                continue;
            }
            if (!filter.acceptsFolder(row.getFolder())) {
                continue;
            }
            if (since != null && (row.getEnvelopeDate() == null || row.getEnvelopeDate().before(since))) {
                continue;
            }
            if (filter.isUnseenOnly() && MailFlags.contains(row.getFlags(), MailFlags.SEEN)) {
                continue;
            }
            String identity = row.getStableIdentity();
            if (localIdentities.contains(identity)) {
                alreadyLocal++;
                continue;
            }
            if (!planned.add(identity)) {
                continue;
            }
            result.add(row);
        }

        LOGGER.fine("Fetch delta for account " + accountId + ": " + result.size() + " messages, "
                + alreadyLocal + " already held locally");
        return result;
    }
}
