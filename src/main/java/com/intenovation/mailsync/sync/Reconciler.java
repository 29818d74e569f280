package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.MailSyncException;
import com.intenovation.mailsync.SyncError;
import com.intenovation.mailsync.SyncErrorKind;
import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailFlags;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.ServerMailRecord;
import com.intenovation.mailsync.store.AccountLock;
import com.intenovation.mailsync.store.ConcurrencyConflictException;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import com.intenovation.mailsync.store.StoreException;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Aligns the local records of an account with its server mirror.
 * <p>
 * A pass runs under the account lock in a single transaction and has three steps:
 * <ol>
 * <li>Duplicates. Local records sharing a stable identity keep the member whose
 * (folder, UIDVALIDITY, UID) matches a mirror row of that identity; the others are
 * soft deleted. A group with no matching member is soft deleted as a whole.</li>
 * <li>Moves and flags. A survivor whose identity is in the mirror takes over the
 * location and flags of its mirror row, and the row is linked to it.</li>
 * <li>Deletions. A survivor whose identity is gone from the mirror is soft deleted,
 * as long as its folder has been scanned.</li>
 * </ol>
 * Any failure rolls the whole pass back. The reconciler is also the only place
 * where confirmed mutations are folded into local records.
 */
public class Reconciler {
    private static final Logger LOGGER = Logger.getLogger(Reconciler.class.getName());

    private final MailStateStore store;
    private final MailSyncConfiguration configuration;
    private final MailSyncEvents events;

    public Reconciler(MailStateStore store, MailSyncConfiguration configuration, MailSyncEvents events) {
        this.store = store;
        this.configuration = configuration;
        this.events = events;
    }

    /**
     * Run a reconcile pass
     *
     * @param accountId The account
     * @return What changed; a pass that could not get the account lock is marked skipped
     * @throws MailSyncException If the pass failed and was rolled back
     * @throws InterruptedException If interrupted while waiting for the lock
     */
    public ReconcileStats reconcile(String accountId) throws MailSyncException, InterruptedException {
        ReconcileStats stats = new ReconcileStats();
        AccountLock lock;
        try {
            lock = store.lockAccount(accountId, configuration.getReconcileLockTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ConcurrencyConflictException e) {
            LOGGER.warning("Skipping reconcile for account " + accountId + ": " + e.getMessage());
            stats.markSkipped(SyncError.forAccount(SyncErrorKind.CONCURRENCY_CONFLICT, e.getMessage()));
            return stats;
        }

        List<PendingEvent> pending = new ArrayList<>();
        try (AccountLock held = lock; MailStateTransaction tx = store.begin(accountId)) {
            reconcile(tx, stats, pending);
            tx.commit();
        } catch (ConcurrencyConflictException e) {
            LOGGER.warning("Reconcile for account " + accountId + " collided with a concurrent writer, "
                    + "rolled back: " + e.getMessage());
            ReconcileStats skipped = new ReconcileStats();
            skipped.markSkipped(SyncError.forAccount(SyncErrorKind.CONCURRENCY_CONFLICT, e.getMessage()));
            return skipped;
        } catch (MailSyncException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Reconcile failed for account " + accountId + ", rolled back", e);
            if (e instanceof MailSyncException) {
                throw (MailSyncException) e;
            }
            throw new MailSyncException("Reconcile failed for account " + accountId, (RuntimeException) e);
        }

        for (PendingEvent event : pending) {
            events.fire(event.type, accountId, event.item);
        }
        LOGGER.info("Reconciled account " + accountId + ": " + stats);
        return stats;
    }

    private void reconcile(MailStateTransaction tx, ReconcileStats stats, List<PendingEvent> pending)
            throws StoreException {
        Date now = new Date();
        List<ServerMailRecord> mirror = tx.serverRecords();

        Map<String, List<ServerMailRecord>> mirrorByIdentity = new HashMap<>();
        Set<String> scannedFolders = new HashSet<>();
        for (ServerMailRecord row : mirror) {
            if (!row.isDeleted()) {
                mirrorByIdentity.computeIfAbsent(row.getStableIdentity(), k -> new ArrayList<>()).add(row);
            }
            scannedFolders.add(row.getFolder());
        }
        for (FolderScan scan : tx.folderScans()) {
            scannedFolders.add(scan.getFolder());
        }

        Map<String, List<LocalMailRecord>> groups = new LinkedHashMap<>();
        for (LocalMailRecord local : tx.localRecords(false)) {
            groups.computeIfAbsent(local.getStableIdentity(), k -> new ArrayList<>()).add(local);
        }

        // 1. duplicates
        List<LocalMailRecord> survivors = new ArrayList<>();
        for (Map.Entry<String, List<LocalMailRecord>> group : groups.entrySet()) {
            List<LocalMailRecord> members = group.getValue();
            if (members.size() == 1) {
                survivors.add(members.get(0));
                continue;
            }
            List<ServerMailRecord> rows = mirrorByIdentity.getOrDefault(group.getKey(), new ArrayList<>());
            LocalMailRecord keep = null;
            for (LocalMailRecord member : members) {
                if (findRowAt(rows, member) != null) {
                    keep = member;
                    break;
                }
            }
            if (keep != null) {
                survivors.add(keep);
                for (LocalMailRecord member : members) {
                    if (member != keep) {
                        softDelete(tx, member, now, true, stats, pending);
                    }
                }
                continue;
            }
            if (rows.isEmpty() && !anyScanned(members, scannedFolders)) {
                // nothing known about these folders yet
                LOGGER.fine("Leaving duplicate group " + group.getKey() + " in unscanned folders untouched");
                continue;
            }
            LOGGER.warning("No member of duplicate group " + group.getKey() + " matches the mirror, "
                    + "soft deleting all " + members.size());
            stats.addError(SyncError.forAccount(SyncErrorKind.DATA_INTEGRITY_ANOMALY,
                    "Duplicate identity " + group.getKey() + " without survivor, " + members.size()
                            + " records soft deleted"));
            for (LocalMailRecord member : members) {
                softDelete(tx, member, now, true, stats, pending);
            }
        }

        // 2. moves and flags
        Map<MailKey, Long> desiredLinks = new HashMap<>();
        for (LocalMailRecord survivor : survivors) {
            List<ServerMailRecord> rows = mirrorByIdentity.get(survivor.getStableIdentity());
            if (rows == null || rows.isEmpty()) {
                // 3. deletions
                if (scannedFolders.contains(survivor.getFolder())) {
                    softDelete(tx, survivor, now, false, stats, pending);
                }
                continue;
            }

            ServerMailRecord target = findRowAt(rows, survivor);
            if (target == null) {
                target = rows.get(0);
            }

            boolean moved = false;
            boolean changed = false;
            if (!target.getKey().equals(survivor.getKey())) {
                LOGGER.fine("Local record " + survivor.getId() + " moved from " + survivor.getKey()
                        + " to " + target.getKey());
                survivor.relocate(target.getFolder(), target.getUidValidity(), target.getUid());
                moved = true;
                changed = true;
            }
            if (configuration.isSyncFlags()) {
                MailFlags serverFlags = target.getParsedFlags();
                if (!serverFlags.equals(survivor.getFlags())) {
                    survivor.setFlags(serverFlags);
                    changed = true;
                }
            }
            if (changed) {
                tx.updateLocal(survivor);
                stats.recordUpdated(moved);
                if (moved) {
                    pending.add(new PendingEvent(MailSyncChangeEvent.ChangeType.MESSAGE_MOVED, survivor.getId()));
                }
            }
            desiredLinks.put(target.getKey(), survivor.getId());
        }

        for (ServerMailRecord row : mirror) {
            Long desired = desiredLinks.get(row.getKey());
            if (!Objects.equals(row.getLinkedLocalId(), desired)) {
                tx.linkServerRecord(row.getKey(), desired);
                if (desired != null) {
                    stats.recordLinked();
                }
            }
        }
    }

    /**
     * Record a confirmed move. With a known destination UID the local record is
     * relocated right away; without one it stays where it is until the next
     * mirror sync and reconcile find it in its new folder.
     *
     * @param source Where the message was
     * @param targetFolder Where it was moved to
     * @param newUidValidity The destination UIDVALIDITY, or null if unknown
     * @param newUid The destination UID, or null if unknown
     * @return The updated record, or empty if there is no local record at the source
     * @throws MailSyncException If the lock or the transaction fails
     * @throws InterruptedException If interrupted while waiting for the lock
     */
    public Optional<LocalMailRecord> applyConfirmedMove(MailKey source, String targetFolder,
                                                        Long newUidValidity, Long newUid)
            throws MailSyncException, InterruptedException {
        if (newUidValidity == null || newUid == null) {
            LOGGER.fine("Move of " + source + " to " + targetFolder + " confirmed without UID, "
                    + "leaving the local record for the next reconcile");
            return Optional.empty();
        }
        return applyConfirmed(source, record -> {
            record.relocate(targetFolder, newUidValidity, newUid);
            return MailSyncChangeEvent.ChangeType.MESSAGE_MOVED;
        });
    }

    /**
     * Record a confirmed deletion by soft deleting the local record
     *
     * @param source The deleted message
     * @return The updated record, or empty if there is no local record
     * @throws MailSyncException If the lock or the transaction fails
     * @throws InterruptedException If interrupted while waiting for the lock
     */
    public Optional<LocalMailRecord> applyConfirmedDelete(MailKey source)
            throws MailSyncException, InterruptedException {
        Date now = new Date();
        return applyConfirmed(source, record -> {
            record.markDeleted(now);
            return MailSyncChangeEvent.ChangeType.MESSAGE_DELETED;
        });
    }

    /**
     * Record confirmed flag changes
     *
     * @param source The message
     * @param seen The new \Seen state, or null if unchanged
     * @param flagged The new \Flagged state, or null if unchanged
     * @return The updated record, or empty if there is no local record
     * @throws MailSyncException If the lock or the transaction fails
     * @throws InterruptedException If interrupted while waiting for the lock
     */
    public Optional<LocalMailRecord> applyConfirmedFlags(MailKey source, Boolean seen, Boolean flagged)
            throws MailSyncException, InterruptedException {
        return applyConfirmed(source, record -> {
            if (seen != null) {
                record.setSeen(seen);
            }
            if (flagged != null) {
                record.setFlagged(flagged);
            }
            return null;
        });
    }

    private Optional<LocalMailRecord> applyConfirmed(MailKey source, LocalChange change)
            throws MailSyncException, InterruptedException {
        String accountId = source.getAccountId();
        LocalMailRecord updated;
        MailSyncChangeEvent.ChangeType eventType;
        try (AccountLock lock = store.lockAccount(accountId, configuration.getReconcileLockTimeoutMs(),
                TimeUnit.MILLISECONDS);
             MailStateTransaction tx = store.begin(accountId)) {
            Optional<LocalMailRecord> found = tx.findLocal(source);
            if (!found.isPresent()) {
                LOGGER.fine("No local record at " + source);
                return Optional.empty();
            }
            updated = found.get();
            eventType = change.apply(updated);
            tx.updateLocal(updated);
            tx.commit();
        }
        if (eventType != null) {
            events.fire(eventType, accountId, updated.getId());
        }
        return Optional.of(updated);
    }

    private void softDelete(MailStateTransaction tx, LocalMailRecord record, Date now, boolean duplicate,
                            ReconcileStats stats, List<PendingEvent> pending) throws StoreException {
        LOGGER.fine("Soft deleting local record " + record.getId() + " at " + record.getKey()
                + (duplicate ? " (duplicate)" : ""));
        record.markDeleted(now);
        tx.updateLocal(record);
        stats.recordDeleted(duplicate);
        pending.add(new PendingEvent(MailSyncChangeEvent.ChangeType.MESSAGE_DELETED, record.getId()));
    }

    private static ServerMailRecord findRowAt(List<ServerMailRecord> rows, LocalMailRecord local) {
        for (ServerMailRecord row : rows) {
            if (row.getKey().matches(local.getFolder(), local.getUidValidity(), local.getUid())) {
                return row;
            }
        }
        return null;
    }

    private static boolean anyScanned(List<LocalMailRecord> members, Set<String> scannedFolders) {
        for (LocalMailRecord member : members) {
            if (scannedFolders.contains(member.getFolder())) {
                return true;
            }
        }
        return false;
    }

    private interface LocalChange {
        MailSyncChangeEvent.ChangeType apply(LocalMailRecord record);
    }

    private static final class PendingEvent {
        final MailSyncChangeEvent.ChangeType type;
        final Object item;

        PendingEvent(MailSyncChangeEvent.ChangeType type, Object item) {
            this.type = type;
            this.item = item;
        }
    }
}
