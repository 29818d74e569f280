package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.SyncError;
import com.intenovation.mailsync.SyncErrorKind;
import com.intenovation.mailsync.SyncErrors;
import com.intenovation.mailsync.imap.FetchedEnvelope;
import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.imap.ImapMailboxFactory;
import com.intenovation.mailsync.imap.SelectedFolder;
import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.ServerMailRecord;
import com.intenovation.mailsync.store.ConcurrencyConflictException;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import com.intenovation.mailsync.store.StoreException;

import javax.mail.MessagingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds the server mirror of an account, one folder at a time.
 * <p>
 * Every folder is scanned on its own connection: select read-only, list all UIDs,
 * fetch envelopes and flags in batches, then replace the folder's mirror rows with
 * the observed set in a single transaction. A folder that collides with a concurrent
 * scan is rolled back and skipped for this run; any other failure is recorded and
 * the remaining folders carry on.
 */
public class ServerMirror {
    private static final Logger LOGGER = Logger.getLogger(ServerMirror.class.getName());

    private final MailStateStore store;
    private final ImapMailboxFactory mailboxFactory;
    private final MailSyncConfiguration configuration;
    private final MailSyncEvents events;

    public ServerMirror(MailStateStore store, ImapMailboxFactory mailboxFactory,
                        MailSyncConfiguration configuration, MailSyncEvents events) {
        this.store = store;
        this.mailboxFactory = mailboxFactory;
        this.configuration = configuration;
        this.events = events;
    }

    /**
     * Rebuild the mirror of the given folders
     *
     * @param settings The account
     * @param folders The folders to scan; empty means the folders scanned before
     * @return What was scanned, written and skipped
     * @throws StoreException If the known folders cannot be read
     * @throws InterruptedException If the run is cancelled
     */
    public MirrorSyncStats syncFolderState(AccountSettings settings, List<String> folders)
            throws StoreException, InterruptedException {
        String accountId = settings.getAccountId();
        MirrorSyncStats stats = new MirrorSyncStats();

        List<String> targets = new ArrayList<>(new LinkedHashSet<>(folders));
        if (targets.isEmpty()) {
            targets = knownFolders(accountId);
            if (targets.isEmpty()) {
                LOGGER.info("No folders known for account " + accountId + ", nothing to scan");
                return stats;
            }
            LOGGER.fine("Using " + targets.size() + " known folders for account " + accountId);
        }

        int workers = Math.min(configuration.getFolderWorkers(), targets.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory("mailsync-folder"));
        Map<String, Future<FolderResult>> futures = new LinkedHashMap<>();
        try {
            for (String folder : targets) {
                futures.put(folder, executor.submit(scanTask(settings, folder)));
            }
            for (Map.Entry<String, Future<FolderResult>> entry : futures.entrySet()) {
                String folder = entry.getKey();
                FolderResult result;
                try {
                    result = entry.getValue().get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    result = FolderResult.failed(folder, SyncErrors.folderError(folder, cause));
                    LOGGER.log(Level.WARNING, "Scan of " + folder + " failed for account " + accountId, cause);
                }
                record(accountId, stats, result);
            }
        } catch (InterruptedException e) {
            for (Future<FolderResult> future : futures.values()) {
                future.cancel(true);
            }
            throw e;
        } finally {
            executor.shutdownNow();
        }

        LOGGER.info("Mirror sync for account " + accountId + ": " + stats);
        return stats;
    }

    private Callable<FolderResult> scanTask(AccountSettings settings, String folder) {
        return () -> {
            try (ImapMailbox mailbox = mailboxFactory.open(settings)) {
                return scanFolder(mailbox, settings.getAccountId(), folder);
            }
        };
    }

    /**
     * Scan one folder and replace its mirror rows
     *
     * @param mailbox An open connection
     * @param accountId The account
     * @param folder The folder
     * @return The outcome for this folder
     * @throws MessagingException If the server or the store fails
     * @throws InterruptedException If the scan is cancelled between batches
     */
    FolderResult scanFolder(ImapMailbox mailbox, String accountId, String folder)
            throws MessagingException, InterruptedException {
        SelectedFolder selected = mailbox.select(folder, true);
        long uidValidity = selected.getUidValidity();
        long[] uids = mailbox.searchAll();
        Date now = new Date();

        List<ServerMailRecord> observed = new ArrayList<>(uids.length);
        int batchSize = configuration.getFetchBatchSize();
        for (int start = 0; start < uids.length; start += batchSize) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Scan of " + folder + " cancelled");
            }
            long[] batch = Arrays.copyOfRange(uids, start, Math.min(start + batchSize, uids.length));
            for (FetchedEnvelope fetched : mailbox.fetchEnvelopes(batch)) {
                MailKey key = new MailKey(accountId, folder, uidValidity, fetched.getUid());
                observed.add(new ServerMailRecord(key, fetched.getEnvelope(), fetched.getFlags(), now));
            }
            LOGGER.fine("Fetched " + batch.length + " envelopes from " + folder);
        }

        try (MailStateTransaction tx = store.begin(accountId)) {
            Optional<FolderScan> previous = tx.folderScan(folder);
            if (previous.isPresent() && previous.get().getUidValidity() != uidValidity) {
                LOGGER.warning("UIDVALIDITY of " + folder + " changed from " + previous.get().getUidValidity()
                        + " to " + uidValidity + " for account " + accountId + ", starting a new epoch");
            }
            int removed = tx.deleteServerRecords(folder);
            for (ServerMailRecord record : observed) {
                tx.insertServerRecord(record);
            }
            tx.recordFolderScan(new FolderScan(folder, uidValidity, now));
            tx.commit();
            return FolderResult.scanned(folder, uids.length, observed.size(), removed);
        } catch (ConcurrencyConflictException e) {
            LOGGER.warning("Skipping " + folder + " for account " + accountId + ": " + e.getMessage());
            return FolderResult.failed(folder, SyncError.forFolder(SyncErrorKind.CONCURRENCY_CONFLICT,
                    folder, e.getMessage()));
        }
    }

    private List<String> knownFolders(String accountId) throws StoreException {
        Set<String> known = new LinkedHashSet<>();
        try (MailStateTransaction tx = store.begin(accountId)) {
            for (FolderScan scan : tx.folderScans()) {
                known.add(scan.getFolder());
            }
            for (ServerMailRecord record : tx.serverRecords()) {
                known.add(record.getFolder());
            }
        }
        return new ArrayList<>(known);
    }

    private void record(String accountId, MirrorSyncStats stats, FolderResult result) {
        if (result.error == null) {
            stats.folderScanned(result.folder, result.onServer, result.inserted, result.removed);
            events.fire(MailSyncChangeEvent.ChangeType.FOLDER_SCANNED, accountId, result.folder);
        } else {
            stats.folderSkipped(result.folder, result.error);
            events.fire(MailSyncChangeEvent.ChangeType.FOLDER_SKIPPED, accountId, result.folder);
        }
    }

    static final class FolderResult {
        final String folder;
        final int onServer;
        final int inserted;
        final int removed;
        final SyncError error;

        private FolderResult(String folder, int onServer, int inserted, int removed, SyncError error) {
            this.folder = folder;
            this.onServer = onServer;
            this.inserted = inserted;
            this.removed = removed;
            this.error = error;
        }

        static FolderResult scanned(String folder, int onServer, int inserted, int removed) {
            return new FolderResult(folder, onServer, inserted, removed, null);
        }

        static FolderResult failed(String folder, SyncError error) {
            return new FolderResult(folder, 0, 0, 0, error);
        }
    }
}
