package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.SyncError;
import com.intenovation.mailsync.SyncErrorKind;
import com.intenovation.mailsync.SyncErrors;
import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.imap.ImapMailboxFactory;
import com.intenovation.mailsync.model.ServerMailRecord;
import com.intenovation.mailsync.store.StoreException;

import javax.mail.MessagingException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Materializes the fetch delta of an account.
 * <p>
 * The delta is cut into per-folder chunks that run with bounded parallelism, each
 * on its own connection. A message that fails is recorded as an error and its
 * siblings carry on; cancellation is checked before every message.
 */
public class FetchCoordinator {
    private static final Logger LOGGER = Logger.getLogger(FetchCoordinator.class.getName());

    private final DeltaPlanner planner;
    private final MessageMaterializer materializer;
    private final FetchExecutor executor;
    private final ImapMailboxFactory mailboxFactory;
    private final MailSyncConfiguration configuration;
    private final MailSyncEvents events;

    public FetchCoordinator(DeltaPlanner planner, MessageMaterializer materializer, FetchExecutor executor,
                            ImapMailboxFactory mailboxFactory, MailSyncConfiguration configuration,
                            MailSyncEvents events) {
        this.planner = planner;
        this.materializer = materializer;
        this.executor = executor;
        this.mailboxFactory = mailboxFactory;
        this.configuration = configuration;
        this.events = events;
    }

    /**
     * Fetch everything the delta planner proposes
     *
     * @param settings The account
     * @param filter The fetch filter
     * @return Counts, created local ids and per-message errors
     * @throws StoreException If the delta cannot be computed
     * @throws InterruptedException If the run is cancelled
     */
    public FetchStats fetch(AccountSettings settings, FetchFilter filter) throws StoreException, InterruptedException {
        String accountId = settings.getAccountId();
        List<ServerMailRecord> rows = planner.plan(accountId, filter);
        FetchStats stats = new FetchStats();
        stats.setPlanned(rows.size());
        if (rows.isEmpty()) {
            LOGGER.info("Nothing to fetch for account " + accountId);
            return stats;
        }

        List<List<ServerMailRecord>> chunks = chunk(rows, configuration.getFetchParallelism(),
                configuration.getFetchBatchSize());
        int threads = Math.min(configuration.getFetchParallelism(), chunks.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerThreadFactory("mailsync-fetch"));
        List<Future<ChunkResult>> futures = new ArrayList<>();
        try {
            for (List<ServerMailRecord> chunk : chunks) {
                futures.add(pool.submit(chunkTask(settings, chunk)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    ChunkResult result = futures.get(i).get();
                    for (Long id : result.localIds) {
                        stats.messageFetched(id);
                    }
                    for (SyncError error : result.errors) {
                        stats.messageFailed(error);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    LOGGER.log(Level.WARNING, "Fetch chunk failed for account " + accountId, cause);
                    for (ServerMailRecord row : chunks.get(i)) {
                        stats.messageFailed(SyncErrors.messageError(row.getFolder(), row.getUid(), cause));
                    }
                }
            }
        } catch (InterruptedException e) {
            for (Future<ChunkResult> future : futures) {
                future.cancel(true);
            }
            throw e;
        } finally {
            pool.shutdownNow();
        }

        LOGGER.info("Fetch for account " + accountId + ": " + stats);
        return stats;
    }

    private Callable<ChunkResult> chunkTask(AccountSettings settings, List<ServerMailRecord> chunk) {
        return () -> {
            ChunkResult result = new ChunkResult();
            String folder = chunk.get(0).getFolder();
            try (ImapMailbox mailbox = mailboxFactory.open(settings)) {
                long uidValidity = mailbox.select(folder, true).getUidValidity();
                for (ServerMailRecord row : chunk) {
                    if (Thread.interrupted()) {
                        throw new InterruptedException("Fetch of " + folder + " cancelled");
                    }
                    if (row.getUidValidity() != uidValidity) {
                        // the UID now names a different message; the next scan picks up the new epoch
                        result.errors.add(SyncError.forMessage(SyncErrorKind.DATA_INTEGRITY_ANOMALY, folder,
                                row.getUid(), "UIDVALIDITY changed from " + row.getUidValidity() + " to "
                                        + uidValidity + " since the last scan"));
                        result.handled.add(row.getUid());
                        continue;
                    }
                    fetchOne(settings.getAccountId(), mailbox, row, result);
                }
            } catch (MessagingException e) {
                // connection or select failed, or closing did; account for what is left
                LOGGER.log(Level.WARNING, "Could not fetch from " + folder, e);
                for (ServerMailRecord row : chunk) {
                    if (!result.handled.contains(row.getUid())) {
                        result.errors.add(SyncErrors.messageError(folder, row.getUid(), e));
                    }
                }
            }
            return result;
        };
    }

    private void fetchOne(String accountId, ImapMailbox mailbox, ServerMailRecord row, ChunkResult result) {
        try {
            FetchedMessage message = materializer.materialize(mailbox, row);
            long id = executor.insertFetched(message);
            result.localIds.add(id);
            events.fire(MailSyncChangeEvent.ChangeType.MESSAGE_FETCHED, accountId, id);
        } catch (MessagingException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not fetch UID " + row.getUid() + " from " + row.getFolder(), e);
            result.errors.add(SyncErrors.messageError(row.getFolder(), row.getUid(), e));
        }
        result.handled.add(row.getUid());
    }

    /**
     * Group rows by folder and cut each folder into chunks so that the work spreads
     * over the available workers, no chunk larger than the batch size
     */
    static List<List<ServerMailRecord>> chunk(List<ServerMailRecord> rows, int parallelism, int batchSize) {
        Map<String, List<ServerMailRecord>> byFolder = new LinkedHashMap<>();
        for (ServerMailRecord row : rows) {
            byFolder.computeIfAbsent(row.getFolder(), f -> new ArrayList<>()).add(row);
        }
        List<List<ServerMailRecord>> chunks = new ArrayList<>();
        for (List<ServerMailRecord> folderRows : byFolder.values()) {
            int size = Math.max(1, Math.min(batchSize, (folderRows.size() + parallelism - 1) / parallelism));
            for (int start = 0; start < folderRows.size(); start += size) {
                chunks.add(new ArrayList<>(folderRows.subList(start, Math.min(start + size, folderRows.size()))));
            }
        }
        return chunks;
    }

    private static final class ChunkResult {
        final List<Long> localIds = new ArrayList<>();
        final List<SyncError> errors = new ArrayList<>();
        final Set<Long> handled = new HashSet<>();
    }
}
