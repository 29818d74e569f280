package com.intenovation.mailsync.thread;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.ProtocolCapabilityMissingException;
import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.imap.ImapMailboxFactory;
import com.intenovation.mailsync.imap.SelectedFolder;
import com.intenovation.mailsync.imap.ThreadNode;
import com.intenovation.mailsync.imap.ThreadStructureParser;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.MessageIdentity;
import com.intenovation.mailsync.store.AccountLock;
import com.intenovation.mailsync.store.ConcurrencyConflictException;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import com.intenovation.mailsync.store.StoreException;

import javax.mail.MessagingException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groups the local records of an account into conversations.
 * <p>
 * A message that names an In-Reply-To is placed by the reference chain: it joins
 * the thread of the message it replies to, or starts a new thread when that
 * message is unknown. Messages without In-Reply-To are placed by the server's
 * THREAD structure when the server offers it, otherwise they start their own
 * thread. Thread ids are name-based UUIDs of the account and the stable identity
 * of the thread root, so the same conversation keeps its id across runs.
 * <p>
 * Assignments are stored on the local records under the account writer lock,
 * in one transaction.
 */
public class ThreadResolver {
    private static final Logger LOGGER = Logger.getLogger(ThreadResolver.class.getName());

    private final MailStateStore store;
    private final ImapMailboxFactory mailboxFactory;
    private final MailSyncConfiguration configuration;
    private final MailSyncEvents events;

    public ThreadResolver(MailStateStore store, ImapMailboxFactory mailboxFactory,
                          MailSyncConfiguration configuration, MailSyncEvents events) {
        this.store = store;
        this.mailboxFactory = mailboxFactory;
        this.configuration = configuration;
        this.events = events;
    }

    /**
     * Resolve the threads of all non-deleted local records of an account
     *
     * @param settings The account
     * @return Assignments keyed by local id
     * @throws StoreException If the local records cannot be read or the assignments cannot be stored
     * @throws InterruptedException If the run is cancelled between folders
     */
    public Map<Long, ThreadAssignment> resolveThreads(AccountSettings settings)
            throws StoreException, InterruptedException {
        String accountId = settings.getAccountId();
        List<LocalMailRecord> records;
        try (MailStateTransaction tx = store.begin(accountId)) {
            records = tx.localRecords(false);
        }

        Map<Long, LocalMailRecord> byId = new HashMap<>();
        ThreadForest forest = new ThreadForest();
        for (LocalMailRecord record : records) {
            byId.put(record.getId(), record);
            forest.add(record.getId());
        }

        linkReferenceChains(records, forest);
        if (configuration.isUseServerThreading() && !records.isEmpty()) {
            linkServerThreads(settings, records, forest);
        }
        forest.breakCycles();

        Map<Long, ThreadAssignment> result = new TreeMap<>();
        for (LocalMailRecord record : records) {
            long rootId = forest.getThreadRoot(record.getId());
            String threadId = threadId(accountId, byId.get(rootId).getStableIdentity());
            Long parentId = forest.getParent(record.getId());
            Long parentUid = parentId != null ? byId.get(parentId).getUid() : null;
            result.put(record.getId(), new ThreadAssignment(threadId, parentId, parentUid));
        }

        int stored = storeAssignments(accountId, result);
        LOGGER.info("Resolved threads for " + result.size() + " messages of account " + accountId
                + ", " + stored + " assignments changed");
        events.fire(MailSyncChangeEvent.ChangeType.THREADS_RESOLVED, accountId, result.size());
        return result;
    }

    /**
     * Write changed assignments to the local records. Records deleted since they
     * were read are left alone. A busy account or a concurrent writer leaves the
     * stored assignments as they were; the next run stores them.
     *
     * @return The number of records whose assignment changed
     */
    private int storeAssignments(String accountId, Map<Long, ThreadAssignment> assignments)
            throws StoreException, InterruptedException {
        int changed = 0;
        try (AccountLock lock = store.lockAccount(accountId, configuration.getReconcileLockTimeoutMs(),
                TimeUnit.MILLISECONDS);
             MailStateTransaction tx = store.begin(accountId)) {
            for (Map.Entry<Long, ThreadAssignment> entry : assignments.entrySet()) {
                Optional<LocalMailRecord> found = tx.findLocal(entry.getKey());
                if (!found.isPresent() || found.get().isSoftDeleted()) {
                    continue;
                }
                LocalMailRecord record = found.get();
                ThreadAssignment assignment = entry.getValue();
                if (assignment.getThreadId().equals(record.getThreadId())
                        && Objects.equals(assignment.getParentLocalId(), record.getParentLocalId())) {
                    continue;
                }
                record.assignThread(assignment.getThreadId(), assignment.getParentLocalId());
                tx.updateLocal(record);
                changed++;
            }
            if (changed > 0) {
                tx.commit();
            }
        } catch (ConcurrencyConflictException e) {
            LOGGER.warning("Thread assignments of account " + accountId + " not stored: " + e.getMessage());
            return 0;
        }
        return changed;
    }

    /**
     * Derive the thread id for a root
     *
     * @param accountId The account
     * @param rootIdentity The stable identity of the thread root
     * @return A name-based UUID string
     */
    public static String threadId(String accountId, String rootIdentity) {
        return UUID.nameUUIDFromBytes((accountId + ":" + rootIdentity).getBytes(StandardCharsets.UTF_8)).toString();
    }

    static void linkReferenceChains(List<LocalMailRecord> records, ThreadForest forest) {
        Map<String, LocalMailRecord> byMessageId = new HashMap<>();
        for (LocalMailRecord record : records) {
            String messageId = MessageIdentity.normalizeMessageId(record.getMessageId());
            if (messageId != null) {
                // records come ordered by id, the oldest copy wins
                byMessageId.putIfAbsent(messageId, record);
            }
        }
        for (LocalMailRecord record : records) {
            String reference = MessageIdentity.normalizeReference(record.getInReplyTo());
            if (reference == null) {
                continue;
            }
            LocalMailRecord parent = byMessageId.get(reference);
            if (parent != null && parent.getId() != record.getId()) {
                forest.setParent(record.getId(), parent.getId());
            } else {
                LOGGER.fine("Message " + record.getId() + " replies to unknown " + reference
                        + ", starting a new thread");
            }
        }
    }

    private void linkServerThreads(AccountSettings settings, List<LocalMailRecord> records, ThreadForest forest)
            throws InterruptedException {
        TreeSet<String> folders = new TreeSet<>();
        Map<MailKey, LocalMailRecord> byKey = new HashMap<>();
        for (LocalMailRecord record : records) {
            folders.add(record.getFolder());
            byKey.put(record.getKey(), record);
        }

        String algorithm = configuration.getThreadAlgorithm();
        try (ImapMailbox mailbox = mailboxFactory.open(settings)) {
            if (!mailbox.supportsThreading(algorithm)) {
                LOGGER.fine("THREAD=" + algorithm + " not advertised, using reference chains only");
                return;
            }
            for (String folder : folders) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Thread resolution cancelled");
                }
                SelectedFolder selected = mailbox.select(folder, true);
                List<ThreadNode> roots = ThreadStructureParser.parse(mailbox.thread(algorithm));
                ServerThreadWalk walk = new ServerThreadWalk(settings.getAccountId(), folder,
                        selected.getUidValidity(), byKey, forest);
                for (ThreadNode root : roots) {
                    walk.visit(root, null, null);
                }
            }
        } catch (ProtocolCapabilityMissingException e) {
            LOGGER.fine("Server threading unavailable (" + e.getMessage() + "), using reference chains only");
        } catch (MessagingException e) {
            LOGGER.log(Level.WARNING, "Server threading failed for account " + settings.getAccountId()
                    + ", using reference chains only", e);
        }
    }

    /**
     * Depth first walk over one folder's THREAD response
     */
    static final class ServerThreadWalk {
        private final String accountId;
        private final String folder;
        private final long uidValidity;
        private final Map<MailKey, LocalMailRecord> byKey;
        private final ThreadForest forest;

        ServerThreadWalk(String accountId, String folder, long uidValidity,
                         Map<MailKey, LocalMailRecord> byKey, ThreadForest forest) {
            this.accountId = accountId;
            this.folder = folder;
            this.uidValidity = uidValidity;
            this.byKey = byKey;
            this.forest = forest;
        }

        /**
         * @param node The node to place
         * @param predecessor The nearest known message above it in the branch
         * @param anchor For children of a missing root, the first sibling placed
         * @return The anchor for the following siblings
         */
        Long visit(ThreadNode node, Long predecessor, Long anchor) {
            if (node.isPlaceholder()) {
                Long siblingAnchor = null;
                for (ThreadNode child : node.getChildren()) {
                    if (predecessor != null) {
                        visit(child, predecessor, null);
                    } else {
                        Long placed = visit(child, null, siblingAnchor);
                        if (siblingAnchor == null) {
                            siblingAnchor = placed;
                        }
                    }
                }
                return siblingAnchor;
            }

            LocalMailRecord record = byKey.get(new MailKey(accountId, folder, uidValidity, node.getUid()));
            Long placed = null;
            if (record != null) {
                placed = record.getId();
                if (MessageIdentity.normalizeReference(record.getInReplyTo()) == null) {
                    if (predecessor != null) {
                        forest.setParent(placed, predecessor);
                    } else if (anchor != null) {
                        forest.join(placed, anchor);
                    }
                }
            }
            Long next = placed != null ? placed : predecessor;
            for (ThreadNode child : node.getChildren()) {
                visit(child, next, null);
            }
            return placed != null ? placed : anchor;
        }
    }
}
