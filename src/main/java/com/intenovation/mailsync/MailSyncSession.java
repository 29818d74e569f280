package com.intenovation.mailsync;

import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.imap.ImapMailboxFactory;
import com.intenovation.mailsync.imap.JavaMailConnector;
import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.mutation.MutationAction;
import com.intenovation.mailsync.mutation.MutationCoordinator;
import com.intenovation.mailsync.mutation.MutationResult;
import com.intenovation.mailsync.store.FileMailStateStore;
import com.intenovation.mailsync.store.InMemoryMailStateStore;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import com.intenovation.mailsync.store.StoreException;
import com.intenovation.mailsync.sync.DeltaPlanner;
import com.intenovation.mailsync.sync.FetchCoordinator;
import com.intenovation.mailsync.sync.FetchFilter;
import com.intenovation.mailsync.sync.FetchStats;
import com.intenovation.mailsync.sync.JavaMailMessageMaterializer;
import com.intenovation.mailsync.sync.MessageMaterializer;
import com.intenovation.mailsync.sync.MirrorSyncStats;
import com.intenovation.mailsync.sync.PayloadCipher;
import com.intenovation.mailsync.sync.ReconcileStats;
import com.intenovation.mailsync.sync.Reconciler;
import com.intenovation.mailsync.sync.ServerMirror;
import com.intenovation.mailsync.sync.StoreFetchExecutor;
import com.intenovation.mailsync.thread.ThreadAssignment;
import com.intenovation.mailsync.thread.ThreadResolver;

import javax.mail.MessagingException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Entry point of the synchronization engine.
 * <p>
 * A session owns the state store, the account settings cache and the listeners,
 * and wires the phases together. Each phase can be run on its own;
 * {@link #runAccount} runs them all for one account in order: mirror sync, fetch,
 * reconcile, thread resolution. Every phase commits before the next one starts.
 */
public class MailSyncSession {
    private static final Logger LOGGER = Logger.getLogger(MailSyncSession.class.getName());

    private final MailSyncConfiguration configuration;
    private final MailStateStore store;
    private final ImapMailboxFactory mailboxFactory;
    private final AccountSettingsCache accountSettings;
    private final MailSyncEvents events;

    private final ServerMirror serverMirror;
    private final DeltaPlanner deltaPlanner;
    private final FetchCoordinator fetchCoordinator;
    private final Reconciler reconciler;
    private final ThreadResolver threadResolver;
    private final MutationCoordinator mutationCoordinator;

    /**
     * Create a session that talks to the servers over JavaMail. The state is kept
     * on disk when a store directory is configured, otherwise in memory.
     *
     * @param settingsProvider Source of account settings
     * @param configuration The configuration
     * @param cipher Encrypts fetched payloads
     * @throws StoreException If the state directory cannot be read
     */
    public MailSyncSession(AccountSettingsProvider settingsProvider, MailSyncConfiguration configuration,
                           PayloadCipher cipher) throws StoreException {
        this(settingsProvider, configuration, createStore(configuration), new JavaMailConnector(configuration),
                new JavaMailMessageMaterializer(cipher));
    }

    public MailSyncSession(AccountSettingsProvider settingsProvider, MailSyncConfiguration configuration,
                           MailStateStore store, ImapMailboxFactory mailboxFactory,
                           MessageMaterializer materializer) {
        this.configuration = configuration;
        this.store = store;
        this.mailboxFactory = mailboxFactory;
        this.accountSettings = new AccountSettingsCache(settingsProvider);
        this.events = new MailSyncEvents(this);

        this.serverMirror = new ServerMirror(store, mailboxFactory, configuration, events);
        this.deltaPlanner = new DeltaPlanner(store);
        this.fetchCoordinator = new FetchCoordinator(deltaPlanner, materializer, new StoreFetchExecutor(store),
                mailboxFactory, configuration, events);
        this.reconciler = new Reconciler(store, configuration, events);
        this.threadResolver = new ThreadResolver(store, mailboxFactory, configuration, events);
        this.mutationCoordinator = new MutationCoordinator(reconciler, mailboxFactory, events);
    }

    private static MailStateStore createStore(MailSyncConfiguration configuration) throws StoreException {
        if (configuration.getStoreDirectory() != null) {
            LOGGER.info("Keeping mail state in " + configuration.getStoreDirectory());
            return new FileMailStateStore(configuration.getStoreDirectory());
        }
        LOGGER.info("No store directory configured, keeping mail state in memory");
        return new InMemoryMailStateStore();
    }

    /**
     * Rebuild the server mirror for some folders of an account
     *
     * @param accountId The account
     * @param folders The folders; empty means the folders scanned before
     * @return Scan counts and per-folder errors
     * @throws MessagingException If the account is unknown or the store fails
     * @throws InterruptedException If the run is cancelled
     */
    public MirrorSyncStats syncFolderState(String accountId, List<String> folders)
            throws MessagingException, InterruptedException {
        return serverMirror.syncFolderState(accountSettings.get(accountId), folders);
    }

    /**
     * The UIDs per folder that are on the server but not yet local
     *
     * @param accountId The account
     * @param filter Which rows to consider
     * @return UIDs ascending per folder
     * @throws StoreException If the store fails
     */
    public Map<String, List<Long>> computeFetchDelta(String accountId, FetchFilter filter) throws StoreException {
        return deltaPlanner.computeFetchDelta(accountId, filter);
    }

    /**
     * Materialize the fetch delta
     *
     * @param accountId The account
     * @param filter Which rows to fetch
     * @return Fetch counts, new local ids and per-message errors
     * @throws MessagingException If the account is unknown or the delta cannot be computed
     * @throws InterruptedException If the run is cancelled
     */
    public FetchStats fetch(String accountId, FetchFilter filter) throws MessagingException, InterruptedException {
        return fetchCoordinator.fetch(accountSettings.get(accountId), filter);
    }

    public ReconcileStats reconcile(String accountId) throws MailSyncException, InterruptedException {
        return reconciler.reconcile(accountId);
    }

    public Map<Long, ThreadAssignment> resolveThreads(String accountId)
            throws MessagingException, InterruptedException {
        return threadResolver.resolveThreads(accountSettings.get(accountId));
    }

    /**
     * Apply a change to one message on the server
     *
     * @param accountId The account
     * @param action What to do
     * @param uid The message UID
     * @param folder The folder holding the message
     * @param target The target folder of a move, or null
     * @return The outcome
     * @throws MessagingException If the account is unknown
     * @throws InterruptedException If interrupted while waiting for the account lock
     */
    public MutationResult applyMutation(String accountId, MutationAction action, long uid, String folder,
                                        String target) throws MessagingException, InterruptedException {
        return mutationCoordinator.applyMutation(accountSettings.get(accountId), action, uid, folder, target);
    }

    /**
     * Run every phase for one account. Without folders the folders scanned
     * before are used, and on a first run the folders the server lists.
     *
     * @param accountId The account
     * @param folders The folders to scan, or an empty list
     * @param filter Which messages to fetch
     * @return The combined report
     * @throws MessagingException If the account is unknown or a phase transaction fails
     * @throws InterruptedException If the run is cancelled
     */
    public AccountSyncReport runAccount(String accountId, List<String> folders, FetchFilter filter)
            throws MessagingException, InterruptedException {
        AccountSettings settings = accountSettings.get(accountId);
        AccountSyncReport report = new AccountSyncReport(accountId);
        LOGGER.info("Starting sync of account " + accountId);

        List<String> targets = folders;
        if (targets.isEmpty() && !hasScans(accountId)) {
            targets = listServerFolders(settings);
        }

        report.setMirrorStats(serverMirror.syncFolderState(settings, targets));
        report.setFetchStats(fetchCoordinator.fetch(settings, filter));
        report.setReconcileStats(reconciler.reconcile(accountId));
        report.setThreads(threadResolver.resolveThreads(settings));
        report.finish();

        LOGGER.info(report.toString());
        return report;
    }

    public AccountSyncReport runAccount(String accountId) throws MessagingException, InterruptedException {
        return runAccount(accountId, Collections.emptyList(), FetchFilter.all());
    }

    private boolean hasScans(String accountId) throws StoreException {
        try (MailStateTransaction tx = store.begin(accountId)) {
            List<FolderScan> scans = tx.folderScans();
            return !scans.isEmpty() || !tx.serverRecords().isEmpty();
        }
    }

    private List<String> listServerFolders(AccountSettings settings) throws MessagingException {
        try (ImapMailbox mailbox = mailboxFactory.open(settings)) {
            List<String> names = new ArrayList<>(mailbox.listFolders());
            LOGGER.fine("Server lists " + names.size() + " folders for account " + settings.getAccountId());
            return names;
        }
    }

    public void addChangeListener(MailSyncChangeListener listener) {
        events.addChangeListener(listener);
    }

    public void removeChangeListener(MailSyncChangeListener listener) {
        events.removeChangeListener(listener);
    }

    /**
     * Forget cached settings of an account, for example after its password changed
     */
    public void invalidateAccount(String accountId) {
        accountSettings.invalidate(accountId);
    }

    public void invalidateAllAccounts() {
        accountSettings.invalidateAll();
    }

    public MailSyncConfiguration getConfiguration() {
        return configuration;
    }

    public MailStateStore getStore() {
        return store;
    }
}
