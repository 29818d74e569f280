package com.intenovation.mailsync.store;

import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.ServerMailRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * A {@link MailStateStore} that keeps all state in memory.
 * <p>
 * Transactions work on private copies. On commit every folder whose mirror rows
 * were written, and every local record that was updated, is checked against the
 * version it had when the transaction first read it; a mismatch means a concurrent
 * writer got there first and the commit fails with a {@link ConcurrencyConflictException}.
 */
public class InMemoryMailStateStore implements MailStateStore {
    private static final Logger LOGGER = Logger.getLogger(InMemoryMailStateStore.class.getName());

    private final Map<String, AccountState> accounts = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();
    private final AtomicLong nextLocalId = new AtomicLong();

    @Override
    public MailStateTransaction begin(String accountId) throws StoreException {
        if (accountId == null || accountId.isEmpty()) {
            throw new StoreException("Account id must not be empty");
        }
        return new Transaction(accountId, state(accountId));
    }

    @Override
    public AccountLock lockAccount(String accountId, long timeout, TimeUnit unit)
            throws StoreException, InterruptedException {
        ReentrantLock lock = accountLocks.computeIfAbsent(accountId, id -> new ReentrantLock());
        if (!lock.tryLock(timeout, unit)) {
            throw new ConcurrencyConflictException("Account " + accountId + " is locked by another writer");
        }
        return lock::unlock;
    }

    /**
     * The ids of all accounts the store holds state for
     */
    public Set<String> getAccountIds() {
        return Collections.unmodifiableSet(new HashSet<>(accounts.keySet()));
    }

    /**
     * Load previously persisted state for an account. Used by subclasses while opening.
     */
    protected void restore(String accountId, Collection<ServerMailRecord> serverRecords,
                           Collection<LocalMailRecord> localRecords, Collection<FolderScan> folderScans) {
        AccountState state = state(accountId);
        synchronized (state) {
            for (ServerMailRecord record : serverRecords) {
                state.server.put(record.getKey(), record.copy());
            }
            for (LocalMailRecord record : localRecords) {
                state.local.put(record.getId(), record.copy());
                nextLocalId.accumulateAndGet(record.getId(), Math::max);
            }
            for (FolderScan scan : folderScans) {
                state.scans.put(scan.getFolder(), scan);
            }
        }
        LOGGER.fine("Restored account " + accountId + ": " + serverRecords.size() + " server records, "
                + localRecords.size() + " local records");
    }

    /**
     * Write committed changes to durable storage. Called while the account state is
     * locked and before the changes become visible; a failure aborts the commit.
     *
     * @param accountId The account
     * @param changes The folders, local records and scans written by the transaction
     * @throws StoreException If the changes cannot be written
     */
    protected void persist(String accountId, Changes changes) throws StoreException {
        // nothing to do for the in-memory store
    }

    private AccountState state(String accountId) {
        return accounts.computeIfAbsent(accountId, id -> new AccountState());
    }

    private static class AccountState {
        final TreeMap<MailKey, ServerMailRecord> server = new TreeMap<>();
        final TreeMap<Long, LocalMailRecord> local = new TreeMap<>();
        final Map<Long, Long> localVersions = new HashMap<>();
        final Map<String, Long> folderVersions = new HashMap<>();
        final TreeMap<String, FolderScan> scans = new TreeMap<>();
    }

    /**
     * The set of changes a transaction commits
     */
    public static class Changes {
        private final Map<String, List<ServerMailRecord>> folders;
        private final List<LocalMailRecord> localRecords;
        private final List<FolderScan> folderScans;

        Changes(Map<String, List<ServerMailRecord>> folders, List<LocalMailRecord> localRecords,
                List<FolderScan> folderScans) {
            this.folders = folders;
            this.localRecords = localRecords;
            this.folderScans = folderScans;
        }

        /**
         * The complete new mirror content of every folder that was written
         */
        public Map<String, List<ServerMailRecord>> getFolders() {
            return folders;
        }

        public List<LocalMailRecord> getLocalRecords() {
            return localRecords;
        }

        public List<FolderScan> getFolderScans() {
            return folderScans;
        }

        public boolean isEmpty() {
            return folders.isEmpty() && localRecords.isEmpty() && folderScans.isEmpty();
        }
    }

    private class Transaction implements MailStateTransaction {
        private final String accountId;
        private final AccountState state;
        private final Map<String, TreeMap<MailKey, ServerMailRecord>> folders = new TreeMap<>();
        private final Map<String, Long> folderBaseVersions = new HashMap<>();
        private final TreeMap<Long, LocalMailRecord> locals = new TreeMap<>();
        private final Map<Long, Long> localBaseVersions = new HashMap<>();
        private final Set<Long> inserted = new HashSet<>();
        private final Map<String, FolderScan> scans = new TreeMap<>();
        private boolean finished;

        Transaction(String accountId, AccountState state) {
            this.accountId = accountId;
            this.state = state;
        }

        @Override
        public String getAccountId() {
            return accountId;
        }

        @Override
        public List<ServerMailRecord> serverRecords() {
            checkOpen();
            List<ServerMailRecord> result = new ArrayList<>();
            synchronized (state) {
                for (ServerMailRecord row : state.server.values()) {
                    if (!folders.containsKey(row.getFolder())) {
                        result.add(row.copy());
                    }
                }
            }
            for (TreeMap<MailKey, ServerMailRecord> rows : folders.values()) {
                for (ServerMailRecord row : rows.values()) {
                    result.add(row.copy());
                }
            }
            result.sort((a, b) -> a.getKey().compareTo(b.getKey()));
            return result;
        }

        @Override
        public List<ServerMailRecord> serverRecords(String folder) {
            checkOpen();
            List<ServerMailRecord> result = new ArrayList<>();
            TreeMap<MailKey, ServerMailRecord> rows = folders.get(folder);
            if (rows != null) {
                for (ServerMailRecord row : rows.values()) {
                    result.add(row.copy());
                }
                return result;
            }
            synchronized (state) {
                for (ServerMailRecord row : state.server.values()) {
                    if (row.getFolder().equals(folder)) {
                        result.add(row.copy());
                    }
                }
            }
            return result;
        }

        @Override
        public int deleteServerRecords(String folder) {
            checkOpen();
            TreeMap<MailKey, ServerMailRecord> rows = touchFolder(folder);
            int removed = rows.size();
            rows.clear();
            return removed;
        }

        @Override
        public void insertServerRecord(ServerMailRecord record) throws ConcurrencyConflictException {
            checkOpen();
            checkAccount(record.getKey().getAccountId());
            TreeMap<MailKey, ServerMailRecord> rows = touchFolder(record.getFolder());
            if (rows.containsKey(record.getKey())) {
                throw new ConcurrencyConflictException("Duplicate server record " + record.getKey());
            }
            rows.put(record.getKey(), record.copy());
        }

        @Override
        public void linkServerRecord(MailKey key, Long localId) throws StoreException {
            checkOpen();
            TreeMap<MailKey, ServerMailRecord> rows = touchFolder(key.getFolder());
            ServerMailRecord row = rows.get(key);
            if (row == null) {
                throw new StoreException("No server record " + key);
            }
            row.setLinkedLocalId(localId);
        }

        @Override
        public List<LocalMailRecord> localRecords(boolean includeDeleted) {
            checkOpen();
            TreeMap<Long, LocalMailRecord> view = new TreeMap<>();
            synchronized (state) {
                for (LocalMailRecord record : state.local.values()) {
                    if (!locals.containsKey(record.getId())) {
                        view.put(record.getId(), record.copy());
                        localBaseVersions.putIfAbsent(record.getId(), localVersion(record.getId()));
                    }
                }
            }
            for (LocalMailRecord record : locals.values()) {
                view.put(record.getId(), record.copy());
            }
            return view.values().stream()
                    .filter(r -> includeDeleted || !r.isSoftDeleted())
                    .collect(Collectors.toList());
        }

        @Override
        public Optional<LocalMailRecord> findLocal(long id) {
            checkOpen();
            LocalMailRecord own = locals.get(id);
            if (own != null) {
                return Optional.of(own.copy());
            }
            synchronized (state) {
                LocalMailRecord record = state.local.get(id);
                if (record == null) {
                    return Optional.empty();
                }
                localBaseVersions.putIfAbsent(id, localVersion(id));
                return Optional.of(record.copy());
            }
        }

        @Override
        public Optional<LocalMailRecord> findLocal(MailKey key) {
            return localRecords(false).stream()
                    .filter(r -> r.getKey().equals(key))
                    .findFirst();
        }

        @Override
        public List<LocalMailRecord> findLocalByIdentity(String stableIdentity) {
            return localRecords(false).stream()
                    .filter(r -> r.getStableIdentity().equals(stableIdentity))
                    .collect(Collectors.toList());
        }

        @Override
        public long insertLocal(LocalMailRecord record) throws ConcurrencyConflictException {
            checkOpen();
            checkAccount(record.getAccountId());
            if (!record.isSoftDeleted() && findLocal(record.getKey()).isPresent()) {
                throw new ConcurrencyConflictException("Local record already exists at " + record.getKey());
            }
            long id = nextLocalId.incrementAndGet();
            record.setId(id);
            locals.put(id, record.copy());
            inserted.add(id);
            return id;
        }

        @Override
        public void updateLocal(LocalMailRecord record) throws StoreException {
            checkOpen();
            long id = record.getId();
            if (!locals.containsKey(id)) {
                synchronized (state) {
                    if (!state.local.containsKey(id)) {
                        throw new StoreException("No local record " + id);
                    }
                    localBaseVersions.putIfAbsent(id, localVersion(id));
                }
            }
            locals.put(id, record.copy());
        }

        @Override
        public void recordFolderScan(FolderScan scan) {
            checkOpen();
            scans.put(scan.getFolder(), scan);
        }

        @Override
        public Optional<FolderScan> folderScan(String folder) {
            checkOpen();
            FolderScan own = scans.get(folder);
            if (own != null) {
                return Optional.of(own);
            }
            synchronized (state) {
                return Optional.ofNullable(state.scans.get(folder));
            }
        }

        @Override
        public List<FolderScan> folderScans() {
            checkOpen();
            TreeMap<String, FolderScan> view;
            synchronized (state) {
                view = new TreeMap<>(state.scans);
            }
            view.putAll(scans);
            return new ArrayList<>(view.values());
        }

        @Override
        public void commit() throws StoreException {
            checkOpen();
            synchronized (state) {
                for (Map.Entry<String, Long> entry : folderBaseVersions.entrySet()) {
                    long current = state.folderVersions.getOrDefault(entry.getKey(), 0L);
                    if (current != entry.getValue()) {
                        throw new ConcurrencyConflictException("Folder " + entry.getKey()
                                + " of account " + accountId + " was changed by a concurrent writer");
                    }
                }
                for (Long id : locals.keySet()) {
                    if (inserted.contains(id)) {
                        continue;
                    }
                    Long base = localBaseVersions.get(id);
                    if (base == null || base != localVersion(id)) {
                        throw new ConcurrencyConflictException("Local record " + id
                                + " was changed by a concurrent writer");
                    }
                }
                checkLocalKeys();

                Map<String, List<ServerMailRecord>> folderChanges = new TreeMap<>();
                for (Map.Entry<String, TreeMap<MailKey, ServerMailRecord>> entry : folders.entrySet()) {
                    folderChanges.put(entry.getKey(), new ArrayList<>(entry.getValue().values()));
                }
                Changes changes = new Changes(folderChanges, new ArrayList<>(locals.values()),
                        new ArrayList<>(scans.values()));
                if (!changes.isEmpty()) {
                    persist(accountId, changes);
                }

                for (Map.Entry<String, TreeMap<MailKey, ServerMailRecord>> entry : folders.entrySet()) {
                    String folder = entry.getKey();
                    state.server.keySet().removeIf(key -> key.getFolder().equals(folder));
                    for (ServerMailRecord row : entry.getValue().values()) {
                        state.server.put(row.getKey(), row.copy());
                    }
                    state.folderVersions.merge(folder, 1L, Long::sum);
                }
                for (LocalMailRecord record : locals.values()) {
                    state.local.put(record.getId(), record.copy());
                    state.localVersions.merge(record.getId(), 1L, Long::sum);
                }
                state.scans.putAll(scans);
            }
            finished = true;
        }

        @Override
        public void rollback() {
            if (finished) {
                return;
            }
            folders.clear();
            locals.clear();
            inserted.clear();
            scans.clear();
            finished = true;
        }

        @Override
        public void close() {
            if (!finished) {
                rollback();
            }
        }

        private TreeMap<MailKey, ServerMailRecord> touchFolder(String folder) {
            TreeMap<MailKey, ServerMailRecord> rows = folders.get(folder);
            if (rows == null) {
                rows = new TreeMap<>();
                synchronized (state) {
                    for (ServerMailRecord row : state.server.values()) {
                        if (row.getFolder().equals(folder)) {
                            rows.put(row.getKey(), row.copy());
                        }
                    }
                    folderBaseVersions.put(folder, state.folderVersions.getOrDefault(folder, 0L));
                }
                folders.put(folder, rows);
            }
            return rows;
        }

        // caller holds the state lock
        private void checkLocalKeys() throws ConcurrencyConflictException {
            Map<MailKey, Long> owners = new HashMap<>();
            for (LocalMailRecord record : state.local.values()) {
                if (!locals.containsKey(record.getId()) && !record.isSoftDeleted()) {
                    owners.put(record.getKey(), record.getId());
                }
            }
            for (LocalMailRecord record : locals.values()) {
                if (record.isSoftDeleted()) {
                    continue;
                }
                Long owner = owners.putIfAbsent(record.getKey(), record.getId());
                if (owner != null && owner != record.getId()) {
                    throw new ConcurrencyConflictException("Local records " + owner + " and " + record.getId()
                            + " both hold " + record.getKey());
                }
            }
        }

        // caller holds the state lock
        private long localVersion(long id) {
            return state.localVersions.getOrDefault(id, 0L);
        }

        private void checkAccount(String recordAccountId) {
            if (!accountId.equals(recordAccountId)) {
                throw new IllegalArgumentException("Record of account " + recordAccountId
                        + " does not belong to transaction of account " + accountId);
            }
        }

        private void checkOpen() {
            if (finished) {
                throw new IllegalStateException("Transaction for account " + accountId + " is already finished");
            }
        }
    }
}
