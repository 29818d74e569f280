package com.intenovation.mailsync.store;

import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.ServerMailRecord;

import java.util.List;
import java.util.Optional;

/**
 * A unit of work against the state of one account.
 * <p>
 * Records returned from a transaction are copies; changes to them only take
 * effect through the update methods. Lists are ordered by (folder, UIDVALIDITY, UID)
 * for server records and by id for local records. Closing a transaction that was
 * not committed rolls it back.
 */
public interface MailStateTransaction extends AutoCloseable {

    String getAccountId();

    // Server mirror

    List<ServerMailRecord> serverRecords();

    List<ServerMailRecord> serverRecords(String folder);

    /**
     * Remove every mirror row of a folder
     *
     * @return The number of rows removed
     */
    int deleteServerRecords(String folder);

    /**
     * Insert a mirror row
     *
     * @throws ConcurrencyConflictException If a row with the same key exists
     */
    void insertServerRecord(ServerMailRecord record) throws ConcurrencyConflictException;

    /**
     * Point a mirror row at a local record
     *
     * @param key The mirror row
     * @param localId The local record id, or null to clear the link
     * @throws StoreException If no such row exists
     */
    void linkServerRecord(MailKey key, Long localId) throws StoreException;

    // Local records

    List<LocalMailRecord> localRecords(boolean includeDeleted);

    Optional<LocalMailRecord> findLocal(long id);

    /**
     * Find the non-deleted local record at a key
     */
    Optional<LocalMailRecord> findLocal(MailKey key);

    /**
     * Find all non-deleted local records with a stable identity
     */
    List<LocalMailRecord> findLocalByIdentity(String stableIdentity);

    /**
     * Insert a new local record and assign its id
     *
     * @return The assigned id
     * @throws ConcurrencyConflictException If a non-deleted record already holds the key
     */
    long insertLocal(LocalMailRecord record) throws ConcurrencyConflictException;

    /**
     * Replace a local record with the given state
     *
     * @throws StoreException If the record does not exist
     */
    void updateLocal(LocalMailRecord record) throws StoreException;

    // Folder scans

    void recordFolderScan(FolderScan scan);

    Optional<FolderScan> folderScan(String folder);

    List<FolderScan> folderScans();

    // Lifecycle

    void commit() throws StoreException;

    void rollback();

    @Override
    void close();
}
