package com.intenovation.mailsync.imap;

import javax.mail.Flags;
import javax.mail.MessagingException;
import java.util.List;
import java.util.Optional;

/**
 * The IMAP capability surface the engine consumes. One instance is one
 * connection and has at most one folder selected at a time; instances are
 * not shared between threads.
 */
public interface ImapMailbox extends AutoCloseable {

    /**
     * List all folders that can hold messages
     */
    List<String> listFolders() throws MessagingException;

    /**
     * Select a folder
     *
     * @param folder The full folder name
     * @param readOnly true for scans, false when flags or contents will change
     * @return The folder and its UIDVALIDITY
     * @throws MessagingException If the folder does not exist or cannot be opened
     */
    SelectedFolder select(String folder, boolean readOnly) throws MessagingException;

    /**
     * All UIDs in the selected folder, ascending
     */
    long[] searchAll() throws MessagingException;

    /**
     * Fetch envelope and flags for a batch of UIDs of the selected folder.
     * UIDs that no longer exist are left out of the result.
     */
    List<FetchedEnvelope> fetchEnvelopes(long[] uids) throws MessagingException;

    /**
     * Fetch the complete RFC 822 source of a message of the selected folder
     *
     * @return The raw bytes, or empty if the UID does not exist
     */
    Optional<byte[]> fetchRawMessage(long uid) throws MessagingException;

    /**
     * Copy a message of the selected folder to another folder
     *
     * @param uid The message
     * @param targetFolder The destination folder
     * @return The copy response with whatever UID remap information the server gave
     * @throws MessagingException If the UID does not exist or the copy fails
     */
    CopyResponse copy(long uid, String targetFolder) throws MessagingException;

    /**
     * Set flags on a message of the selected folder
     *
     * @return false if the UID does not exist
     */
    boolean addFlags(long uid, Flags flags) throws MessagingException;

    /**
     * Clear flags on a message of the selected folder
     *
     * @return false if the UID does not exist
     */
    boolean removeFlags(long uid, Flags flags) throws MessagingException;

    /**
     * Permanently remove messages flagged \Deleted from the selected folder
     */
    void expunge() throws MessagingException;

    /**
     * Whether the server advertises THREAD with the given algorithm
     */
    boolean supportsThreading(String algorithm) throws MessagingException;

    /**
     * Run UID THREAD on the selected folder
     *
     * @param algorithm REFERENCES or ORDEREDSUBJECT
     * @return The raw THREAD response
     * @throws com.intenovation.mailsync.ProtocolCapabilityMissingException If THREAD is not supported
     */
    String thread(String algorithm) throws MessagingException;

    /**
     * Find the folder carrying the \Trash special-use attribute
     */
    Optional<String> findTrashFolder() throws MessagingException;

    @Override
    void close() throws MessagingException;
}
