package com.intenovation.mailsync.store;

import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailFlags;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.ServerMailRecord;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link MailStateStore} that persists every committed change as properties files.
 * <p>
 * Layout below the base directory:
 * <pre>
 * &lt;account&gt;/account.properties
 * &lt;account&gt;/folders/&lt;folder&gt;.properties   mirror rows of one folder
 * &lt;account&gt;/scans/&lt;folder&gt;.properties     last scan of one folder
 * &lt;account&gt;/messages/&lt;id&gt;.properties      one local record
 * &lt;account&gt;/.lock                           held while an account writer is active
 * </pre>
 * Names are URL encoded so that any folder name maps to exactly one file.
 * <p>
 * A commit first writes every file it touches next to its target with a
 * {@code .tmp} suffix. Only when all of them are written is
 * {@code commit.journal} put in place, listing the staged files; from then on
 * the commit counts as done and the staged files are moved over their targets.
 * A journal left behind by a crash is completed when the store is opened again,
 * and staged files without a journal are discarded.
 */
public class FileMailStateStore extends InMemoryMailStateStore {
    private static final Logger LOGGER = Logger.getLogger(FileMailStateStore.class.getName());

    // File name constants
    public static final String FILE_ACCOUNT_PROPERTIES = "account.properties";
    public static final String FILE_LOCK = ".lock";
    public static final String FILE_COMMIT_JOURNAL = "commit.journal";
    public static final String DIR_FOLDERS = "folders";
    public static final String DIR_SCANS = "scans";
    public static final String DIR_MESSAGES = "messages";

    // Property key constants
    public static final String PROP_ACCOUNT_ID = "account.id";
    public static final String PROP_FOLDER_NAME = "folder.name";
    public static final String PROP_ROW_COUNT = "row.count";
    public static final String PROP_UID_VALIDITY = "uid.validity";
    public static final String PROP_UID = "uid";
    public static final String PROP_MESSAGE_ID = "message.id";
    public static final String PROP_IN_REPLY_TO = "in.reply.to";
    public static final String PROP_CONTENT_HASH = "content.hash";
    public static final String PROP_FLAGS = "flags";
    public static final String PROP_FROM = "from";
    public static final String PROP_SUBJECT = "subject";
    public static final String PROP_SENT_DATE = "sent.date";
    public static final String PROP_FIRST_SEEN = "first.seen";
    public static final String PROP_LAST_SEEN = "last.seen";
    public static final String PROP_DELETED = "deleted";
    public static final String PROP_LINKED_LOCAL_ID = "linked.local.id";
    public static final String PROP_SCANNED_AT = "scanned.at";
    public static final String PROP_LOCAL_ID = "local.id";
    public static final String PROP_FLAG_SEEN = "flag.seen";
    public static final String PROP_FLAG_ANSWERED = "flag.answered";
    public static final String PROP_FLAG_FLAGGED = "flag.flagged";
    public static final String PROP_FLAG_DELETED = "flag.deleted";
    public static final String PROP_FLAG_DRAFT = "flag.draft";
    public static final String PROP_RECEIVED_DATE = "received.date";
    public static final String PROP_DELETED_DATE = "deleted.date";
    public static final String PROP_PAYLOAD_PREFIX = "payload.";
    public static final String PROP_THREAD_ID = "thread.id";
    public static final String PROP_PARENT_LOCAL_ID = "parent.local.id";
    public static final String PROP_FILE_COUNT = "file.count";
    public static final String PROP_FILE_PREFIX = "file.";

    private static final String DATE_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSZ";
    private static final long LOCK_POLL_MS = 50;
    private static final String TEMP_SUFFIX = ".tmp";

    private final File baseDirectory;
    private final Map<String, HeldFileLock> heldFileLocks = new ConcurrentHashMap<>();

    /**
     * Open a store, loading any state found in the directory
     *
     * @param baseDirectory The directory holding one subdirectory per account
     * @throws StoreException If the directory cannot be created or read
     */
    public FileMailStateStore(File baseDirectory) throws StoreException {
        this.baseDirectory = baseDirectory;
        if (!baseDirectory.exists() && !baseDirectory.mkdirs()) {
            throw new StoreException("Could not create store directory " + baseDirectory);
        }
        load();
    }

    public File getBaseDirectory() {
        return baseDirectory;
    }

    @Override
    public AccountLock lockAccount(String accountId, long timeout, TimeUnit unit)
            throws StoreException, InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        AccountLock memoryLock = super.lockAccount(accountId, timeout, unit);
        if (heldFileLocks.containsKey(accountId)) {
            // re-entered by the thread that already holds the file lock
            return memoryLock;
        }

        FileChannel channel = null;
        try {
            File accountDir = accountDirectory(accountId);
            ensureDirectory(accountDir);
            channel = FileChannel.open(new File(accountDir, FILE_LOCK).toPath(),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock;
            while ((fileLock = tryLock(channel)) == null) {
                if (System.nanoTime() >= deadline) {
                    throw new ConcurrencyConflictException("Account " + accountId + " is locked by another process");
                }
                Thread.sleep(LOCK_POLL_MS);
            }
            HeldFileLock held = new HeldFileLock(channel, fileLock);
            heldFileLocks.put(accountId, held);
            return () -> {
                heldFileLocks.remove(accountId);
                held.release();
                memoryLock.close();
            };
        } catch (IOException e) {
            closeQuietly(channel);
            memoryLock.close();
            throw new StoreException("Could not lock account " + accountId, e);
        } catch (StoreException | InterruptedException | RuntimeException e) {
            closeQuietly(channel);
            memoryLock.close();
            throw e;
        }
    }

    @Override
    protected void persist(String accountId, Changes changes) throws StoreException {
        File accountDir = accountDirectory(accountId);
        List<File> staged = new ArrayList<>();
        try {
            ensureDirectory(accountDir);
            completeCommit(accountDir);

            File accountFile = new File(accountDir, FILE_ACCOUNT_PROPERTIES);
            if (!accountFile.exists()) {
                Properties props = new Properties();
                props.setProperty(PROP_ACCOUNT_ID, accountId);
                stage(accountFile, props, "Mail Sync Account", staged);
            }
            for (Map.Entry<String, List<ServerMailRecord>> entry : changes.getFolders().entrySet()) {
                File folderFile = new File(new File(accountDir, DIR_FOLDERS), encodeName(entry.getKey()) + ".properties");
                stage(folderFile, folderToProperties(entry.getKey(), entry.getValue()), "Server Mirror", staged);
            }
            for (FolderScan scan : changes.getFolderScans()) {
                File scanFile = new File(new File(accountDir, DIR_SCANS), encodeName(scan.getFolder()) + ".properties");
                stage(scanFile, scanToProperties(scan), "Folder Scan", staged);
            }
            for (LocalMailRecord record : changes.getLocalRecords()) {
                File messageFile = new File(new File(accountDir, DIR_MESSAGES), record.getId() + ".properties");
                stage(messageFile, localToProperties(record), "Mail Message Properties", staged);
            }
            writeJournal(accountDir, staged);
        } catch (IOException e) {
            discard(staged);
            throw new StoreException("Could not write state of account " + accountId, e);
        }

        try {
            completeCommit(accountDir);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Commit of account " + accountId + " is journaled but not in place yet, "
                    + "it is completed by the next write or when the store is opened", e);
        }
        LOGGER.fine("Persisted " + changes.getFolders().size() + " folders and "
                + changes.getLocalRecords().size() + " local records for account " + accountId);
    }

    /**
     * Move the files of a journaled commit into place and remove the journal.
     * Safe to repeat: a staged file that is already gone was moved before.
     */
    private static void completeCommit(File accountDir) throws IOException {
        File journal = new File(accountDir, FILE_COMMIT_JOURNAL);
        if (!journal.exists()) {
            return;
        }
        Properties props = readProperties(journal);
        int count = Integer.parseInt(props.getProperty(PROP_FILE_COUNT, "0"));
        for (int i = 0; i < count; i++) {
            File target = new File(accountDir, props.getProperty(PROP_FILE_PREFIX + i));
            File temp = tempFile(target);
            if (temp.isFile()) {
                Files.move(temp.toPath(), target.toPath(),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
        }
        Files.delete(journal.toPath());
        LOGGER.fine("Completed commit of " + count + " files in " + accountDir);
    }

    private static void writeJournal(File accountDir, List<File> staged) throws IOException {
        Properties props = new Properties();
        props.setProperty(PROP_FILE_COUNT, String.valueOf(staged.size()));
        for (int i = 0; i < staged.size(); i++) {
            props.setProperty(PROP_FILE_PREFIX + i,
                    accountDir.toPath().relativize(staged.get(i).toPath()).toString());
        }
        File journal = new File(accountDir, FILE_COMMIT_JOURNAL);
        File temp = tempFile(journal);
        try (FileOutputStream fos = new FileOutputStream(temp)) {
            props.store(fos, "Commit Journal");
        }
        Files.move(temp.toPath(), journal.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static void discard(List<File> staged) {
        for (File file : staged) {
            File temp = tempFile(file);
            if (temp.isFile() && !temp.delete()) {
                LOGGER.warning("Could not remove staged file " + temp);
            }
        }
    }

    /**
     * Remove staged files that no journal refers to, left by a commit that never completed
     */
    private static void discardStaleFiles(File accountDir) {
        List<File> dirs = new ArrayList<>();
        dirs.add(accountDir);
        dirs.add(new File(accountDir, DIR_FOLDERS));
        dirs.add(new File(accountDir, DIR_SCANS));
        dirs.add(new File(accountDir, DIR_MESSAGES));
        for (File dir : dirs) {
            File[] stale = dir.listFiles((d, name) -> name.endsWith(TEMP_SUFFIX));
            if (stale == null) {
                continue;
            }
            for (File file : stale) {
                if (file.isFile()) {
                    LOGGER.info("Discarding uncommitted file " + file);
                    if (!file.delete()) {
                        LOGGER.warning("Could not remove uncommitted file " + file);
                    }
                }
            }
        }
    }

    private void load() throws StoreException {
        File[] accountDirs = baseDirectory.listFiles(File::isDirectory);
        if (accountDirs == null) {
            return;
        }
        for (File accountDir : accountDirs) {
            try {
                completeCommit(accountDir);
            } catch (IOException | RuntimeException e) {
                throw new StoreException("Could not complete journaled commit in " + accountDir, e);
            }
            discardStaleFiles(accountDir);

            File accountFile = new File(accountDir, FILE_ACCOUNT_PROPERTIES);
            if (!accountFile.exists()) {
                LOGGER.warning("Skipping directory without account properties: " + accountDir);
                continue;
            }
            try {
                String accountId = readProperties(accountFile).getProperty(PROP_ACCOUNT_ID);
                List<ServerMailRecord> serverRecords = new ArrayList<>();
                for (File file : propertiesFiles(new File(accountDir, DIR_FOLDERS))) {
                    serverRecords.addAll(folderFromProperties(accountId, readProperties(file)));
                }
                List<FolderScan> scans = new ArrayList<>();
                for (File file : propertiesFiles(new File(accountDir, DIR_SCANS))) {
                    scans.add(scanFromProperties(readProperties(file)));
                }
                List<LocalMailRecord> localRecords = new ArrayList<>();
                for (File file : propertiesFiles(new File(accountDir, DIR_MESSAGES))) {
                    localRecords.add(localFromProperties(accountId, readProperties(file)));
                }
                restore(accountId, serverRecords, localRecords, scans);
                LOGGER.info("Loaded account " + accountId + " from " + accountDir);
            } catch (IOException | RuntimeException e) {
                throw new StoreException("Could not load state from " + accountDir, e);
            }
        }
    }

    private File accountDirectory(String accountId) {
        return new File(baseDirectory, encodeName(accountId));
    }

    // Server rows

    private static Properties folderToProperties(String folder, List<ServerMailRecord> rows) {
        Properties props = new Properties();
        props.setProperty(PROP_FOLDER_NAME, folder);
        props.setProperty(PROP_ROW_COUNT, String.valueOf(rows.size()));
        for (int i = 0; i < rows.size(); i++) {
            ServerMailRecord row = rows.get(i);
            String prefix = "row." + i + ".";
            props.setProperty(prefix + PROP_UID_VALIDITY, String.valueOf(row.getUidValidity()));
            props.setProperty(prefix + PROP_UID, String.valueOf(row.getUid()));
            setIfPresent(props, prefix + PROP_MESSAGE_ID, row.getMessageId());
            setIfPresent(props, prefix + PROP_IN_REPLY_TO, row.getInReplyTo());
            setIfPresent(props, prefix + PROP_CONTENT_HASH, row.getContentHash());
            props.setProperty(prefix + PROP_FLAGS, row.getFlags());
            setIfPresent(props, prefix + PROP_FROM, row.getEnvelopeFrom());
            setIfPresent(props, prefix + PROP_SUBJECT, row.getEnvelopeSubject());
            setIfPresent(props, prefix + PROP_SENT_DATE, formatDate(row.getEnvelopeDate()));
            setIfPresent(props, prefix + PROP_FIRST_SEEN, formatDate(row.getFirstSeenAt()));
            setIfPresent(props, prefix + PROP_LAST_SEEN, formatDate(row.getLastSeenAt()));
            props.setProperty(prefix + PROP_DELETED, String.valueOf(row.isDeleted()));
            if (row.getLinkedLocalId() != null) {
                props.setProperty(prefix + PROP_LINKED_LOCAL_ID, String.valueOf(row.getLinkedLocalId()));
            }
        }
        return props;
    }

    private static List<ServerMailRecord> folderFromProperties(String accountId, Properties props) {
        String folder = props.getProperty(PROP_FOLDER_NAME);
        int count = Integer.parseInt(props.getProperty(PROP_ROW_COUNT, "0"));
        List<ServerMailRecord> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String prefix = "row." + i + ".";
            MailKey key = new MailKey(accountId, folder,
                    Long.parseLong(props.getProperty(prefix + PROP_UID_VALIDITY)),
                    Long.parseLong(props.getProperty(prefix + PROP_UID)));
            String linked = props.getProperty(prefix + PROP_LINKED_LOCAL_ID);
            rows.add(new ServerMailRecord(key,
                    props.getProperty(prefix + PROP_MESSAGE_ID),
                    props.getProperty(prefix + PROP_IN_REPLY_TO),
                    props.getProperty(prefix + PROP_CONTENT_HASH),
                    props.getProperty(prefix + PROP_FLAGS, ""),
                    props.getProperty(prefix + PROP_FROM),
                    props.getProperty(prefix + PROP_SUBJECT),
                    parseDate(props.getProperty(prefix + PROP_SENT_DATE)),
                    parseDate(props.getProperty(prefix + PROP_FIRST_SEEN)),
                    parseDate(props.getProperty(prefix + PROP_LAST_SEEN)),
                    Boolean.parseBoolean(props.getProperty(prefix + PROP_DELETED)),
                    linked != null ? Long.valueOf(linked) : null));
        }
        return rows;
    }

    // Folder scans

    private static Properties scanToProperties(FolderScan scan) {
        Properties props = new Properties();
        props.setProperty(PROP_FOLDER_NAME, scan.getFolder());
        props.setProperty(PROP_UID_VALIDITY, String.valueOf(scan.getUidValidity()));
        props.setProperty(PROP_SCANNED_AT, formatDate(scan.getScannedAt()));
        return props;
    }

    private static FolderScan scanFromProperties(Properties props) {
        return new FolderScan(props.getProperty(PROP_FOLDER_NAME),
                Long.parseLong(props.getProperty(PROP_UID_VALIDITY)),
                parseDate(props.getProperty(PROP_SCANNED_AT)));
    }

    // Local records

    private static Properties localToProperties(LocalMailRecord record) {
        Properties props = new Properties();
        props.setProperty(PROP_LOCAL_ID, String.valueOf(record.getId()));
        props.setProperty(PROP_FOLDER_NAME, record.getFolder());
        props.setProperty(PROP_UID_VALIDITY, String.valueOf(record.getUidValidity()));
        props.setProperty(PROP_UID, String.valueOf(record.getUid()));
        setIfPresent(props, PROP_MESSAGE_ID, record.getMessageId());
        setIfPresent(props, PROP_IN_REPLY_TO, record.getInReplyTo());
        setIfPresent(props, PROP_CONTENT_HASH, record.getContentHash());
        props.setProperty(PROP_FLAG_SEEN, String.valueOf(record.getFlags().isSeen()));
        props.setProperty(PROP_FLAG_ANSWERED, String.valueOf(record.getFlags().isAnswered()));
        props.setProperty(PROP_FLAG_FLAGGED, String.valueOf(record.getFlags().isFlagged()));
        props.setProperty(PROP_FLAG_DELETED, String.valueOf(record.getFlags().isDeleted()));
        props.setProperty(PROP_FLAG_DRAFT, String.valueOf(record.getFlags().isDraft()));
        setIfPresent(props, PROP_RECEIVED_DATE, formatDate(record.getReceivedAt()));
        setIfPresent(props, PROP_DELETED_DATE, formatDate(record.getDeletedAt()));
        setIfPresent(props, PROP_THREAD_ID, record.getThreadId());
        if (record.getParentLocalId() != null) {
            props.setProperty(PROP_PARENT_LOCAL_ID, String.valueOf(record.getParentLocalId()));
        }
        for (Map.Entry<String, String> entry : record.getPayload().entrySet()) {
            props.setProperty(PROP_PAYLOAD_PREFIX + entry.getKey(), entry.getValue());
        }
        return props;
    }

    private static LocalMailRecord localFromProperties(String accountId, Properties props) {
        Map<String, String> payload = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(PROP_PAYLOAD_PREFIX)) {
                payload.put(name.substring(PROP_PAYLOAD_PREFIX.length()), props.getProperty(name));
            }
        }
        LocalMailRecord record = new LocalMailRecord(accountId,
                props.getProperty(PROP_FOLDER_NAME),
                Long.parseLong(props.getProperty(PROP_UID_VALIDITY)),
                Long.parseLong(props.getProperty(PROP_UID)),
                props.getProperty(PROP_MESSAGE_ID),
                props.getProperty(PROP_IN_REPLY_TO),
                props.getProperty(PROP_CONTENT_HASH),
                payload,
                parseDate(props.getProperty(PROP_RECEIVED_DATE)));
        record.setId(Long.parseLong(props.getProperty(PROP_LOCAL_ID)));
        record.setFlags(new MailFlags(
                Boolean.parseBoolean(props.getProperty(PROP_FLAG_SEEN)),
                Boolean.parseBoolean(props.getProperty(PROP_FLAG_ANSWERED)),
                Boolean.parseBoolean(props.getProperty(PROP_FLAG_FLAGGED)),
                Boolean.parseBoolean(props.getProperty(PROP_FLAG_DELETED)),
                Boolean.parseBoolean(props.getProperty(PROP_FLAG_DRAFT))));
        String parent = props.getProperty(PROP_PARENT_LOCAL_ID);
        record.assignThread(props.getProperty(PROP_THREAD_ID), parent != null ? Long.valueOf(parent) : null);
        Date deletedAt = parseDate(props.getProperty(PROP_DELETED_DATE));
        if (deletedAt != null) {
            record.markDeleted(deletedAt);
        }
        return record;
    }

    // Helpers

    static String encodeName(String name) {
        try {
            return URLEncoder.encode(name, StandardCharsets.UTF_8.name()).replace("*", "%2A");
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException("UTF-8 not supported", e);
        }
    }

    private static void setIfPresent(Properties props, String key, String value) {
        if (value != null) {
            props.setProperty(key, value);
        }
    }

    private static String formatDate(Date date) {
        return date != null ? new SimpleDateFormat(DATE_PATTERN).format(date) : null;
    }

    private static Date parseDate(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return new SimpleDateFormat(DATE_PATTERN).parse(value);
        } catch (ParseException e) {
            LOGGER.log(Level.WARNING, "Error parsing date: " + value, e);
            return null;
        }
    }

    private static List<File> propertiesFiles(File dir) {
        List<File> result = new ArrayList<>();
        File[] files = dir.listFiles((d, name) -> name.endsWith(".properties"));
        if (files != null) {
            for (File file : files) {
                result.add(file);
            }
        }
        return result;
    }

    private static Properties readProperties(File file) throws IOException {
        Properties props = new Properties();
        try (FileInputStream fis = new FileInputStream(file)) {
            props.load(fis);
        }
        return props;
    }

    private static void stage(File file, Properties props, String comment, List<File> staged) throws IOException {
        ensureDirectory(file.getParentFile());
        try (FileOutputStream fos = new FileOutputStream(tempFile(file))) {
            staged.add(file);
            props.store(fos, comment);
        }
    }

    private static File tempFile(File file) {
        return new File(file.getParentFile(), file.getName() + TEMP_SUFFIX);
    }

    private static void ensureDirectory(File dir) throws IOException {
        if (!dir.exists() && !dir.mkdirs() && !dir.isDirectory()) {
            throw new IOException("Could not create directory " + dir);
        }
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // held by another store instance in this JVM
            return null;
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error closing lock file", e);
        }
    }

    private static class HeldFileLock {
        private final FileChannel channel;
        private final FileLock lock;

        HeldFileLock(FileChannel channel, FileLock lock) {
            this.channel = channel;
            this.lock = lock;
        }

        void release() {
            try {
                lock.release();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Error releasing account lock", e);
            }
            closeQuietly(channel);
        }
    }
}
