package com.intenovation.mailsync;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration options for the synchronization engine
 */
public class MailSyncConfiguration {
    private static final Logger LOGGER = Logger.getLogger(MailSyncConfiguration.class.getName());

    public static final String RESOURCE_NAME = "mailsync.properties";

    public static final String KEY_FETCH_BATCH_SIZE = "mailsync.fetch.batch-size";
    public static final String KEY_FOLDER_WORKERS = "mailsync.folder.workers";
    public static final String KEY_FETCH_PARALLELISM = "mailsync.fetch.parallelism";
    public static final String KEY_OPERATION_TIMEOUT_MS = "mailsync.operation.timeout-ms";
    public static final String KEY_RECONCILE_LOCK_TIMEOUT_MS = "mailsync.reconcile.lock-timeout-ms";
    public static final String KEY_THREAD_USE_SERVER = "mailsync.thread.use-server";
    public static final String KEY_THREAD_ALGORITHM = "mailsync.thread.algorithm";
    public static final String KEY_SYNC_FLAGS = "mailsync.sync-flags";
    public static final String KEY_STORE_DIRECTORY = "mailsync.store.directory";

    private int fetchBatchSize = 500;
    private int folderWorkers = 4;
    private int fetchParallelism = 4;
    private long operationTimeoutMs = 60000;
    private long reconcileLockTimeoutMs = 5000;
    private boolean useServerThreading = true;
    private String threadAlgorithm = "REFERENCES";
    private boolean syncFlags = true;
    private File storeDirectory;

    /**
     * Create a new configuration with default values
     */
    public MailSyncConfiguration() {
        // Default values are set in field initializers
    }

    /**
     * Load the configuration from {@value #RESOURCE_NAME} on the classpath,
     * falling back to the defaults if the resource is absent
     *
     * @return The configuration
     */
    public static MailSyncConfiguration load() {
        Properties props = new Properties();
        try (InputStream in = MailSyncConfiguration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            } else {
                LOGGER.fine(RESOURCE_NAME + " not found, using defaults");
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error reading " + RESOURCE_NAME + ", using defaults", e);
        }
        return fromProperties(props);
    }

    /**
     * Build a configuration from properties. Missing keys keep their defaults.
     *
     * @param props The properties
     * @return The configuration
     * @throws IllegalArgumentException If a value cannot be parsed or is out of range
     */
    public static MailSyncConfiguration fromProperties(Properties props) {
        MailSyncConfiguration config = new MailSyncConfiguration();
        String value;
        if ((value = get(props, KEY_FETCH_BATCH_SIZE)) != null) {
            config.setFetchBatchSize(parseInt(KEY_FETCH_BATCH_SIZE, value));
        }
        if ((value = get(props, KEY_FOLDER_WORKERS)) != null) {
            config.setFolderWorkers(parseInt(KEY_FOLDER_WORKERS, value));
        }
        if ((value = get(props, KEY_FETCH_PARALLELISM)) != null) {
            config.setFetchParallelism(parseInt(KEY_FETCH_PARALLELISM, value));
        }
        if ((value = get(props, KEY_OPERATION_TIMEOUT_MS)) != null) {
            config.setOperationTimeoutMs(parseLong(KEY_OPERATION_TIMEOUT_MS, value));
        }
        if ((value = get(props, KEY_RECONCILE_LOCK_TIMEOUT_MS)) != null) {
            config.setReconcileLockTimeoutMs(parseLong(KEY_RECONCILE_LOCK_TIMEOUT_MS, value));
        }
        if ((value = get(props, KEY_THREAD_USE_SERVER)) != null) {
            config.setUseServerThreading(Boolean.parseBoolean(value));
        }
        if ((value = get(props, KEY_THREAD_ALGORITHM)) != null) {
            config.setThreadAlgorithm(value);
        }
        if ((value = get(props, KEY_SYNC_FLAGS)) != null) {
            config.setSyncFlags(Boolean.parseBoolean(value));
        }
        if ((value = get(props, KEY_STORE_DIRECTORY)) != null) {
            config.setStoreDirectory(new File(value));
        }
        return config;
    }

    private static String get(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static int requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return value;
    }

    private static long requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return value;
    }

    /**
     * Number of UIDs per envelope fetch during a folder scan
     */
    public int getFetchBatchSize() {
        return fetchBatchSize;
    }

    /**
     * Set the number of UIDs per envelope fetch
     *
     * @param fetchBatchSize A positive batch size
     * @return this configuration instance for chaining
     */
    public MailSyncConfiguration setFetchBatchSize(int fetchBatchSize) {
        this.fetchBatchSize = requirePositive(KEY_FETCH_BATCH_SIZE, fetchBatchSize);
        return this;
    }

    /**
     * Number of folders scanned in parallel, each with its own connection
     */
    public int getFolderWorkers() {
        return folderWorkers;
    }

    /**
     * Set the number of folders scanned in parallel
     *
     * @param folderWorkers A positive worker count
     * @return this configuration instance for chaining
     */
    public MailSyncConfiguration setFolderWorkers(int folderWorkers) {
        this.folderWorkers = requirePositive(KEY_FOLDER_WORKERS, folderWorkers);
        return this;
    }

    /**
     * Number of messages materialized in parallel
     */
    public int getFetchParallelism() {
        return fetchParallelism;
    }

    public MailSyncConfiguration setFetchParallelism(int fetchParallelism) {
        this.fetchParallelism = requirePositive(KEY_FETCH_PARALLELISM, fetchParallelism);
        return this;
    }

    /**
     * Timeout for a single server operation, also used as socket timeout
     */
    public long getOperationTimeoutMs() {
        return operationTimeoutMs;
    }

    public MailSyncConfiguration setOperationTimeoutMs(long operationTimeoutMs) {
        this.operationTimeoutMs = requirePositive(KEY_OPERATION_TIMEOUT_MS, operationTimeoutMs);
        return this;
    }

    /**
     * How long a reconcile pass waits for the account lock before it is skipped
     */
    public long getReconcileLockTimeoutMs() {
        return reconcileLockTimeoutMs;
    }

    public MailSyncConfiguration setReconcileLockTimeoutMs(long reconcileLockTimeoutMs) {
        this.reconcileLockTimeoutMs = requirePositive(KEY_RECONCILE_LOCK_TIMEOUT_MS, reconcileLockTimeoutMs);
        return this;
    }

    /**
     * Whether to ask the server for THREAD structure when it supports it
     */
    public boolean isUseServerThreading() {
        return useServerThreading;
    }

    public MailSyncConfiguration setUseServerThreading(boolean useServerThreading) {
        this.useServerThreading = useServerThreading;
        return this;
    }

    /**
     * The THREAD algorithm to request, REFERENCES or ORDEREDSUBJECT
     */
    public String getThreadAlgorithm() {
        return threadAlgorithm;
    }

    public MailSyncConfiguration setThreadAlgorithm(String threadAlgorithm) {
        this.threadAlgorithm = threadAlgorithm.trim().toUpperCase(Locale.ROOT);
        return this;
    }

    /**
     * Whether to synchronize message flags between server and local records
     */
    public boolean isSyncFlags() {
        return syncFlags;
    }

    /**
     * Set whether to synchronize message flags between server and local records
     *
     * @param syncFlags true to sync flags, false otherwise
     * @return this configuration instance for chaining
     */
    public MailSyncConfiguration setSyncFlags(boolean syncFlags) {
        this.syncFlags = syncFlags;
        return this;
    }

    /**
     * Directory of the file based state store, or null to keep state in memory
     */
    public File getStoreDirectory() {
        return storeDirectory;
    }

    public MailSyncConfiguration setStoreDirectory(File storeDirectory) {
        this.storeDirectory = storeDirectory;
        return this;
    }
}
