package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.SyncError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a server mirror run over a set of folders.
 */
public class MirrorSyncStats {
    private int scanned;
    private int onServer;
    private int inserted;
    private int removed;
    private final List<String> scannedFolders = new ArrayList<>();
    private final List<String> skippedFolders = new ArrayList<>();
    private final List<SyncError> errors = new ArrayList<>();

    /**
     * Number of folders whose mirror was rebuilt
     */
    public int getScanned() {
        return scanned;
    }

    /**
     * Number of messages the server reported across all scanned folders
     */
    public int getOnServer() {
        return onServer;
    }

    /**
     * Number of mirror rows written
     */
    public int getInserted() {
        return inserted;
    }

    /**
     * Number of mirror rows replaced or dropped
     */
    public int getRemoved() {
        return removed;
    }

    public List<String> getScannedFolders() {
        return Collections.unmodifiableList(scannedFolders);
    }

    /**
     * Folders left out of this run because a concurrent scan or an error got in the way
     */
    public List<String> getSkippedFolders() {
        return Collections.unmodifiableList(skippedFolders);
    }

    public List<SyncError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    void folderScanned(String folder, int onServer, int inserted, int removed) {
        this.scanned++;
        this.onServer += onServer;
        this.inserted += inserted;
        this.removed += removed;
        this.scannedFolders.add(folder);
    }

    void folderSkipped(String folder, SyncError error) {
        this.skippedFolders.add(folder);
        this.errors.add(error);
    }

    @Override
    public String toString() {
        return "scanned=" + scanned + ", onServer=" + onServer + ", inserted=" + inserted
                + ", removed=" + removed + ", errors=" + errors.size();
    }
}
