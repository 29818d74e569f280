package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.SyncError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a reconcile pass.
 */
public class ReconcileStats {
    private int updated;
    private int moved;
    private int deleted;
    private int duplicatesRemoved;
    private int linked;
    private boolean skipped;
    private final List<SyncError> errors = new ArrayList<>();

    /**
     * Local records whose location or flags changed
     */
    public int getUpdated() {
        return updated;
    }

    /**
     * Local records relocated to a new folder, UIDVALIDITY or UID
     */
    public int getMoved() {
        return moved;
    }

    /**
     * Local records soft deleted, duplicates included
     */
    public int getDeleted() {
        return deleted;
    }

    public int getDuplicatesRemoved() {
        return duplicatesRemoved;
    }

    /**
     * Mirror rows linked to a local record by this pass
     */
    public int getLinked() {
        return linked;
    }

    /**
     * Whether the pass did not run because the account lock was busy
     */
    public boolean isSkipped() {
        return skipped;
    }

    public List<SyncError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    void recordUpdated(boolean wasMoved) {
        updated++;
        if (wasMoved) {
            moved++;
        }
    }

    void recordDeleted(boolean duplicate) {
        deleted++;
        if (duplicate) {
            duplicatesRemoved++;
        }
    }

    void recordLinked() {
        linked++;
    }

    void markSkipped(SyncError error) {
        skipped = true;
        errors.add(error);
    }

    void addError(SyncError error) {
        errors.add(error);
    }

    @Override
    public String toString() {
        return "updated=" + updated + " (moved " + moved + "), deleted=" + deleted
                + " (duplicates " + duplicatesRemoved + "), linked=" + linked + ", errors=" + errors.size()
                + (skipped ? ", skipped" : "");
    }
}
