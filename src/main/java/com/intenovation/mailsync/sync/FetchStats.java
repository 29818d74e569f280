package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.SyncError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a fetch run.
 */
public class FetchStats {
    private int planned;
    private int fetched;
    private int failed;
    private final List<Long> localIds = new ArrayList<>();
    private final List<SyncError> errors = new ArrayList<>();

    /**
     * Number of messages the delta proposed
     */
    public int getPlanned() {
        return planned;
    }

    public int getFetched() {
        return fetched;
    }

    public int getFailed() {
        return failed;
    }

    /**
     * Ids of the local records created or confirmed by this run
     */
    public List<Long> getLocalIds() {
        return Collections.unmodifiableList(localIds);
    }

    public List<SyncError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    void setPlanned(int planned) {
        this.planned = planned;
    }

    void messageFetched(long localId) {
        fetched++;
        localIds.add(localId);
    }

    void messageFailed(SyncError error) {
        failed++;
        errors.add(error);
    }

    @Override
    public String toString() {
        return "planned=" + planned + ", fetched=" + fetched + ", failed=" + failed;
    }
}
