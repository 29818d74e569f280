package com.intenovation.mailsync;

import com.intenovation.mailsync.sync.FetchStats;
import com.intenovation.mailsync.sync.MirrorSyncStats;
import com.intenovation.mailsync.sync.ReconcileStats;
import com.intenovation.mailsync.thread.ThreadAssignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * What a full run over one account did, phase by phase.
 */
public class AccountSyncReport {
    private final String accountId;
    private final long startTime;
    private long endTime;
    private MirrorSyncStats mirrorStats;
    private FetchStats fetchStats;
    private ReconcileStats reconcileStats;
    private Map<Long, ThreadAssignment> threads = Collections.emptyMap();

    public AccountSyncReport(String accountId) {
        this.accountId = accountId;
        this.startTime = System.currentTimeMillis();
    }

    public String getAccountId() {
        return accountId;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public MirrorSyncStats getMirrorStats() {
        return mirrorStats;
    }

    public FetchStats getFetchStats() {
        return fetchStats;
    }

    public ReconcileStats getReconcileStats() {
        return reconcileStats;
    }

    public Map<Long, ThreadAssignment> getThreads() {
        return threads;
    }

    /**
     * Every error entry of every phase, in phase order
     */
    public List<SyncError> getErrors() {
        List<SyncError> errors = new ArrayList<>();
        if (mirrorStats != null) {
            errors.addAll(mirrorStats.getErrors());
        }
        if (fetchStats != null) {
            errors.addAll(fetchStats.getErrors());
        }
        if (reconcileStats != null) {
            errors.addAll(reconcileStats.getErrors());
        }
        return errors;
    }

    public boolean hasErrors() {
        return !getErrors().isEmpty();
    }

    AccountSyncReport setMirrorStats(MirrorSyncStats mirrorStats) {
        this.mirrorStats = mirrorStats;
        return this;
    }

    AccountSyncReport setFetchStats(FetchStats fetchStats) {
        this.fetchStats = fetchStats;
        return this;
    }

    AccountSyncReport setReconcileStats(ReconcileStats reconcileStats) {
        this.reconcileStats = reconcileStats;
        return this;
    }

    AccountSyncReport setThreads(Map<Long, ThreadAssignment> threads) {
        this.threads = threads;
        return this;
    }

    AccountSyncReport finish() {
        this.endTime = System.currentTimeMillis();
        return this;
    }

    @Override
    public String toString() {
        return "Account " + accountId + " in " + (endTime - startTime) + "ms: mirror [" + mirrorStats
                + "], fetch [" + fetchStats + "], reconcile [" + reconcileStats + "], threads "
                + threads.size();
    }
}
