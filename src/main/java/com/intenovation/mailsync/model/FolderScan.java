package com.intenovation.mailsync.model;

import java.util.Date;

/**
 * The UIDVALIDITY and time of the last successful scan of a folder.
 */
public final class FolderScan {
    private final String folder;
    private final long uidValidity;
    private final Date scannedAt;

    public FolderScan(String folder, long uidValidity, Date scannedAt) {
        this.folder = folder;
        this.uidValidity = uidValidity;
        this.scannedAt = new Date(scannedAt.getTime());
    }

    public String getFolder() {
        return folder;
    }

    public long getUidValidity() {
        return uidValidity;
    }

    public Date getScannedAt() {
        return new Date(scannedAt.getTime());
    }

    @Override
    public String toString() {
        return "FolderScan[" + folder + ", UIDVALIDITY=" + uidValidity + ", at " + scannedAt + "]";
    }
}
