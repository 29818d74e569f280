package com.intenovation.mailsync.imap;

/**
 * Where a copied message landed: the destination UIDVALIDITY and the UID the
 * source message received there.
 */
public final class UidRemap {
    private final long uidValidity;
    private final long sourceUid;
    private final long targetUid;

    public UidRemap(long uidValidity, long sourceUid, long targetUid) {
        this.uidValidity = uidValidity;
        this.sourceUid = sourceUid;
        this.targetUid = targetUid;
    }

    /**
     * The UIDVALIDITY of the destination folder
     */
    public long getUidValidity() {
        return uidValidity;
    }

    public long getSourceUid() {
        return sourceUid;
    }

    public long getTargetUid() {
        return targetUid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UidRemap)) {
            return false;
        }
        UidRemap other = (UidRemap) o;
        return uidValidity == other.uidValidity && sourceUid == other.sourceUid && targetUid == other.targetUid;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(uidValidity) * 31 * 31 + Long.hashCode(sourceUid) * 31 + Long.hashCode(targetUid);
    }

    @Override
    public String toString() {
        return "COPYUID " + uidValidity + " " + sourceUid + " " + targetUid;
    }
}
