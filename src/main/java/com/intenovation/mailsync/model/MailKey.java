package com.intenovation.mailsync.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * The RFC-aligned location of a message: (account, folder, UIDVALIDITY, UID).
 * A UID alone means nothing outside its (folder, UIDVALIDITY) epoch.
 */
public final class MailKey implements Comparable<MailKey> {
    private static final Comparator<MailKey> ORDER = Comparator
            .comparing(MailKey::getAccountId)
            .thenComparing(MailKey::getFolder)
            .thenComparingLong(MailKey::getUidValidity)
            .thenComparingLong(MailKey::getUid);

    private final String accountId;
    private final String folder;
    private final long uidValidity;
    private final long uid;

    public MailKey(String accountId, String folder, long uidValidity, long uid) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.folder = Objects.requireNonNull(folder, "folder");
        this.uidValidity = uidValidity;
        this.uid = uid;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getFolder() {
        return folder;
    }

    public long getUidValidity() {
        return uidValidity;
    }

    public long getUid() {
        return uid;
    }

    /**
     * Whether this key points at the same message slot as the given folder, epoch and uid
     */
    public boolean matches(String folder, long uidValidity, long uid) {
        return this.folder.equals(folder) && this.uidValidity == uidValidity && this.uid == uid;
    }

    @Override
    public int compareTo(MailKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MailKey)) {
            return false;
        }
        MailKey other = (MailKey) o;
        return uidValidity == other.uidValidity
                && uid == other.uid
                && accountId.equals(other.accountId)
                && folder.equals(other.folder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, folder, uidValidity, uid);
    }

    @Override
    public String toString() {
        return accountId + ":" + folder + ";UIDVALIDITY=" + uidValidity + "/" + uid;
    }
}
