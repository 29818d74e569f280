package com.intenovation.mailsync.imap;

/**
 * The result of selecting a folder: its name and current UIDVALIDITY.
 */
public final class SelectedFolder {
    private final String name;
    private final long uidValidity;

    public SelectedFolder(String name, long uidValidity) {
        this.name = name;
        this.uidValidity = uidValidity;
    }

    public String getName() {
        return name;
    }

    public long getUidValidity() {
        return uidValidity;
    }

    @Override
    public String toString() {
        return name + " (UIDVALIDITY " + uidValidity + ")";
    }
}
