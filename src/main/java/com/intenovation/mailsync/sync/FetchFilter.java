package com.intenovation.mailsync.sync;

import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Restricts which mirror rows the delta planner proposes for fetching.
 * An empty filter lets everything through.
 */
public class FetchFilter {
    private final Set<String> includeFolders = new LinkedHashSet<>();
    private final Set<String> excludeFolders = new LinkedHashSet<>();
    private Date since;
    private boolean unseenOnly;

    /**
     * A filter that accepts every row
     */
    public static FetchFilter all() {
        return new FetchFilter();
    }

    public Set<String> getIncludeFolders() {
        return Collections.unmodifiableSet(includeFolders);
    }

    /**
     * Only fetch from these folders
     *
     * @param folders The folders, empty for all
     * @return this filter instance for chaining
     */
    public FetchFilter setIncludeFolders(Collection<String> folders) {
        includeFolders.clear();
        includeFolders.addAll(folders);
        return this;
    }

    public Set<String> getExcludeFolders() {
        return Collections.unmodifiableSet(excludeFolders);
    }

    /**
     * Never fetch from these folders, even if they are included
     *
     * @param folders The folders to skip
     * @return this filter instance for chaining
     */
    public FetchFilter setExcludeFolders(Collection<String> folders) {
        excludeFolders.clear();
        excludeFolders.addAll(folders);
        return this;
    }

    public Date getSince() {
        return since != null ? new Date(since.getTime()) : null;
    }

    /**
     * Only fetch messages whose envelope date is on or after this date.
     * Messages without a date are left out when this is set.
     *
     * @param since The earliest date, or null for no limit
     * @return this filter instance for chaining
     */
    public FetchFilter setSince(Date since) {
        this.since = since != null ? new Date(since.getTime()) : null;
        return this;
    }

    public boolean isUnseenOnly() {
        return unseenOnly;
    }

    /**
     * Only fetch messages the server does not flag \Seen
     *
     * @param unseenOnly true to skip read messages
     * @return this filter instance for chaining
     */
    public FetchFilter setUnseenOnly(boolean unseenOnly) {
        this.unseenOnly = unseenOnly;
        return this;
    }

    /**
     * Whether a folder passes the include and exclude lists
     */
    public boolean acceptsFolder(String folder) {
        if (excludeFolders.contains(folder)) {
            return false;
        }
        return includeFolders.isEmpty() || includeFolders.contains(folder);
    }

    @Override
    public String toString() {
        return "FetchFilter[include=" + includeFolders + ", exclude=" + excludeFolders
                + ", since=" + since + ", unseenOnly=" + unseenOnly + "]";
    }
}
