package com.intenovation.mailsync.imap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a server THREAD response. A node without a UID is a placeholder
 * for a message the server knows is missing.
 */
public final class ThreadNode {
    private final Long uid;
    private final List<ThreadNode> children = new ArrayList<>();

    private ThreadNode(Long uid) {
        this.uid = uid;
    }

    public static ThreadNode of(long uid) {
        return new ThreadNode(uid);
    }

    public static ThreadNode placeholder() {
        return new ThreadNode(null);
    }

    /**
     * The UID, or null for a placeholder
     */
    public Long getUid() {
        return uid;
    }

    public boolean isPlaceholder() {
        return uid == null;
    }

    public List<ThreadNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public ThreadNode addChild(ThreadNode child) {
        children.add(child);
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(uid == null ? "-" : uid.toString());
        for (ThreadNode child : children) {
            sb.append(' ').append(child);
        }
        return sb.append(')').toString();
    }
}
