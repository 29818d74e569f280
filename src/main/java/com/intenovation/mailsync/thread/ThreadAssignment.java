package com.intenovation.mailsync.thread;

import java.util.Objects;

/**
 * Where a local record sits in its conversation.
 */
public final class ThreadAssignment {
    private final String threadId;
    private final Long parentLocalId;
    private final Long parentUid;

    public ThreadAssignment(String threadId, Long parentLocalId, Long parentUid) {
        this.threadId = threadId;
        this.parentLocalId = parentLocalId;
        this.parentUid = parentUid;
    }

    public String getThreadId() {
        return threadId;
    }

    /**
     * The local id of the message this one replies to, or null for a thread root
     */
    public Long getParentLocalId() {
        return parentLocalId;
    }

    public Long getParentUid() {
        return parentUid;
    }

    public boolean isRoot() {
        return parentLocalId == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ThreadAssignment)) {
            return false;
        }
        ThreadAssignment that = (ThreadAssignment) o;
        return threadId.equals(that.threadId)
                && Objects.equals(parentLocalId, that.parentLocalId)
                && Objects.equals(parentUid, that.parentUid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(threadId, parentLocalId, parentUid);
    }

    @Override
    public String toString() {
        return "ThreadAssignment{thread=" + threadId + ", parent=" + parentLocalId + "}";
    }
}
