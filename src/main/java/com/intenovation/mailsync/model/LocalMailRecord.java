package com.intenovation.mailsync.model;

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A materialized message in the local store.
 * <p>
 * The payload map holds opaque, already encrypted fields that the engine
 * stores and returns without interpreting them.
 */
public class LocalMailRecord {
    private long id;
    private final String accountId;
    private String folder;
    private long uidValidity;
    private long uid;
    private final String messageId;
    private final String inReplyTo;
    private final String contentHash;
    private boolean seen;
    private boolean answered;
    private boolean flagged;
    private boolean deleted;
    private boolean draft;
    private final Map<String, String> payload;
    private final Date receivedAt;
    private Date deletedAt;
    private String threadId;
    private Long parentLocalId;

    public LocalMailRecord(String accountId, String folder, long uidValidity, long uid,
                           String messageId, String inReplyTo, String contentHash,
                           Map<String, String> payload, Date receivedAt) {
        this.accountId = accountId;
        this.folder = folder;
        this.uidValidity = uidValidity;
        this.uid = uid;
        this.messageId = messageId;
        this.inReplyTo = inReplyTo;
        this.contentHash = contentHash;
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.receivedAt = receivedAt != null ? new Date(receivedAt.getTime()) : null;
    }

    /**
     * Create an independent copy, used by stores to isolate transactions
     */
    public LocalMailRecord copy() {
        LocalMailRecord copy = new LocalMailRecord(accountId, folder, uidValidity, uid, messageId,
                inReplyTo, contentHash, payload, receivedAt);
        copy.id = id;
        copy.seen = seen;
        copy.answered = answered;
        copy.flagged = flagged;
        copy.deleted = deleted;
        copy.draft = draft;
        copy.deletedAt = deletedAt != null ? new Date(deletedAt.getTime()) : null;
        copy.threadId = threadId;
        copy.parentLocalId = parentLocalId;
        return copy;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getAccountId() {
        return accountId;
    }

    public MailKey getKey() {
        return new MailKey(accountId, folder, uidValidity, uid);
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
     * Relocate the record, used when a move has been observed or confirmed
     */
    public void relocate(String folder, long uidValidity, long uid) {
        this.folder = folder;
        this.uidValidity = uidValidity;
        this.uid = uid;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getInReplyTo() {
        return inReplyTo;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getStableIdentity() {
        return MessageIdentity.stableIdentity(messageId, contentHash);
    }

    public MailFlags getFlags() {
        return new MailFlags(seen, answered, flagged, deleted, draft);
    }

    public void setFlags(MailFlags flags) {
        this.seen = flags.isSeen();
        this.answered = flags.isAnswered();
        this.flagged = flags.isFlagged();
        this.deleted = flags.isDeleted();
        this.draft = flags.isDraft();
    }

    public boolean isSeen() {
        return seen;
    }

    public void setSeen(boolean seen) {
        this.seen = seen;
    }

    public boolean isFlagged() {
        return flagged;
    }

    public void setFlagged(boolean flagged) {
        this.flagged = flagged;
    }

    public Map<String, String> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public Date getReceivedAt() {
        return receivedAt != null ? new Date(receivedAt.getTime()) : null;
    }

    /**
     * Whether the record has been soft deleted
     */
    public boolean isSoftDeleted() {
        return deletedAt != null;
    }

    public Date getDeletedAt() {
        return deletedAt != null ? new Date(deletedAt.getTime()) : null;
    }

    /**
     * Soft delete the record. The record is kept, only the timestamp is set.
     */
    public void markDeleted(Date when) {
        if (deletedAt == null) {
            deletedAt = new Date(when.getTime());
        }
    }

    /**
     * The conversation the record belongs to, or null before threads were resolved
     */
    public String getThreadId() {
        return threadId;
    }

    /**
     * The local id of the message this one replies to, or null for a thread root
     */
    public Long getParentLocalId() {
        return parentLocalId;
    }

    public void assignThread(String threadId, Long parentLocalId) {
        this.threadId = threadId;
        this.parentLocalId = parentLocalId;
    }

    @Override
    public String toString() {
        return "LocalMailRecord[" + id + ", " + getKey() + ", " + getStableIdentity()
                + (deletedAt != null ? ", deleted" : "") + "]";
    }
}
