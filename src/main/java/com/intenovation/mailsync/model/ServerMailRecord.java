package com.intenovation.mailsync.model;

import java.util.Date;
import java.util.Objects;

/**
 * One row of the server mirror: what the server reported for a single
 * (account, folder, UIDVALIDITY, UID) during the last scan of that folder.
 */
public class ServerMailRecord {
    private final MailKey key;
    private final String messageId;
    private final String inReplyTo;
    private final String contentHash;
    private final String flags;
    private final String envelopeFrom;
    private final String envelopeSubject;
    private final Date envelopeDate;
    private final Date firstSeenAt;
    private Date lastSeenAt;
    private boolean deleted;
    private Long linkedLocalId;

    public ServerMailRecord(MailKey key, MailEnvelope envelope, String flags, Date seenAt) {
        this(key, envelope.getMessageId(), envelope.getInReplyTo(), envelope.getContentHash(), flags,
                envelope.getFrom(), envelope.getSubject(), envelope.getDate(), seenAt, seenAt, false, null);
    }

    public ServerMailRecord(MailKey key, String messageId, String inReplyTo, String contentHash, String flags,
                            String envelopeFrom, String envelopeSubject, Date envelopeDate,
                            Date firstSeenAt, Date lastSeenAt, boolean deleted, Long linkedLocalId) {
        this.key = key;
        this.messageId = messageId;
        this.inReplyTo = inReplyTo;
        this.contentHash = contentHash;
        this.flags = flags != null ? flags : "";
        this.envelopeFrom = envelopeFrom;
        this.envelopeSubject = envelopeSubject;
        this.envelopeDate = copy(envelopeDate);
        this.firstSeenAt = copy(firstSeenAt);
        this.lastSeenAt = copy(lastSeenAt);
        this.deleted = deleted;
        this.linkedLocalId = linkedLocalId;
    }

    /**
     * Create an independent copy, used by stores to isolate transactions
     */
    public ServerMailRecord copy() {
        return new ServerMailRecord(key, messageId, inReplyTo, contentHash, flags, envelopeFrom,
                envelopeSubject, envelopeDate, firstSeenAt, lastSeenAt, deleted, linkedLocalId);
    }

    public MailKey getKey() {
        return key;
    }

    public String getFolder() {
        return key.getFolder();
    }

    public long getUidValidity() {
        return key.getUidValidity();
    }

    public long getUid() {
        return key.getUid();
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

    /**
     * The flag string as reported by the server, e.g. "\Seen \Flagged"
     */
    public String getFlags() {
        return flags;
    }

    public MailFlags getParsedFlags() {
        return MailFlags.parse(flags);
    }

    public String getEnvelopeFrom() {
        return envelopeFrom;
    }

    public String getEnvelopeSubject() {
        return envelopeSubject;
    }

    public Date getEnvelopeDate() {
        return copy(envelopeDate);
    }

    public Date getFirstSeenAt() {
        return copy(firstSeenAt);
    }

    public Date getLastSeenAt() {
        return copy(lastSeenAt);
    }

    public void setLastSeenAt(Date lastSeenAt) {
        this.lastSeenAt = copy(lastSeenAt);
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    /**
     * The id of the local record this row was matched to, or null
     */
    public Long getLinkedLocalId() {
        return linkedLocalId;
    }

    public void setLinkedLocalId(Long linkedLocalId) {
        this.linkedLocalId = linkedLocalId;
    }

    /**
     * Whether two rows describe the same server state, ignoring observation times and links
     */
    public boolean sameContent(ServerMailRecord other) {
        return key.equals(other.key)
                && Objects.equals(messageId, other.messageId)
                && Objects.equals(inReplyTo, other.inReplyTo)
                && Objects.equals(contentHash, other.contentHash)
                && flags.equals(other.flags)
                && Objects.equals(envelopeFrom, other.envelopeFrom)
                && Objects.equals(envelopeSubject, other.envelopeSubject)
                && Objects.equals(envelopeDate, other.envelopeDate)
                && deleted == other.deleted;
    }

    private static Date copy(Date date) {
        return date != null ? new Date(date.getTime()) : null;
    }

    @Override
    public String toString() {
        return "ServerMailRecord[" + key + ", " + getStableIdentity() + ", flags=" + flags + "]";
    }
}
