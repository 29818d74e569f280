package com.intenovation.mailsync.model;

import java.util.Date;
import java.util.Objects;

/**
 * The canonical envelope of a message. Every provider-specific representation
 * is normalized into this type once, by the {@link EnvelopeExtractor}.
 */
public final class MailEnvelope {
    private final String messageId;
    private final String inReplyTo;
    private final String from;
    private final String subject;
    private final Date date;
    private final String contentHash;

    public MailEnvelope(String messageId, String inReplyTo, String from, String subject, Date date) {
        this.messageId = messageId;
        this.inReplyTo = inReplyTo;
        this.from = from;
        this.subject = subject;
        this.date = date != null ? new Date(date.getTime()) : null;
        this.contentHash = MessageIdentity.contentHash(date, from, subject);
    }

    /**
     * The Message-ID without angle brackets, or null
     */
    public String getMessageId() {
        return messageId;
    }

    /**
     * The first Message-ID referenced by In-Reply-To, or null
     */
    public String getInReplyTo() {
        return inReplyTo;
    }

    /**
     * The sender as mailbox@host, or null
     */
    public String getFrom() {
        return from;
    }

    public String getSubject() {
        return subject;
    }

    public Date getDate() {
        return date != null ? new Date(date.getTime()) : null;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getStableIdentity() {
        return MessageIdentity.stableIdentity(messageId, contentHash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MailEnvelope)) {
            return false;
        }
        MailEnvelope other = (MailEnvelope) o;
        return Objects.equals(messageId, other.messageId)
                && Objects.equals(inReplyTo, other.inReplyTo)
                && Objects.equals(from, other.from)
                && Objects.equals(subject, other.subject)
                && Objects.equals(date, other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, inReplyTo, from, subject, date);
    }

    @Override
    public String toString() {
        return "MailEnvelope[" + getStableIdentity() + ", from=" + from + ", subject=" + subject + "]";
    }
}
