package com.intenovation.mailsync.imap;

import com.intenovation.mailsync.model.MailEnvelope;

/**
 * Envelope and flags of one message as returned by a batched metadata fetch.
 */
public final class FetchedEnvelope {
    private final long uid;
    private final MailEnvelope envelope;
    private final String flags;

    public FetchedEnvelope(long uid, MailEnvelope envelope, String flags) {
        this.uid = uid;
        this.envelope = envelope;
        this.flags = flags != null ? flags : "";
    }

    public long getUid() {
        return uid;
    }

    public MailEnvelope getEnvelope() {
        return envelope;
    }

    /**
     * The flag string, e.g. "\Seen \Answered"
     */
    public String getFlags() {
        return flags;
    }
}
