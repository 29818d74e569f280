package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.model.MailEnvelope;
import com.intenovation.mailsync.model.MailKey;

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message fetched from the server, ready to be stored. The payload fields
 * are already encrypted; the envelope is kept only for identity and threading.
 */
public final class FetchedMessage {
    private final MailKey key;
    private final MailEnvelope envelope;
    private final String flags;
    private final Map<String, String> payload;
    private final Date receivedAt;

    public FetchedMessage(MailKey key, MailEnvelope envelope, String flags, Map<String, String> payload,
                          Date receivedAt) {
        this.key = key;
        this.envelope = envelope;
        this.flags = flags != null ? flags : "";
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.receivedAt = receivedAt != null ? new Date(receivedAt.getTime()) : new Date();
    }

    public MailKey getKey() {
        return key;
    }

    public MailEnvelope getEnvelope() {
        return envelope;
    }

    public String getFlags() {
        return flags;
    }

    public Map<String, String> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public Date getReceivedAt() {
        return new Date(receivedAt.getTime());
    }
}
