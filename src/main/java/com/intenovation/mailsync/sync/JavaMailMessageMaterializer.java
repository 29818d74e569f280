package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.model.MailEnvelope;
import com.intenovation.mailsync.model.ServerMailRecord;

import javax.mail.MessagingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches the raw message source by UID and stores it, together with sender and
 * subject, through a {@link PayloadCipher}.
 */
public class JavaMailMessageMaterializer implements MessageMaterializer {

    public static final String PAYLOAD_RAW = "raw";
    public static final String PAYLOAD_FROM = "from";
    public static final String PAYLOAD_SUBJECT = "subject";

    private final PayloadCipher cipher;

    public JavaMailMessageMaterializer(PayloadCipher cipher) {
        this.cipher = cipher;
    }

    @Override
    public FetchedMessage materialize(ImapMailbox mailbox, ServerMailRecord row) throws MessagingException {
        byte[] raw = mailbox.fetchRawMessage(row.getUid()).orElseThrow(() ->
                new MessagingException("UID " + row.getUid() + " no longer exists in " + row.getFolder()));

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(PAYLOAD_RAW, cipher.encrypt(raw));
        if (row.getEnvelopeFrom() != null) {
            payload.put(PAYLOAD_FROM, cipher.encrypt(row.getEnvelopeFrom().getBytes(StandardCharsets.UTF_8)));
        }
        if (row.getEnvelopeSubject() != null) {
            payload.put(PAYLOAD_SUBJECT, cipher.encrypt(row.getEnvelopeSubject().getBytes(StandardCharsets.UTF_8)));
        }

        MailEnvelope envelope = new MailEnvelope(row.getMessageId(), row.getInReplyTo(),
                row.getEnvelopeFrom(), row.getEnvelopeSubject(), row.getEnvelopeDate());
        return new FetchedMessage(row.getKey(), envelope, row.getFlags(), payload, new Date());
    }
}
