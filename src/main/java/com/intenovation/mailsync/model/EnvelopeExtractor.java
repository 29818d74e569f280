package com.intenovation.mailsync.model;

import com.sun.mail.imap.IMAPMessage;

import javax.mail.Address;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Normalizes provider metadata into a {@link MailEnvelope}.
 * <p>
 * Header values may arrive as text, as raw bytes or not at all. Bytes are decoded
 * as UTF-8 with malformed sequences replaced; blank values become null.
 */
public final class EnvelopeExtractor {
    private static final Logger LOGGER = Logger.getLogger(EnvelopeExtractor.class.getName());

    private EnvelopeExtractor() {
    }

    /**
     * Extract the envelope from a JavaMail message
     *
     * @param message The message, ideally with ENVELOPE already fetched
     * @return The canonical envelope
     * @throws MessagingException If the message cannot be read
     */
    public static MailEnvelope extract(Message message) throws MessagingException {
        String messageId = null;
        String inReplyTo = null;

        if (message instanceof IMAPMessage) {
            IMAPMessage imapMessage = (IMAPMessage) message;
            messageId = imapMessage.getMessageID();
            inReplyTo = imapMessage.getInReplyTo();
        } else if (message instanceof MimeMessage) {
            messageId = ((MimeMessage) message).getMessageID();
            inReplyTo = firstHeader(message, "In-Reply-To");
        } else {
            messageId = firstHeader(message, "Message-ID");
            inReplyTo = firstHeader(message, "In-Reply-To");
        }

        return fromRaw(messageId, inReplyTo, senderAddress(message.getFrom()),
                message.getSubject(), message.getSentDate());
    }

    /**
     * Build an envelope from loosely typed values. Each value may be a String,
     * a byte array or null.
     *
     * @param messageId The Message-ID header value
     * @param inReplyTo The In-Reply-To header value
     * @param from The sender address
     * @param subject The subject
     * @param date The envelope date
     * @return The canonical envelope
     */
    public static MailEnvelope fromRaw(Object messageId, Object inReplyTo, Object from, Object subject, Date date) {
        return new MailEnvelope(
                MessageIdentity.normalizeMessageId(normalizeText(messageId)),
                MessageIdentity.normalizeReference(normalizeText(inReplyTo)),
                normalizeText(from),
                normalizeText(subject),
                date);
    }

    /**
     * Decode a header value to trimmed text
     *
     * @param raw A String, CharSequence, byte array or null
     * @return The text, or null when absent or blank
     */
    public static String normalizeText(Object raw) {
        if (raw == null) {
            return null;
        }
        String text;
        if (raw instanceof byte[]) {
            text = new String((byte[]) raw, StandardCharsets.UTF_8);
        } else {
            text = raw.toString();
        }
        text = text.trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Render the first sender as mailbox@host
     */
    static String senderAddress(Address[] from) {
        if (from == null || from.length == 0 || from[0] == null) {
            return null;
        }
        Address first = from[0];
        if (first instanceof InternetAddress) {
            return ((InternetAddress) first).getAddress();
        }
        return first.toString();
    }

    private static String firstHeader(Message message, String name) {
        try {
            String[] values = message.getHeader(name);
            return values != null && values.length > 0 ? values[0] : null;
        } catch (MessagingException e) {
            LOGGER.log(Level.FINE, "Could not read header " + name, e);
            return null;
        }
    }
}
