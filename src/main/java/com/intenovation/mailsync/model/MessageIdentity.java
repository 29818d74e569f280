package com.intenovation.mailsync.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * Derives the durable identity of a message.
 * <p>
 * The stable identity is the Message-ID when the message has one, otherwise
 * {@code "hash:"} followed by a fingerprint of date, sender and subject.
 * Folder and UID may change; the stable identity must not.
 */
public final class MessageIdentity {
    public static final String HASH_PREFIX = "hash:";

    private static final int HASH_LENGTH = 32;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private MessageIdentity() {
    }

    /**
     * Compute the content fingerprint used when a message has no Message-ID.
     * The same (date, from, subject) triple always yields the same hash.
     *
     * @param date The envelope date, may be null
     * @param from The sender address, may be null
     * @param subject The subject, may be null
     * @return 32 lowercase hex characters
     */
    public static String contentHash(Date date, String from, String subject) {
        String content = formatDate(date) + "|" + nullToEmpty(from) + "|" + nullToEmpty(subject);
        byte[] digest = sha256(content.getBytes(StandardCharsets.UTF_8));
        return toHex(digest).substring(0, HASH_LENGTH);
    }

    /**
     * Get the stable identity of a message
     *
     * @param messageId The normalized Message-ID, may be null
     * @param contentHash The content fingerprint
     * @return The Message-ID if present, otherwise "hash:" + contentHash
     */
    public static String stableIdentity(String messageId, String contentHash) {
        if (messageId != null && !messageId.isEmpty()) {
            return messageId;
        }
        return HASH_PREFIX + contentHash;
    }

    /**
     * Whether the identity was derived from the content fingerprint
     */
    public static boolean isHashIdentity(String stableIdentity) {
        return stableIdentity != null && stableIdentity.startsWith(HASH_PREFIX);
    }

    /**
     * Normalize a Message-ID style value: strip whitespace and angle brackets
     *
     * @param raw The raw header value
     * @return The bare identifier or null if nothing is left
     */
    public static String normalizeMessageId(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        while (value.startsWith("<")) {
            value = value.substring(1);
        }
        while (value.endsWith(">")) {
            value = value.substring(0, value.length() - 1);
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Normalize an In-Reply-To value, which may list several ids; the first one wins
     *
     * @param raw The raw header value
     * @return The first referenced Message-ID or null
     */
    public static String normalizeReference(String raw) {
        if (raw == null) {
            return null;
        }
        int open = raw.indexOf('<');
        if (open >= 0) {
            int close = raw.indexOf('>', open);
            if (close > open) {
                return normalizeMessageId(raw.substring(open + 1, close));
            }
        }
        String trimmed = raw.trim();
        int space = trimmed.indexOf(' ');
        return normalizeMessageId(space > 0 ? trimmed.substring(0, space) : trimmed);
    }

    static String formatDate(Date date) {
        if (date == null) {
            return "";
        }
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(date.toInstant().atOffset(ZoneOffset.UTC));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0f];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0f];
        }
        return new String(out);
    }
}
