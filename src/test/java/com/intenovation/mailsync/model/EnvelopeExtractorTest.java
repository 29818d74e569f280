package com.intenovation.mailsync.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import javax.mail.Address;
import javax.mail.Message;
import javax.mail.MessagingException;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Test cases for EnvelopeExtractor
 */
public class EnvelopeExtractorTest {

    private static final Date DATE = new Date(1700000000000L);

    @Mock
    MimeMessage mimeMessage;

    @Mock
    Message plainMessage;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    public void testExtractFromMimeMessage() throws Exception {
        when(mimeMessage.getMessageID()).thenReturn("<m1@example.com>");
        when(mimeMessage.getHeader("In-Reply-To")).thenReturn(new String[]{"<m0@example.com>"});
        when(mimeMessage.getFrom()).thenReturn(new Address[]{new InternetAddress("Alice <alice@example.com>")});
        when(mimeMessage.getSubject()).thenReturn("  Lunch ");
        when(mimeMessage.getSentDate()).thenReturn(DATE);

        MailEnvelope envelope = EnvelopeExtractor.extract(mimeMessage);

        assertEquals("m1@example.com", envelope.getMessageId());
        assertEquals("m0@example.com", envelope.getInReplyTo());
        assertEquals("alice@example.com", envelope.getFrom());
        assertEquals("Lunch", envelope.getSubject());
        assertEquals(DATE, envelope.getDate());
        assertEquals("m1@example.com", envelope.getStableIdentity());
    }

    @Test
    public void testExtractFromHeaders() throws Exception {
        when(plainMessage.getHeader("Message-ID")).thenReturn(new String[]{"<m2@example.com>"});
        when(plainMessage.getHeader("In-Reply-To")).thenReturn(null);
        when(plainMessage.getFrom()).thenReturn(null);
        when(plainMessage.getSubject()).thenReturn(null);
        when(plainMessage.getSentDate()).thenReturn(null);

        MailEnvelope envelope = EnvelopeExtractor.extract(plainMessage);

        assertEquals("m2@example.com", envelope.getMessageId());
        assertNull(envelope.getInReplyTo());
        assertNull(envelope.getFrom());
        assertNull(envelope.getSubject());
    }

    @Test
    public void testUnreadableHeaderIsAbsent() throws Exception {
        when(plainMessage.getHeader(anyString())).thenThrow(new MessagingException("gone"));
        when(plainMessage.getSubject()).thenReturn("Hello");
        when(plainMessage.getSentDate()).thenReturn(DATE);

        MailEnvelope envelope = EnvelopeExtractor.extract(plainMessage);

        assertNull(envelope.getMessageId());
        assertTrue(MessageIdentity.isHashIdentity(envelope.getStableIdentity()));
    }

    @Test
    public void testMissingMessageIdFallsBackToHash() throws Exception {
        when(mimeMessage.getMessageID()).thenReturn(null);
        when(mimeMessage.getFrom()).thenReturn(new Address[]{new InternetAddress("bob@example.com")});
        when(mimeMessage.getSubject()).thenReturn("Report");
        when(mimeMessage.getSentDate()).thenReturn(DATE);

        MailEnvelope envelope = EnvelopeExtractor.extract(mimeMessage);

        assertEquals("hash:" + MessageIdentity.contentHash(DATE, "bob@example.com", "Report"),
                envelope.getStableIdentity());
    }

    @Test
    public void testFromRawDecodesBytes() {
        MailEnvelope envelope = EnvelopeExtractor.fromRaw(
                "<m3@example.com>".getBytes(StandardCharsets.UTF_8),
                "   ",
                "carol@example.com",
                "Grüße".getBytes(StandardCharsets.UTF_8),
                DATE);
        assertEquals("m3@example.com", envelope.getMessageId());
        assertNull(envelope.getInReplyTo());
        assertEquals("Grüße", envelope.getSubject());
    }

    @Test
    public void testNormalizeText() {
        assertNull(EnvelopeExtractor.normalizeText(null));
        assertNull(EnvelopeExtractor.normalizeText(" "));
        assertNull(EnvelopeExtractor.normalizeText(new byte[0]));
        assertEquals("x", EnvelopeExtractor.normalizeText(" x "));
    }
}
