package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.FakeImapServer;
import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.RecordingListener;
import com.intenovation.mailsync.SyncErrorKind;
import com.intenovation.mailsync.imap.ImapMailbox;
import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.model.ServerMailRecord;
import com.intenovation.mailsync.store.ConcurrencyConflictException;
import com.intenovation.mailsync.store.InMemoryMailStateStore;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.mail.Flags;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Test cases for ServerMirror
 */
public class ServerMirrorTest {

    private static final String ACCOUNT = "acct";
    private static final Date DATE = new Date(1700000000000L);

    private FakeImapServer server;
    private InMemoryMailStateStore store;
    private MailSyncConfiguration configuration;
    private MailSyncEvents events;
    private RecordingListener listener;
    private AccountSettings settings;
    private ServerMirror mirror;

    @BeforeEach
    public void setUp() {
        server = new FakeImapServer().addFolder("INBOX", 10).addFolder("Archive", 20);
        store = new InMemoryMailStateStore();
        configuration = new MailSyncConfiguration().setFetchBatchSize(2).setFolderWorkers(2);
        events = new MailSyncEvents(this);
        listener = new RecordingListener();
        events.addChangeListener(listener);
        settings = new AccountSettings(ACCOUNT, "imap.example.com", 993, "user", "secret", true);
        mirror = new ServerMirror(store, server, configuration, events);
    }

    private List<ServerMailRecord> mirrorRows() throws Exception {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            return tx.serverRecords();
        }
    }

    @Test
    public void testScanBuildsMirror() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE, Flags.Flag.SEEN);
        server.addMessage("INBOX", null, null, "bob@example.com", "Two", DATE);
        server.addMessage("INBOX", "c@x", "a@x", "carol@example.com", "Re: One", DATE);
        server.addMessage("Archive", "d@x", null, "dave@example.com", "Four", DATE);

        MirrorSyncStats stats = mirror.syncFolderState(settings, Arrays.asList("INBOX", "Archive"));

        assertEquals(2, stats.getScanned());
        assertEquals(4, stats.getOnServer());
        assertEquals(4, stats.getInserted());
        assertEquals(0, stats.getRemoved());
        assertTrue(stats.getErrors().isEmpty());

        List<ServerMailRecord> rows = mirrorRows();
        assertEquals(4, rows.size());
        ServerMailRecord first = rows.get(1);
        assertEquals("INBOX", first.getFolder());
        assertEquals(10, first.getUidValidity());
        assertEquals(1, first.getUid());
        assertTrue(first.getParsedFlags().isSeen());
        assertNull(first.getLinkedLocalId());
        assertTrue(rows.get(2).getStableIdentity().startsWith("hash:"));
        assertEquals("a@x", rows.get(3).getInReplyTo());
        assertEquals(2, listener.count(MailSyncChangeEvent.ChangeType.FOLDER_SCANNED));

        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertEquals(10, tx.folderScan("INBOX").get().getUidValidity());
            assertEquals(20, tx.folderScan("Archive").get().getUidValidity());
        }
    }

    @Test
    public void testRescanWithoutChangesIsIdempotent() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);
        server.addMessage("INBOX", null, null, "bob@example.com", "Two", DATE, Flags.Flag.FLAGGED);

        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));
        List<ServerMailRecord> before = mirrorRows();
        MirrorSyncStats second = mirror.syncFolderState(settings, Collections.singletonList("INBOX"));
        List<ServerMailRecord> after = mirrorRows();

        assertEquals(2, second.getRemoved());
        assertEquals(2, second.getInserted());
        assertEquals(before.size(), after.size());
        for (int i = 0; i < before.size(); i++) {
            assertTrue(before.get(i).sameContent(after.get(i)), "row " + i + " changed");
        }
    }

    @Test
    public void testRescanDropsVanishedMessages() throws Exception {
        long uid = server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);
        server.addMessage("INBOX", "b@x", null, "alice@example.com", "Two", DATE);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));

        server.removeMessage("INBOX", uid);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));

        List<ServerMailRecord> rows = mirrorRows();
        assertEquals(1, rows.size());
        assertEquals("b@x", rows.get(0).getMessageId());
    }

    @Test
    public void testFailingFolderDoesNotStopOthers() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);

        MirrorSyncStats stats = mirror.syncFolderState(settings, Arrays.asList("Missing", "INBOX"));

        assertEquals(1, stats.getScanned());
        assertEquals(Collections.singletonList("Missing"), stats.getSkippedFolders());
        assertEquals(1, stats.getErrors().size());
        assertEquals("Missing", stats.getErrors().get(0).getFolder());
        assertEquals(SyncErrorKind.FAILURE, stats.getErrors().get(0).getKind());
        assertEquals(1, mirrorRows().size());
        assertEquals(1, listener.count(MailSyncChangeEvent.ChangeType.FOLDER_SKIPPED));
    }

    @Test
    public void testConnectionFailureIsTransient() throws Exception {
        server.setFailOpen(true);

        MirrorSyncStats stats = mirror.syncFolderState(settings, Collections.singletonList("INBOX"));

        assertEquals(0, stats.getScanned());
        assertEquals(SyncErrorKind.TRANSIENT_NETWORK, stats.getErrors().get(0).getKind());
    }

    @Test
    public void testEmptyFolderListUsesKnownFolders() throws Exception {
        server.addMessage("Archive", "d@x", null, "dave@example.com", "Four", DATE);
        mirror.syncFolderState(settings, Collections.singletonList("Archive"));
        server.addMessage("Archive", "e@x", null, "dave@example.com", "Five", DATE);

        MirrorSyncStats stats = mirror.syncFolderState(settings, Collections.emptyList());

        assertEquals(Collections.singletonList("Archive"), stats.getScannedFolders());
        assertEquals(2, mirrorRows().size());
    }

    @Test
    public void testEmptyFolderListWithoutHistoryIsNoop() throws Exception {
        MirrorSyncStats stats = mirror.syncFolderState(settings, Collections.emptyList());

        assertEquals(0, stats.getScanned());
        assertTrue(stats.getErrors().isEmpty());
        assertEquals(0, server.getOpenCount());
    }

    @Test
    public void testUidValidityResetStartsNewEpoch() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));

        server.resetUidValidity("INBOX", 11);
        server.addMessage("INBOX", "b@x", null, "bob@example.com", "Other", DATE);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));

        List<ServerMailRecord> rows = mirrorRows();
        assertEquals(1, rows.size());
        assertEquals(11, rows.get(0).getUidValidity());
        assertEquals(1, rows.get(0).getUid());
        assertEquals("b@x", rows.get(0).getMessageId());
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertEquals(11, tx.folderScan("INBOX").get().getUidValidity());
        }
    }

    @Test
    public void testConcurrentScanSkipsFolder() throws Exception {
        MailStateStore conflicting = mock(MailStateStore.class);
        MailStateTransaction tx = mock(MailStateTransaction.class);
        when(conflicting.begin(ACCOUNT)).thenReturn(tx);
        when(tx.folderScan("INBOX")).thenReturn(Optional.<FolderScan>empty());
        doThrow(new ConcurrencyConflictException("Folder INBOX was changed by a concurrent writer")).when(tx).commit();
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);

        ServerMirror conflictingMirror = new ServerMirror(conflicting, server, configuration, events);
        ServerMirror.FolderResult result;
        try (ImapMailbox mailbox = server.open(settings)) {
            result = conflictingMirror.scanFolder(mailbox, ACCOUNT, "INBOX");
        }

        assertNotNull(result.error);
        assertEquals(SyncErrorKind.CONCURRENCY_CONFLICT, result.error.getKind());
        verify(tx).insertServerRecord(any(ServerMailRecord.class));
        verify(tx).close();
    }
}
