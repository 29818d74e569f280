package com.intenovation.mailsync.sync;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.Base64PayloadCipher;
import com.intenovation.mailsync.FakeImapServer;
import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.RecordingListener;
import com.intenovation.mailsync.SyncError;
import com.intenovation.mailsync.SyncErrorKind;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailEnvelope;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.ServerMailRecord;
import com.intenovation.mailsync.store.InMemoryMailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.mail.Flags;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for FetchCoordinator
 */
public class FetchCoordinatorTest {

    private static final String ACCOUNT = "acct";
    private static final Date DATE = new Date(1700000000000L);

    private FakeImapServer server;
    private InMemoryMailStateStore store;
    private MailSyncConfiguration configuration;
    private RecordingListener listener;
    private AccountSettings settings;
    private ServerMirror mirror;
    private FetchCoordinator coordinator;

    @BeforeEach
    public void setUp() {
        server = new FakeImapServer().addFolder("INBOX", 10).addFolder("Archive", 20);
        store = new InMemoryMailStateStore();
        configuration = new MailSyncConfiguration().setFetchBatchSize(2).setFetchParallelism(2);
        MailSyncEvents events = new MailSyncEvents(this);
        listener = new RecordingListener();
        events.addChangeListener(listener);
        settings = new AccountSettings(ACCOUNT, "imap.example.com", 993, "user", "secret", true);
        mirror = new ServerMirror(store, server, configuration, events);
        coordinator = new FetchCoordinator(new DeltaPlanner(store),
                new JavaMailMessageMaterializer(new Base64PayloadCipher()), new StoreFetchExecutor(store),
                server, configuration, events);
    }

    private List<LocalMailRecord> locals() throws Exception {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            return tx.localRecords(false);
        }
    }

    private static List<ServerMailRecord> rows(String folder, int count) {
        List<ServerMailRecord> rows = new ArrayList<>();
        for (int uid = 1; uid <= count; uid++) {
            rows.add(new ServerMailRecord(new MailKey(ACCOUNT, folder, 1, uid),
                    new MailEnvelope("m" + uid + "@x", null, "a@x", "s", DATE), "", DATE));
        }
        return rows;
    }

    @Test
    public void testChunkSpreadsFolderOverWorkers() {
        List<List<ServerMailRecord>> chunks = FetchCoordinator.chunk(rows("INBOX", 5), 2, 100);

        assertEquals(2, chunks.size());
        assertEquals(3, chunks.get(0).size());
        assertEquals(2, chunks.get(1).size());
    }

    @Test
    public void testChunkRespectsBatchSize() {
        List<List<ServerMailRecord>> chunks = FetchCoordinator.chunk(rows("INBOX", 10), 2, 3);

        assertEquals(4, chunks.size());
        for (List<ServerMailRecord> chunk : chunks) {
            assertTrue(chunk.size() <= 3);
        }
        assertEquals(1, chunks.get(3).size());
    }

    @Test
    public void testChunkNeverMixesFolders() {
        List<ServerMailRecord> mixed = new ArrayList<>(rows("Archive", 1));
        mixed.addAll(rows("INBOX", 1));

        List<List<ServerMailRecord>> chunks = FetchCoordinator.chunk(mixed, 4, 50);

        assertEquals(2, chunks.size());
        assertEquals("Archive", chunks.get(0).get(0).getFolder());
        assertEquals("INBOX", chunks.get(1).get(0).getFolder());
    }

    @Test
    public void testFetchMaterializesDelta() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE, Flags.Flag.SEEN);
        server.addMessage("INBOX", "b@x", null, "bob@example.com", "Two", DATE);
        server.addMessage("INBOX", "c@x", "a@x", "carol@example.com", "Re: One", DATE);
        server.addMessage("Archive", "d@x", null, "dave@example.com", "Four", DATE, Flags.Flag.FLAGGED);
        mirror.syncFolderState(settings, Arrays.asList("INBOX", "Archive"));

        FetchStats stats = coordinator.fetch(settings, FetchFilter.all());

        assertEquals(4, stats.getPlanned());
        assertEquals(4, stats.getFetched());
        assertEquals(0, stats.getFailed());
        assertEquals(4, stats.getLocalIds().size());
        assertEquals(4, listener.count(MailSyncChangeEvent.ChangeType.MESSAGE_FETCHED));

        List<LocalMailRecord> locals = locals();
        assertEquals(4, locals.size());
        LocalMailRecord first = null;
        for (LocalMailRecord local : locals) {
            if ("a@x".equals(local.getMessageId())) {
                first = local;
            }
        }
        assertNotNull(first);
        assertEquals("INBOX", first.getFolder());
        assertEquals(10, first.getUidValidity());
        assertTrue(first.isSeen());
        assertFalse(first.isFlagged());

        byte[] raw = new Base64PayloadCipher().decrypt(first.getPayload().get(JavaMailMessageMaterializer.PAYLOAD_RAW));
        assertTrue(new String(raw, StandardCharsets.UTF_8).contains("Subject: One"));
        assertEquals("alice@example.com", new String(new Base64PayloadCipher()
                .decrypt(first.getPayload().get(JavaMailMessageMaterializer.PAYLOAD_FROM)), StandardCharsets.UTF_8));

        // fetch never links; the mirror rows stay unlinked until reconcile
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            for (ServerMailRecord row : tx.serverRecords()) {
                assertNull(row.getLinkedLocalId());
            }
        }
    }

    @Test
    public void testSecondFetchFindsNothing() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));
        coordinator.fetch(settings, FetchFilter.all());

        FetchStats again = coordinator.fetch(settings, FetchFilter.all());

        assertEquals(0, again.getPlanned());
        assertEquals(1, locals().size());
    }

    @Test
    public void testUnreadableMessageDoesNotStopSiblings() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);
        long broken = server.addMessage("INBOX", "b@x", null, "bob@example.com", "Two", DATE);
        server.addMessage("INBOX", "c@x", null, "carol@example.com", "Three", DATE);
        server.setUnreadable(broken);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));

        FetchStats stats = coordinator.fetch(settings, FetchFilter.all());

        assertEquals(2, stats.getFetched());
        assertEquals(1, stats.getFailed());
        SyncError error = stats.getErrors().get(0);
        assertEquals("INBOX", error.getFolder());
        assertEquals(Long.valueOf(broken), error.getUid());
        assertEquals(SyncErrorKind.FAILURE, error.getKind());
        assertEquals(2, locals().size());
    }

    @Test
    public void testUidValidityChangeIsAnomaly() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);
        server.addMessage("INBOX", "b@x", null, "bob@example.com", "Two", DATE);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));
        server.resetUidValidity("INBOX", 11);
        server.addMessage("INBOX", "z@x", null, "zed@example.com", "Other", DATE);

        FetchStats stats = coordinator.fetch(settings, FetchFilter.all());

        assertEquals(0, stats.getFetched());
        assertEquals(2, stats.getFailed());
        for (SyncError error : stats.getErrors()) {
            assertEquals(SyncErrorKind.DATA_INTEGRITY_ANOMALY, error.getKind());
        }
        assertTrue(locals().isEmpty());
    }

    @Test
    public void testConnectionFailureRecordsEveryMessage() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE);
        server.addMessage("INBOX", "b@x", null, "bob@example.com", "Two", DATE);
        server.addMessage("INBOX", "c@x", null, "carol@example.com", "Three", DATE);
        mirror.syncFolderState(settings, Collections.singletonList("INBOX"));
        server.setFailOpen(true);

        FetchStats stats = coordinator.fetch(settings, FetchFilter.all());

        assertEquals(3, stats.getPlanned());
        assertEquals(3, stats.getFailed());
        for (SyncError error : stats.getErrors()) {
            assertEquals(SyncErrorKind.TRANSIENT_NETWORK, error.getKind());
        }
    }

    @Test
    public void testFilterLimitsFetch() throws Exception {
        server.addMessage("INBOX", "a@x", null, "alice@example.com", "One", DATE, Flags.Flag.SEEN);
        server.addMessage("INBOX", "b@x", null, "bob@example.com", "Two", DATE);
        server.addMessage("Archive", "d@x", null, "dave@example.com", "Four", DATE);
        mirror.syncFolderState(settings, Arrays.asList("INBOX", "Archive"));

        FetchStats stats = coordinator.fetch(settings, new FetchFilter()
                .setIncludeFolders(Collections.singletonList("INBOX")).setUnseenOnly(true));

        assertEquals(1, stats.getFetched());
        assertEquals("b@x", locals().get(0).getMessageId());
    }
}
