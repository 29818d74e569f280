package com.intenovation.mailsync.thread;

import com.intenovation.mailsync.AccountSettings;
import com.intenovation.mailsync.FakeImapServer;
import com.intenovation.mailsync.MailSyncChangeEvent;
import com.intenovation.mailsync.MailSyncConfiguration;
import com.intenovation.mailsync.MailSyncEvents;
import com.intenovation.mailsync.RecordingListener;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MessageIdentity;
import com.intenovation.mailsync.store.AccountLock;
import com.intenovation.mailsync.store.FileMailStateStore;
import com.intenovation.mailsync.store.InMemoryMailStateStore;
import com.intenovation.mailsync.store.MailStateStore;
import com.intenovation.mailsync.store.MailStateTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ThreadResolver
 */
public class ThreadResolverTest {

    private static final String ACCOUNT = "acct";
    private static final long UIDVALIDITY = 10;

    private FakeImapServer server;
    private InMemoryMailStateStore store;
    private MailSyncConfiguration configuration;
    private RecordingListener listener;
    private AccountSettings settings;
    private ThreadResolver resolver;

    @BeforeEach
    public void setUp() {
        server = new FakeImapServer().addFolder("INBOX", UIDVALIDITY);
        store = new InMemoryMailStateStore();
        configuration = new MailSyncConfiguration();
        MailSyncEvents events = new MailSyncEvents(this);
        listener = new RecordingListener();
        events.addChangeListener(listener);
        settings = new AccountSettings(ACCOUNT, "imap.example.com", 993, "user", "secret", true);
        resolver = new ThreadResolver(store, server, configuration, events);
    }

    private long local(long uid, String messageId, String inReplyTo) throws Exception {
        return local(store, uid, messageId, inReplyTo);
    }

    private static long local(MailStateStore store, long uid, String messageId, String inReplyTo) throws Exception {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            long id = tx.insertLocal(new LocalMailRecord(ACCOUNT, "INBOX", UIDVALIDITY, uid, messageId, inReplyTo,
                    "hash" + uid, null, new Date()));
            tx.commit();
            return id;
        }
    }

    @Test
    public void testReferenceChain() throws Exception {
        long a = local(1, "a@x", null);
        long b = local(2, "b@x", "<a@x>");
        long c = local(3, "c@x", "<b@x>");

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        String expected = ThreadResolver.threadId(ACCOUNT, "a@x");
        assertEquals(expected, threads.get(a).getThreadId());
        assertEquals(expected, threads.get(b).getThreadId());
        assertEquals(expected, threads.get(c).getThreadId());
        assertTrue(threads.get(a).isRoot());
        assertEquals(Long.valueOf(a), threads.get(b).getParentLocalId());
        assertEquals(Long.valueOf(b), threads.get(c).getParentLocalId());
        assertEquals(Long.valueOf(2), threads.get(c).getParentUid());
        assertEquals(1, listener.count(MailSyncChangeEvent.ChangeType.THREADS_RESOLVED));
    }

    @Test
    public void testMissingMiddleStartsNewThread() throws Exception {
        long a = local(1, "a@x", null);
        long c = local(3, "c@x", "<b@x>");

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertTrue(threads.get(c).isRoot());
        assertNull(threads.get(c).getParentUid());
        assertEquals(ThreadResolver.threadId(ACCOUNT, "c@x"), threads.get(c).getThreadId());
        assertNotEquals(threads.get(a).getThreadId(), threads.get(c).getThreadId());
    }

    @Test
    public void testServerThreadPlacesMessagesWithoutReferences() throws Exception {
        server.addCapability("THREAD=REFERENCES").setThreadResponse("INBOX", "* THREAD (1 2)(3)");
        long first = local(1, "a@x", null);
        long second = local(2, "b@x", null);
        long other = local(3, "c@x", null);

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertEquals(Long.valueOf(first), threads.get(second).getParentLocalId());
        assertEquals(threads.get(first).getThreadId(), threads.get(second).getThreadId());
        assertTrue(threads.get(other).isRoot());
        assertEquals(ThreadResolver.threadId(ACCOUNT, "c@x"), threads.get(other).getThreadId());
    }

    @Test
    public void testSiblingsUnderMissingRootShareThread() throws Exception {
        server.addCapability("THREAD=REFERENCES").setThreadResponse("INBOX", "* THREAD ((1)(2))");
        long first = local(1, "a@x", null);
        long second = local(2, "b@x", null);

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertEquals(threads.get(first).getThreadId(), threads.get(second).getThreadId());
        assertEquals(ThreadResolver.threadId(ACCOUNT, "a@x"), threads.get(second).getThreadId());
        assertNull(threads.get(first).getParentLocalId());
        assertNull(threads.get(second).getParentLocalId());
    }

    @Test
    public void testInReplyToWinsOverServer() throws Exception {
        server.addCapability("THREAD=REFERENCES").setThreadResponse("INBOX", "* THREAD (2 3)(1)");
        long a = local(1, "a@x", null);
        local(2, "b@x", null);
        long reply = local(3, "c@x", "<a@x>");

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertEquals(Long.valueOf(a), threads.get(reply).getParentLocalId());
        assertEquals(ThreadResolver.threadId(ACCOUNT, "a@x"), threads.get(reply).getThreadId());
    }

    @Test
    public void testWithoutCapabilityUsesReferencesOnly() throws Exception {
        server.setThreadResponse("INBOX", "* THREAD (1 2)");
        long first = local(1, "a@x", null);
        long second = local(2, "b@x", null);

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertTrue(threads.get(second).isRoot());
        assertNotEquals(threads.get(first).getThreadId(), threads.get(second).getThreadId());
    }

    @Test
    public void testUnreachableServerFallsBack() throws Exception {
        server.setFailOpen(true);
        long a = local(1, "a@x", null);
        long b = local(2, "b@x", "<a@x>");

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertEquals(Long.valueOf(a), threads.get(b).getParentLocalId());
    }

    @Test
    public void testServerThreadingCanBeDisabled() throws Exception {
        configuration.setUseServerThreading(false);
        server.addCapability("THREAD=REFERENCES").setThreadResponse("INBOX", "* THREAD (1 2)");
        local(1, "a@x", null);
        long second = local(2, "b@x", null);

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertTrue(threads.get(second).isRoot());
        assertEquals(0, server.getOpenCount());
    }

    @Test
    public void testCycleIsBroken() throws Exception {
        long a = local(1, "a@x", "<b@x>");
        long b = local(2, "b@x", "<a@x>");

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        assertTrue(threads.get(a).isRoot());
        assertEquals(Long.valueOf(a), threads.get(b).getParentLocalId());
        assertEquals(threads.get(a).getThreadId(), threads.get(b).getThreadId());
    }

    @Test
    public void testThreadIdsAreStable() throws Exception {
        local(1, "a@x", null);
        local(2, null, null);
        local(3, "c@x", "<a@x>");

        Map<Long, ThreadAssignment> first = resolver.resolveThreads(settings);
        Map<Long, ThreadAssignment> second = resolver.resolveThreads(settings);

        assertEquals(first, second);
        String hashRoot = MessageIdentity.stableIdentity(null, "hash2");
        assertEquals(ThreadResolver.threadId(ACCOUNT, hashRoot), first.get(2L).getThreadId());
        assertEquals(ThreadResolver.threadId(ACCOUNT, "a@x"), ThreadResolver.threadId(ACCOUNT, "a@x"));
        assertNotEquals(ThreadResolver.threadId(ACCOUNT, "a@x"), ThreadResolver.threadId("other", "a@x"));
    }

    private static LocalMailRecord stored(MailStateStore store, long id) throws Exception {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            return tx.findLocal(id).get();
        }
    }

    @Test
    public void testAssignmentsAreStoredOnRecords() throws Exception {
        long a = local(1, "a@x", null);
        long b = local(2, "b@x", "<a@x>");

        Map<Long, ThreadAssignment> threads = resolver.resolveThreads(settings);

        LocalMailRecord root = stored(store, a);
        LocalMailRecord reply = stored(store, b);
        assertEquals(threads.get(a).getThreadId(), root.getThreadId());
        assertNull(root.getParentLocalId());
        assertEquals(threads.get(b).getThreadId(), reply.getThreadId());
        assertEquals(Long.valueOf(a), reply.getParentLocalId());
    }

    @Test
    public void testAssignmentsFollowNewReplies() throws Exception {
        long a = local(1, "a@x", null);
        long c = local(3, "c@x", "<b@x>");
        resolver.resolveThreads(settings);
        assertEquals(ThreadResolver.threadId(ACCOUNT, "c@x"), stored(store, c).getThreadId());

        long b = local(2, "b@x", "<a@x>");
        resolver.resolveThreads(settings);

        String expected = ThreadResolver.threadId(ACCOUNT, "a@x");
        assertEquals(expected, stored(store, c).getThreadId());
        assertEquals(Long.valueOf(b), stored(store, c).getParentLocalId());
        assertEquals(Long.valueOf(a), stored(store, b).getParentLocalId());
    }

    @Test
    public void testAssignmentsSurviveReopen(@TempDir File tempDir) throws Exception {
        FileMailStateStore fileStore = new FileMailStateStore(tempDir);
        long a = local(fileStore, 1, "a@x", null);
        long b = local(fileStore, 2, "b@x", "<a@x>");
        ThreadResolver fileResolver = new ThreadResolver(fileStore, server, configuration, new MailSyncEvents(this));

        Map<Long, ThreadAssignment> threads = fileResolver.resolveThreads(settings);

        FileMailStateStore reopened = new FileMailStateStore(tempDir);
        LocalMailRecord reply = stored(reopened, b);
        assertEquals(threads.get(b).getThreadId(), reply.getThreadId());
        assertEquals(Long.valueOf(a), reply.getParentLocalId());
        assertEquals(threads.get(a).getThreadId(), stored(reopened, a).getThreadId());
        assertNull(stored(reopened, a).getParentLocalId());
    }

    @Test
    public void testBusyAccountReturnsAssignmentsWithoutStoring() throws Exception {
        configuration.setReconcileLockTimeoutMs(100);
        long a = local(1, "a@x", null);
        long b = local(2, "b@x", "<a@x>");

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (AccountLock lock = store.lockAccount(ACCOUNT, 1, TimeUnit.SECONDS)) {
                locked.countDown();
                release.await();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        holder.start();
        assertTrue(locked.await(5, TimeUnit.SECONDS));

        Map<Long, ThreadAssignment> threads;
        try {
            threads = resolver.resolveThreads(settings);
        } finally {
            release.countDown();
            holder.join();
        }

        assertEquals(Long.valueOf(a), threads.get(b).getParentLocalId());
        assertNull(stored(store, b).getThreadId());

        resolver.resolveThreads(settings);
        assertEquals(Long.valueOf(a), stored(store, b).getParentLocalId());
    }
}
