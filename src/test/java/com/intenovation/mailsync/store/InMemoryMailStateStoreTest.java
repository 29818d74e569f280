package com.intenovation.mailsync.store;

import com.intenovation.mailsync.model.FolderScan;
import com.intenovation.mailsync.model.LocalMailRecord;
import com.intenovation.mailsync.model.MailEnvelope;
import com.intenovation.mailsync.model.MailKey;
import com.intenovation.mailsync.model.ServerMailRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InMemoryMailStateStore
 */
public class InMemoryMailStateStoreTest {

    private static final String ACCOUNT = "acct";

    private InMemoryMailStateStore store;

    @BeforeEach
    public void setUp() {
        store = new InMemoryMailStateStore();
    }

    static ServerMailRecord serverRecord(String folder, long uidValidity, long uid, String messageId) {
        MailEnvelope envelope = new MailEnvelope(messageId, null, "alice@example.com", "Subject " + uid,
                new Date(1700000000000L + uid));
        return new ServerMailRecord(new MailKey(ACCOUNT, folder, uidValidity, uid), envelope, "\\Seen", new Date());
    }

    static LocalMailRecord localRecord(String folder, long uidValidity, long uid, String messageId) {
        return new LocalMailRecord(ACCOUNT, folder, uidValidity, uid, messageId, null, "hash" + uid, null, new Date());
    }

    @Test
    public void testCommittedChangesAreVisible() throws StoreException {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            tx.insertServerRecord(serverRecord("INBOX", 1, 1, "a@x"));
            tx.insertServerRecord(serverRecord("INBOX", 1, 2, "b@x"));
            tx.recordFolderScan(new FolderScan("INBOX", 1, new Date()));
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertEquals(2, tx.serverRecords().size());
            assertEquals(2, tx.serverRecords("INBOX").size());
            assertTrue(tx.serverRecords("Archive").isEmpty());
            assertEquals(1, tx.folderScan("INBOX").get().getUidValidity());
        }
    }

    @Test
    public void testUncommittedChangesAreRolledBack() throws StoreException {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            tx.insertServerRecord(serverRecord("INBOX", 1, 1, "a@x"));
            tx.insertLocal(localRecord("INBOX", 1, 1, "a@x"));
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertTrue(tx.serverRecords().isEmpty());
            assertTrue(tx.localRecords(true).isEmpty());
        }
    }

    @Test
    public void testFinishedTransactionIsClosed() throws StoreException {
        MailStateTransaction tx = store.begin(ACCOUNT);
        tx.commit();
        assertThrows(IllegalStateException.class, tx::serverRecords);
        tx.close();
    }

    @Test
    public void testEmptyAccountIdRejected() {
        assertThrows(StoreException.class, () -> store.begin(""));
    }

    @Test
    public void testDuplicateServerRecordRejected() throws StoreException {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            tx.insertServerRecord(serverRecord("INBOX", 1, 1, "a@x"));
            assertThrows(ConcurrencyConflictException.class,
                    () -> tx.insertServerRecord(serverRecord("INBOX", 1, 1, "other@x")));
        }
    }

    @Test
    public void testConcurrentFolderScanConflicts() throws StoreException {
        MailStateTransaction first = store.begin(ACCOUNT);
        MailStateTransaction second = store.begin(ACCOUNT);

        first.deleteServerRecords("INBOX");
        first.insertServerRecord(serverRecord("INBOX", 1, 1, "a@x"));
        second.deleteServerRecords("INBOX");
        second.insertServerRecord(serverRecord("INBOX", 1, 2, "b@x"));

        second.commit();
        assertThrows(ConcurrencyConflictException.class, first::commit);
        first.close();

        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            List<ServerMailRecord> rows = tx.serverRecords("INBOX");
            assertEquals(1, rows.size());
            assertEquals(2, rows.get(0).getUid());
        }
    }

    @Test
    public void testDifferentFoldersDoNotConflict() throws StoreException {
        MailStateTransaction first = store.begin(ACCOUNT);
        MailStateTransaction second = store.begin(ACCOUNT);
        first.insertServerRecord(serverRecord("INBOX", 1, 1, "a@x"));
        second.insertServerRecord(serverRecord("Archive", 5, 1, "b@x"));
        second.commit();
        first.commit();

        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertEquals(2, tx.serverRecords().size());
        }
    }

    @Test
    public void testLocalKeyIsUniqueAmongLiveRecords() throws StoreException {
        long id;
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            id = tx.insertLocal(localRecord("INBOX", 1, 1, "a@x"));
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertThrows(ConcurrencyConflictException.class, () -> tx.insertLocal(localRecord("INBOX", 1, 1, "b@x")));
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            LocalMailRecord record = tx.findLocal(id).get();
            record.markDeleted(new Date());
            tx.updateLocal(record);
            tx.insertLocal(localRecord("INBOX", 1, 1, "b@x"));
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertEquals(1, tx.localRecords(false).size());
            assertEquals(2, tx.localRecords(true).size());
            assertEquals("b@x", tx.findLocal(new MailKey(ACCOUNT, "INBOX", 1, 1)).get().getMessageId());
        }
    }

    @Test
    public void testKeysMaySwapWithinOneTransaction() throws StoreException {
        long a;
        long b;
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            a = tx.insertLocal(localRecord("INBOX", 1, 1, "a@x"));
            b = tx.insertLocal(localRecord("INBOX", 1, 2, "b@x"));
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            LocalMailRecord first = tx.findLocal(a).get();
            LocalMailRecord second = tx.findLocal(b).get();
            first.relocate("INBOX", 1, 2);
            tx.updateLocal(first);
            second.relocate("INBOX", 1, 1);
            tx.updateLocal(second);
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertEquals(2, tx.findLocal(a).get().getUid());
            assertEquals(1, tx.findLocal(b).get().getUid());
        }
    }

    @Test
    public void testKeyCollisionDetectedAtCommit() throws StoreException {
        long a;
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            a = tx.insertLocal(localRecord("INBOX", 1, 1, "a@x"));
            tx.insertLocal(localRecord("INBOX", 1, 2, "b@x"));
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            LocalMailRecord first = tx.findLocal(a).get();
            first.relocate("INBOX", 1, 2);
            tx.updateLocal(first);
            assertThrows(ConcurrencyConflictException.class, tx::commit);
        }
    }

    @Test
    public void testConcurrentLocalUpdateConflicts() throws StoreException {
        long id;
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            id = tx.insertLocal(localRecord("INBOX", 1, 1, "a@x"));
            tx.commit();
        }
        MailStateTransaction first = store.begin(ACCOUNT);
        MailStateTransaction second = store.begin(ACCOUNT);
        LocalMailRecord viaFirst = first.findLocal(id).get();
        LocalMailRecord viaSecond = second.findLocal(id).get();

        viaSecond.setSeen(true);
        second.updateLocal(viaSecond);
        second.commit();

        viaFirst.setFlagged(true);
        first.updateLocal(viaFirst);
        assertThrows(ConcurrencyConflictException.class, first::commit);
        first.close();
    }

    @Test
    public void testRecordsAreCopies() throws StoreException {
        long id;
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            id = tx.insertLocal(localRecord("INBOX", 1, 1, "a@x"));
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            tx.findLocal(id).get().setSeen(true);
            assertFalse(tx.findLocal(id).get().isSeen());
        }
    }

    @Test
    public void testLinkServerRecord() throws StoreException {
        MailKey key = new MailKey(ACCOUNT, "INBOX", 1, 1);
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            tx.insertServerRecord(serverRecord("INBOX", 1, 1, "a@x"));
            tx.linkServerRecord(key, 42L);
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            assertEquals(Long.valueOf(42), tx.serverRecords().get(0).getLinkedLocalId());
            assertThrows(StoreException.class, () -> tx.linkServerRecord(new MailKey(ACCOUNT, "INBOX", 1, 9), 1L));
        }
    }

    @Test
    public void testFindLocalByIdentity() throws StoreException {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            tx.insertLocal(localRecord("INBOX", 1, 1, "a@x"));
            tx.insertLocal(localRecord("Archive", 3, 7, "a@x"));
            tx.insertLocal(localRecord("INBOX", 1, 2, null));
            assertEquals(2, tx.findLocalByIdentity("a@x").size());
            assertEquals(1, tx.findLocalByIdentity("hash:hash2").size());
        }
    }

    @Test
    public void testAccountsAreSeparate() throws StoreException {
        try (MailStateTransaction tx = store.begin(ACCOUNT)) {
            tx.insertServerRecord(serverRecord("INBOX", 1, 1, "a@x"));
            tx.commit();
        }
        try (MailStateTransaction tx = store.begin("other")) {
            assertTrue(tx.serverRecords().isEmpty());
            assertThrows(IllegalArgumentException.class,
                    () -> tx.insertServerRecord(serverRecord("INBOX", 1, 2, "b@x")));
        }
    }

    @Test
    public void testLockAccountTimesOutWhileHeldElsewhere() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (AccountLock lock = store.lockAccount(ACCOUNT, 1, TimeUnit.SECONDS)) {
                locked.countDown();
                release.await();
            } catch (Exception e) {
                fail(e);
            }
        });
        holder.start();
        assertTrue(locked.await(5, TimeUnit.SECONDS));

        assertThrows(ConcurrencyConflictException.class,
                () -> store.lockAccount(ACCOUNT, 50, TimeUnit.MILLISECONDS));
        // another account is not affected
        store.lockAccount("other", 50, TimeUnit.MILLISECONDS).close();

        release.countDown();
        holder.join();
        store.lockAccount(ACCOUNT, 1, TimeUnit.SECONDS).close();
    }
}
