package org.iceforge.efsguard.lock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LockManagerTest {

    private static final String DB = "/path/to/sqlite.db";
    private static final String KEY = "database#/path/to/sqlite.db";

    private final LockStore store = mock(LockStore.class);
    private final MutableClock clock = MutableClock.atEpochSecond(1000);
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = d -> {
        sleeps.add(d);
        clock.advance(d);
    };

    private LockManager manager;

    @BeforeEach
    void setup() {
        manager = newManager(settings(Duration.ofSeconds(5), 10), store, clock);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static LockSettings settings(Duration waitTimeout, int maxAttempts) {
        return new LockSettings(KEY, waitTimeout, maxAttempts, Duration.ofSeconds(10), Duration.ofMillis(50));
    }

    private LockManager newManager(LockSettings s, LockStore st, MutableClock c) {
        return new LockManager(s, st, CrashMarker.none(), c, d -> {
            sleeps.add(d);
            c.advance(d);
        });
    }

    @Test
    void acquire_writesRecordExpiringAfterExpiration() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);

        manager.acquire();

        ArgumentCaptor<Instant> expiry = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> now = ArgumentCaptor.forClass(Instant.class);
        verify(store).tryPut(eq(KEY), anyString(), expiry.capture(), now.capture());
        assertEquals(Instant.ofEpochSecond(1010), expiry.getValue());
        assertEquals(Instant.ofEpochSecond(1000), now.getValue());
        assertTrue(manager.isLockActive());
        assertTrue(manager.currentLockId().isPresent());
        assertEquals(Instant.ofEpochSecond(1000), manager.acquiredAt().orElseThrow());
        assertEquals(Instant.ofEpochSecond(1010), manager.expiresAt().orElseThrow());
    }

    @Test
    void acquire_isNoOpWhileLockUnexpired() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);

        manager.acquire();
        String first = manager.currentLockId().orElseThrow();
        manager.acquire();

        verify(store, times(1)).tryPut(anyString(), anyString(), any(), any());
        assertEquals(first, manager.currentLockId().orElseThrow());
    }

    @Test
    void acquire_generatesFreshLockIdPerAttempt() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(false, false, true);

        manager.acquire();

        ArgumentCaptor<String> ids = ArgumentCaptor.forClass(String.class);
        verify(store, times(3)).tryPut(eq(KEY), ids.capture(), any(), any());
        assertEquals(3, ids.getAllValues().stream().distinct().count());
        assertEquals(ids.getAllValues().get(2), manager.currentLockId().orElseThrow());
    }

    @Test
    void acquire_failsBusyAfterExactlyMaxAttempts() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(false);
        Instant start = clock.instant();

        assertThrows(DatabaseBusyException.class, () -> manager.acquire());

        verify(store, times(10)).tryPut(anyString(), anyString(), any(), any());
        Duration backoff = sleeps.stream().reduce(Duration.ZERO, Duration::plus);
        assertEquals(Duration.ofMillis(50 * 55), backoff);
        assertTrue(Duration.between(start, clock.instant()).compareTo(backoff) >= 0);
        assertEquals(Duration.ofMillis(50), sleeps.get(0));
        assertEquals(Duration.ofMillis(500), sleeps.get(9));
        assertFalse(manager.isLockActive());
        assertTrue(manager.currentLockId().isEmpty());
    }

    @Test
    void acquire_stopsAtWaitDeadline() {
        manager = newManager(settings(Duration.ofSeconds(1), 100), store, clock);
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(false);

        assertThrows(DatabaseBusyException.class, () -> manager.acquire());

        // cumulative backoff 50, 150, 300, 500, 750, 1050ms
        verify(store, times(6)).tryPut(anyString(), anyString(), any(), any());
    }

    @Test
    void acquire_retriesThroughStoreErrors() {
        when(store.tryPut(anyString(), anyString(), any(), any()))
                .thenThrow(new LockStoreException("throttled", null, false))
                .thenThrow(new LockStoreException("connect timeout", null, true))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(true);

        manager.acquire();

        verify(store, times(4)).tryPut(anyString(), anyString(), any(), any());
        assertTrue(manager.isLockActive());
    }

    @Test
    void acquire_interruptedDuringBackoffFailsBusy() {
        manager = new LockManager(settings(Duration.ofSeconds(5), 10), store, CrashMarker.none(), clock,
                d -> { throw new InterruptedException(); });
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(false);

        assertThrows(DatabaseBusyException.class, () -> manager.acquire());

        assertTrue(Thread.currentThread().isInterrupted());
        verify(store, times(1)).tryPut(anyString(), anyString(), any(), any());
    }

    @Test
    void release_withoutLock_makesNoStoreCalls() {
        manager.release();

        verifyNoInteractions(store);
    }

    @Test
    void release_deletesWithTheAcquiredLockId() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        when(store.deleteIfOwner(anyString(), anyString())).thenReturn(true);
        manager.acquire();
        String lockId = manager.currentLockId().orElseThrow();

        manager.release();

        verify(store).deleteIfOwner(KEY, lockId);
        assertFalse(manager.isLockActive());
        assertTrue(manager.currentLockId().isEmpty());
        assertTrue(manager.expiresAt().isEmpty());
    }

    @Test
    void release_logsButDoesNotThrowOnStoreFailure() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        when(store.deleteIfOwner(anyString(), anyString())).thenThrow(new LockStoreException("down", null, true));
        manager.acquire();

        assertDoesNotThrow(() -> manager.release());

        assertFalse(manager.isLockActive());
    }

    @Test
    void release_afterLocalExpiry_makesNoStoreCalls() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        manager.acquire();
        clock.advance(Duration.ofSeconds(11));

        manager.release();

        verify(store, never()).deleteIfOwner(anyString(), anyString());
        assertTrue(manager.currentLockId().isEmpty());
    }

    @Test
    void transactionOutlivingItsLock_staysOpenUntilReacquired() throws Exception {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        when(store.deleteIfOwner(anyString(), anyString())).thenReturn(true);
        manager.guardedOperation("BEGIN", () -> null);
        clock.advance(Duration.ofSeconds(11));

        manager.release();

        assertTrue(manager.isInTransaction());
        assertFalse(manager.isLockActive());
        verify(store, never()).deleteIfOwner(anyString(), anyString());
        assertThrows(LockRequiredException.class, () -> manager.commit(() -> { }));
        assertTrue(manager.isInTransaction());

        // the next write takes a fresh lock for the still-open transaction
        manager.guardedOperation("UPDATE t SET x = 1", () -> null);
        assertTrue(manager.isLockActive());
        verify(store, times(2)).tryPut(anyString(), anyString(), any(), any());

        manager.commit(() -> { });
        assertFalse(manager.isInTransaction());
        verify(store, times(1)).deleteIfOwner(eq(KEY), anyString());
    }

    @Test
    void guardedWrite_acquiresThenReleases() throws Exception {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        when(store.deleteIfOwner(anyString(), anyString())).thenReturn(true);

        int rows = manager.guardedOperation("INSERT INTO t VALUES (1)", () -> {
            assertTrue(manager.isLockActive());
            assertEquals("INSERT INTO T VALUES (1)", manager.pendingOperation().orElseThrow());
            return 1;
        });

        assertEquals(1, rows);
        verify(store).deleteIfOwner(eq(KEY), anyString());
        assertFalse(manager.isLockActive());
        assertTrue(manager.pendingOperation().isEmpty());
    }

    @Test
    void guardedRead_doesNotTouchTheStore() {
        String result = manager.guardedOperation("select * from t", () -> "rows");

        assertEquals("rows", result);
        verifyNoInteractions(store);
    }

    @Test
    void guardedOperation_releasesWhenBodyThrows() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);

        assertThrows(SQLException.class, () -> manager.guardedOperation("DELETE FROM t", () -> {
            throw new SQLException("disk I/O error");
        }));

        verify(store).deleteIfOwner(eq(KEY), anyString());
        assertFalse(manager.isLockActive());
    }

    @Test
    void begin_keepsLockUntilCommit() throws Exception {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        when(store.deleteIfOwner(anyString(), anyString())).thenReturn(true);
        AtomicBoolean ran = new AtomicBoolean();

        manager.guardedOperation("BEGIN", () -> {
            ran.set(true);
            return null;
        });

        assertTrue(ran.get());
        assertTrue(manager.isInTransaction());
        assertTrue(manager.isLockActive());
        verify(store, never()).deleteIfOwner(anyString(), anyString());

        // writes inside the transaction keep the lock too
        manager.guardedOperation("UPDATE t SET x = 1", () -> null);
        assertTrue(manager.isLockActive());
        verify(store, times(1)).tryPut(anyString(), anyString(), any(), any());

        AtomicBoolean committed = new AtomicBoolean();
        manager.commit(() -> committed.set(true));

        assertTrue(committed.get());
        assertFalse(manager.isLockActive());
        assertFalse(manager.isInTransaction());
        verify(store, times(1)).deleteIfOwner(eq(KEY), anyString());
    }

    @Test
    void rollback_releasesLock() throws Exception {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        manager.guardedOperation("begin immediate", () -> null);

        manager.rollback(() -> { });

        assertFalse(manager.isLockActive());
        assertFalse(manager.isInTransaction());
    }

    @Test
    void begin_busy_leavesNoTransactionOpen() {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(false);
        AtomicBoolean ran = new AtomicBoolean();

        assertThrows(DatabaseBusyException.class, () -> manager.guardedOperation("BEGIN", () -> {
            ran.set(true);
            return null;
        }));

        assertFalse(ran.get());
        assertFalse(manager.isInTransaction());
        assertFalse(manager.isLockActive());
    }

    @Test
    void commitAndRollback_withoutLock_throwLockRequired() {
        AtomicBoolean called = new AtomicBoolean();

        assertThrows(LockRequiredException.class, () -> manager.commit(() -> called.set(true)));
        assertThrows(LockRequiredException.class, () -> manager.rollback(() -> called.set(true)));

        assertFalse(called.get());
        verifyNoInteractions(store);
    }

    @Test
    void commit_failure_retainsLock() throws Exception {
        when(store.tryPut(anyString(), anyString(), any(), any())).thenReturn(true);
        manager.guardedOperation("BEGIN", () -> null);

        SQLException e = assertThrows(SQLException.class, () -> manager.commit(() -> {
            throw new SQLException("database is locked");
        }));

        assertEquals("database is locked", e.getMessage());
        assertTrue(manager.isLockActive());
        assertTrue(manager.isInTransaction());
        verify(store, never()).deleteIfOwner(anyString(), anyString());
    }

    @Test
    void crashRecoveryCheck_reportsMarker() {
        LockManager withMarker = new LockManager(settings(Duration.ofSeconds(3), 10), store, () -> true, clock, sleeper);

        assertTrue(withMarker.crashRecoveryCheck());
        assertFalse(manager.crashRecoveryCheck());
    }

    @Test
    void staleLockIsTakenOverAfterExpiry() {
        InMemoryLockStore shared = new InMemoryLockStore();
        MutableClock clockA = MutableClock.atEpochSecond(1000);
        MutableClock clockB = MutableClock.atEpochSecond(1005);
        LockManager a = newManager(settings(Duration.ofSeconds(3), 10), shared, clockA);
        LockManager b = newManager(settings(Duration.ofSeconds(3), 10), shared, clockB);

        a.acquire();
        assertEquals(Instant.ofEpochSecond(1010), shared.find(KEY).orElseThrow().expiresAt());

        assertThrows(DatabaseBusyException.class, b::acquire);

        clockB.set(Instant.ofEpochSecond(1011));
        b.acquire();
        assertTrue(b.isLockActive());
        assertEquals(b.currentLockId().orElseThrow(), shared.find(KEY).orElseThrow().lockId());

        // A still believes it holds the lock locally; its release must not delete B's record
        a.release();
        assertEquals(b.currentLockId().orElseThrow(), shared.find(KEY).orElseThrow().lockId());
    }
}
