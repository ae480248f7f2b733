package org.iceforge.efsguard.lock;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLockStoreTest {

    private final InMemoryLockStore store = new InMemoryLockStore();
    private final Instant t1000 = Instant.ofEpochSecond(1000);

    @Test
    void tryPut_succeedsWhenAbsent() {
        assertTrue(store.tryPut("k", "a", t1000.plusSeconds(10), t1000));
        assertEquals("a", store.find("k").orElseThrow().lockId());
    }

    @Test
    void tryPut_failsWhileExistingRecordUnexpired() {
        store.tryPut("k", "a", t1000.plusSeconds(10), t1000);

        assertFalse(store.tryPut("k", "b", t1000.plusSeconds(15), t1000.plusSeconds(5)));
        assertEquals("a", store.find("k").orElseThrow().lockId());
    }

    @Test
    void tryPut_overwritesExpiredRecord() {
        store.tryPut("k", "a", t1000.plusSeconds(10), t1000);

        assertTrue(store.tryPut("k", "b", t1000.plusSeconds(21), t1000.plusSeconds(11)));
        assertEquals("b", store.find("k").orElseThrow().lockId());
    }

    @Test
    void deleteIfOwner_onlyDeletesMatchingLockId() {
        store.tryPut("k", "a", t1000.plusSeconds(10), t1000);

        assertFalse(store.deleteIfOwner("k", "b"));
        assertTrue(store.find("k").isPresent());

        assertTrue(store.deleteIfOwner("k", "a"));
        assertTrue(store.find("k").isEmpty());
        assertFalse(store.deleteIfOwner("k", "a"));
    }
}
