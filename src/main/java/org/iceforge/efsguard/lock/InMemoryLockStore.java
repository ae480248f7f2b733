package org.iceforge.efsguard.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lock store for local mode.
 *
 * <p>This is not distributed and only provides single-JVM semantics. That's fine for
 * integration tests and a single-host deployment.
 */
public class InMemoryLockStore implements LockStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLockStore.class);

    private final ConcurrentHashMap<String, LockRecord> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryPut(String key, String lockId, Instant expiresAt, Instant now) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(lockId);
        LockRecord fresh = new LockRecord(lockId, expiresAt);

        for (int i = 0; i < 3; i++) {
            LockRecord existing = locks.get(key);
            if (existing == null) {
                if (locks.putIfAbsent(key, fresh) == null) return true;
                continue;
            }
            if (existing.isExpiredAt(now)) {
                if (locks.replace(key, existing, fresh)) return true;
                continue;
            }
            return false;
        }

        log.debug("Local lock contention for {}", key);
        return false;
    }

    @Override
    public boolean deleteIfOwner(String key, String lockId) {
        LockRecord existing = locks.get(key);
        if (existing == null || !existing.lockId().equals(lockId)) {
            return false;
        }
        return locks.remove(key, existing);
    }

    @Override
    public Optional<LockRecord> find(String key) {
        return Optional.ofNullable(locks.get(key));
    }
}
