package org.iceforge.efsguard.lock;

import java.time.Instant;
import java.util.Optional;

/**
 * Remote store holding one lock record per protected database.
 * <p>
 * Both operations must be atomic at the store: correctness across processes rests entirely
 * on the store's conditional write.
 */
public interface LockStore {

    /**
     * Write {@code key -> (lockId, expiresAt)} iff no record exists for {@code key}
     * or the existing record expired before {@code now}.
     *
     * @return false when the condition failed (someone else holds an unexpired lock)
     * @throws LockStoreException on network or service errors
     */
    boolean tryPut(String key, String lockId, Instant expiresAt, Instant now);

    /**
     * Delete the record for {@code key} iff it is still owned by {@code lockId}.
     *
     * @return false when the record is gone or owned by another lock id
     * @throws LockStoreException on network or service errors
     */
    boolean deleteIfOwner(String key, String lockId);

    /**
     * Current record for {@code key}, expired or not. Read-only; used for status reporting,
     * never for deciding ownership.
     *
     * @throws LockStoreException on network or service errors
     */
    Optional<LockRecord> find(String key);
}
