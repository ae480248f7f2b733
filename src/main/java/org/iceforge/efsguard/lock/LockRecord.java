package org.iceforge.efsguard.lock;

import java.time.Instant;

/**
 * The lock record as stored remotely: the owner's lock id and when it stops being valid.
 */
public record LockRecord(String lockId, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt.isBefore(now);
    }
}
