package org.iceforge.efsguard.status;

import java.time.Instant;

/**
 * Snapshot of the protected database's lock as seen by this process.
 *
 * @param state        {@code FREE} (no record), {@code HELD} (unexpired record) or {@code EXPIRED}
 *                     (record left behind; the next writer takes it over)
 * @param lockId       owner of the record, null when {@code FREE}
 * @param expiresAt    record expiry, null when {@code FREE}
 * @param journalPresent whether the rollback journal exists next to the database file
 */
public record LockStatus(
        String databasePath,
        String resourceKey,
        String store,
        State state,
        String lockId,
        Instant expiresAt,
        Instant checkedAt,
        boolean journalPresent
) {

    public enum State { FREE, HELD, EXPIRED }
}
