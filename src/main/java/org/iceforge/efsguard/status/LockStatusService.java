package org.iceforge.efsguard.status;

import org.iceforge.efsguard.jdbc.EfsGuardJdbcProperties;
import org.iceforge.efsguard.lock.LockManagerFactory;
import org.iceforge.efsguard.lock.LockProperties;
import org.iceforge.efsguard.lock.LockRecord;
import org.iceforge.efsguard.lock.LockSettings;
import org.iceforge.efsguard.lock.LockStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the lock record without taking part in locking: nothing here writes to the store.
 */
@Service
public class LockStatusService {

    private final LockStore store;
    private final LockManagerFactory lockManagers;
    private final LockProperties lockProps;
    private final EfsGuardJdbcProperties jdbcProps;
    private final Clock clock;

    @Autowired
    public LockStatusService(LockStore store,
                             LockManagerFactory lockManagers,
                             LockProperties lockProps,
                             EfsGuardJdbcProperties jdbcProps) {
        this(store, lockManagers, lockProps, jdbcProps, Clock.systemUTC());
    }

    LockStatusService(LockStore store,
                      LockManagerFactory lockManagers,
                      LockProperties lockProps,
                      EfsGuardJdbcProperties jdbcProps,
                      Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.lockManagers = Objects.requireNonNull(lockManagers);
        this.lockProps = Objects.requireNonNull(lockProps);
        this.jdbcProps = Objects.requireNonNull(jdbcProps);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @throws org.iceforge.efsguard.lock.LockStoreException when the store cannot be read
     */
    public LockStatus current() {
        LockSettings settings = lockManagers.settings();
        Instant now = clock.instant();
        Optional<LockRecord> record = store.find(settings.resourceKey());
        boolean journal = lockManagers.create().crashRecoveryCheck();

        LockStatus.State state = record
                .map(r -> r.isExpiredAt(now) ? LockStatus.State.EXPIRED : LockStatus.State.HELD)
                .orElse(LockStatus.State.FREE);
        return new LockStatus(
                jdbcProps.getDatabasePath(),
                settings.resourceKey(),
                lockProps.getStore(),
                state,
                record.map(LockRecord::lockId).orElse(null),
                record.map(LockRecord::expiresAt).orElse(null),
                now,
                journal);
    }
}
