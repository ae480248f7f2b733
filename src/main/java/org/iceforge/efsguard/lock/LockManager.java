package org.iceforge.efsguard.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Holds the distributed lock for one protected database on behalf of one connection.
 *
 * <p>Lifecycle:
 * <pre>
 * UNLOCKED --acquire--> LOCKED --guarded write done--> UNLOCKED
 * LOCKED --BEGIN--> LOCKED_IN_TRANSACTION --commit/rollback ok--> UNLOCKED
 * LOCKED_IN_TRANSACTION --commit/rollback failed--> LOCKED_IN_TRANSACTION
 * </pre>
 * A failed acquire leaves the manager unlocked and throws {@link DatabaseBusyException}.
 *
 * <p>Not thread-safe: an instance belongs to a single connection and is used by one thread
 * at a time. Mutual exclusion between processes comes only from the {@link LockStore}'s
 * conditional write.
 */
public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final LockSettings settings;
    private final LockStore store;
    private final CrashMarker crashMarker;
    private final Clock clock;
    private final Sleeper sleeper;

    private String currentLockId;
    private Instant acquiredAt;
    private Instant expiresAt;
    private boolean inTransaction;
    private String pendingOperation;

    public LockManager(LockSettings settings, LockStore store, CrashMarker crashMarker, Clock clock, Sleeper sleeper) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.store = Objects.requireNonNull(store, "store");
        this.crashMarker = Objects.requireNonNull(crashMarker, "crashMarker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public LockManager(LockSettings settings, LockStore store, CrashMarker crashMarker) {
        this(settings, store, crashMarker, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * Acquire the lock, retrying with linear backoff until either the attempt budget or the
     * wait timeout runs out. No-op if this instance already holds an unexpired lock.
     *
     * @throws DatabaseBusyException if the lock could not be obtained
     */
    public void acquire() {
        if (isLockActive()) {
            return;
        }
        String key = settings.resourceKey();
        int attempts = 0;
        Instant deadline = clock.instant().plus(settings.waitTimeout());

        while (clock.instant().isBefore(deadline) && attempts < settings.maxAttempts()) {
            String lockId = UUID.randomUUID().toString();
            Instant now = clock.instant();
            Instant expiry = now.plus(settings.expiration());
            boolean lastAttempt = attempts + 1 >= settings.maxAttempts();

            try {
                if (store.tryPut(key, lockId, expiry, now)) {
                    currentLockId = lockId;
                    acquiredAt = now;
                    expiresAt = expiry;
                    log.info("Lock acquired: id='{}', key='{}', at={}, expiresAt={}", lockId, key, now, expiry);
                    return;
                }
                log.debug("Lock busy: key='{}', attempt={}", key, attempts);
            } catch (LockStoreException e) {
                if (lastAttempt || e.isClientSide()) {
                    log.error("Failed to write lock record: key='{}', attempt={}, error='{}'", key, attempts, e.getMessage());
                } else {
                    log.warn("Failed to write lock record: key='{}', attempt={}, error='{}'", key, attempts, e.getMessage());
                }
            } catch (RuntimeException e) {
                log.error("Unexpected failure writing lock record: key='{}', attempt={}", key, attempts, e);
            }

            clearLockState();
            attempts++;
            try {
                sleeper.sleep(settings.baseDelay().multipliedBy(attempts));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DatabaseBusyException("Interrupted while waiting for database lock '" + key + "'", e);
            }
        }

        log.error("Lock acquisition failed: key='{}', waitTimeout={}, attempts={}", key, settings.waitTimeout(), attempts);
        throw new DatabaseBusyException("Failed to acquire database lock '" + key + "'.");
    }

    /**
     * Release the lock if held. Store failures are logged and never thrown: the record's
     * expiry frees it eventually.
     */
    public void release() {
        if (!isLockActive()) {
            // An open transaction stays open: the next write re-acquires for it, and only
            // commit/rollback (or closing the connection) ends it.
            log.debug("No active lock to release.");
            clearLockState();
            return;
        }
        String key = settings.resourceKey();
        String lockId = currentLockId;
        try {
            if (!store.deleteIfOwner(key, lockId)) {
                log.warn("Lock record no longer owned at release: id='{}', key='{}'", lockId, key);
            }
        } catch (RuntimeException e) {
            log.error("Lock release failed: id='{}', key='{}', error='{}'", lockId, key, e.getMessage());
        }
        Instant releasedAt = clock.instant();
        log.info("Lock released: id='{}', key='{}', at={}, held={}",
                lockId, key, releasedAt, Duration.between(acquiredAt, releasedAt));
        clearLockState();
        inTransaction = false;
    }

    public boolean isLockActive() {
        return currentLockId != null && expiresAt != null && expiresAt.isAfter(clock.instant());
    }

    /**
     * Run {@code body} with the lock held if the statement needs it.
     * <p>
     * Transaction starts and writes acquire; reads run unlocked. On every exit path the lock
     * is released, unless a transaction is open, in which case commit/rollback releases it.
     */
    public <T, E extends Exception> T guardedOperation(String operationText, GuardedOperation<T, E> body) throws E {
        pendingOperation = SqlClassifier.normalize(operationText);
        try {
            switch (SqlClassifier.classify(pendingOperation)) {
                case TRANSACTION_START -> beginTransaction();
                case WRITE -> acquire();
                case READ -> {
                }
            }
            log.debug("Executing statement: '{}'", pendingOperation);
            return body.execute();
        } finally {
            if (!inTransaction) {
                release();
            }
            pendingOperation = null;
        }
    }

    /**
     * Mark a transaction as open and take the lock for it. The lock is kept until
     * commit/rollback. Used for {@code BEGIN} and for JDBC connections with auto-commit off.
     */
    public void beginTransaction() {
        boolean alreadyOpen = inTransaction;
        inTransaction = true;
        try {
            acquire();
        } catch (DatabaseBusyException e) {
            // a new transaction never began
            inTransaction = alreadyOpen;
            throw e;
        }
    }

    /**
     * @throws LockRequiredException if no lock is held; {@code commit} is not invoked
     */
    public <E extends Exception> void commit(TransactionFinalizer<E> commit) throws E {
        finish("commit", commit);
    }

    /**
     * @throws LockRequiredException if no lock is held; {@code rollback} is not invoked
     */
    public <E extends Exception> void rollback(TransactionFinalizer<E> rollback) throws E {
        finish("rollback", rollback);
    }

    /**
     * True if a rollback journal says another transaction may still be in flight. Callers
     * acquire before connecting and skip closing while this holds.
     */
    public boolean crashRecoveryCheck() {
        return crashMarker.exists();
    }

    public boolean isInTransaction() {
        return inTransaction;
    }

    public Optional<String> currentLockId() {
        return Optional.ofNullable(currentLockId);
    }

    public Optional<Instant> acquiredAt() {
        return Optional.ofNullable(acquiredAt);
    }

    public Optional<Instant> expiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public Optional<String> pendingOperation() {
        return Optional.ofNullable(pendingOperation);
    }

    public LockSettings settings() {
        return settings;
    }

    private <E extends Exception> void finish(String action, TransactionFinalizer<E> finalizer) throws E {
        if (!isLockActive()) {
            throw new LockRequiredException("Database lock is required for transaction " + action + ".");
        }
        boolean finished = false;
        try {
            finalizer.finish();
            finished = true;
        } finally {
            if (!finished) {
                log.error("Transaction {} failed. Database lock retained: id='{}'", action, currentLockId);
            }
        }
        log.debug("Transaction {} succeeded. Releasing database lock.", action);
        release();
    }

    private void clearLockState() {
        currentLockId = null;
        acquiredAt = null;
        expiresAt = null;
    }
}
