package org.iceforge.efsguard.lock;

import java.time.Duration;
import java.util.Objects;

/**
 * Validated settings for one {@link LockManager}.
 *
 * @param resourceKey  lock record key, {@code database#<path>}
 * @param waitTimeout  wall-clock budget for {@link LockManager#acquire()}
 * @param maxAttempts  attempt budget for {@link LockManager#acquire()}
 * @param expiration   lifetime of an acquired lock record
 * @param baseDelay    backoff unit; attempt n sleeps {@code baseDelay * n}
 */
public record LockSettings(
        String resourceKey,
        Duration waitTimeout,
        int maxAttempts,
        Duration expiration,
        Duration baseDelay
) {
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(3);
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(50);

    public LockSettings {
        if (resourceKey == null || resourceKey.isBlank()) {
            throw new LockConfigurationException("Lock resource key is required but not set.");
        }
        if (expiration == null || expiration.isZero() || expiration.isNegative()) {
            throw new LockConfigurationException("efsguard.lock.expiration is required but not set.");
        }
        if (maxAttempts < 1) {
            throw new LockConfigurationException("efsguard.lock.max-attempts must be >= 1, was " + maxAttempts);
        }
        Objects.requireNonNull(waitTimeout, "waitTimeout");
        Objects.requireNonNull(baseDelay, "baseDelay");
    }

    public static String resourceKeyFor(String databasePath) {
        return "database#" + databasePath;
    }

    /**
     * Build settings for the database at {@code databasePath}, applying defaults:
     * a wait timeout that is unset or under one second becomes 3 seconds, an unset
     * attempt count becomes 10.
     */
    public static LockSettings forDatabase(String databasePath, LockProperties props) {
        if (databasePath == null || databasePath.isBlank()) {
            throw new LockConfigurationException("efsguard.datasource.database-path is required but not set.");
        }
        Duration wait = props.getWaitTimeout();
        if (wait == null || wait.compareTo(Duration.ofSeconds(1)) < 0) {
            wait = DEFAULT_WAIT_TIMEOUT;
        }
        int attempts = props.getMaxAttempts() == null ? DEFAULT_MAX_ATTEMPTS : props.getMaxAttempts();
        Duration delay = props.getBaseDelay() == null ? DEFAULT_BASE_DELAY : props.getBaseDelay();
        return new LockSettings(resourceKeyFor(databasePath), wait, attempts, props.getExpiration(), delay);
    }
}
