package org.iceforge.efsguard.lock;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Distributed lock configuration.
 * <p>
 * Values may come from application.yml or the environment
 * (e.g. {@code EFSGUARD_LOCK_EXPIRATION=30s}).
 */
@ConfigurationProperties(prefix = "efsguard.lock")
public class LockProperties {

    /**
     * Where lock records live.
     * <p>
     * - "dynamodb" (default): a DynamoDB table shared by every process
     * - "local": in-process map, single JVM only
     */
    private String store = "dynamodb";

    /** How long acquire() may keep retrying. Unset or under 1s means 3s. */
    private Duration waitTimeout;

    /** Attempt budget for acquire(). Unset means 10. */
    private Integer maxAttempts;

    /** Lifetime of a lock record. Required. */
    private Duration expiration;

    /** Backoff unit between attempts. */
    private Duration baseDelay;

    /** Suffix of the rollback journal next to the database file. */
    private String markerSuffix = JournalFileCrashMarker.DEFAULT_SUFFIX;

    private DynamoDb dynamodb = new DynamoDb();

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Duration getWaitTimeout() {
        return waitTimeout;
    }

    public void setWaitTimeout(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    public Integer getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(Integer maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getExpiration() {
        return expiration;
    }

    public void setExpiration(Duration expiration) {
        this.expiration = expiration;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public String getMarkerSuffix() {
        return markerSuffix;
    }

    public void setMarkerSuffix(String markerSuffix) {
        this.markerSuffix = markerSuffix;
    }

    public DynamoDb getDynamodb() {
        return dynamodb;
    }

    public void setDynamodb(DynamoDb dynamodb) {
        this.dynamodb = dynamodb;
    }

    public static class DynamoDb {

        /** Lock table name. Required when store=dynamodb. */
        private String table;

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }
    }
}
