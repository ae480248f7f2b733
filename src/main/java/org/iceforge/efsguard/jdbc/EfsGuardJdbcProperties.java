package org.iceforge.efsguard.jdbc;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The protected database.
 * <p>
 * {@code databasePath} names the file on the shared filesystem. It is the lock's identity
 * and the base of the rollback journal path, so every process must configure the same path.
 */
@ConfigurationProperties(prefix = "efsguard.datasource")
public class EfsGuardJdbcProperties {

    /**
     * SQLite settings for a database on a network filesystem: full fsync, temp data and cache
     * pages kept in memory (256 MB cache, 256 MB mmap).
     */
    public static final List<String> DEFAULT_INIT_STATEMENTS = List.of(
            "PRAGMA synchronous = EXTRA",
            "PRAGMA temp_store = MEMORY",
            "PRAGMA cache_spill = FALSE",
            "PRAGMA cache_size = -268435456",
            "PRAGMA mmap_size = 268435456");

    /** JDBC URL, e.g. jdbc:sqlite:/mnt/efs/app.db. */
    private String jdbcUrl;

    /** Database file path on the shared filesystem. */
    private String databasePath;

    /** Optional username. */
    private String username;

    /** Optional password. */
    private String password;

    /** Driver-specific connection properties. */
    private Map<String, String> properties = new HashMap<>();

    /**
     * Statements run on every new connection. Unset means {@link #DEFAULT_INIT_STATEMENTS};
     * an empty list runs nothing.
     */
    private List<String> initStatements;

    /** Seconds to wait for a physical connection; 0 leaves the driver default. */
    private int loginTimeout;

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, String> properties) {
        this.properties = properties;
    }

    public List<String> getInitStatements() {
        return initStatements;
    }

    public void setInitStatements(List<String> initStatements) {
        this.initStatements = initStatements;
    }

    public List<String> resolveInitStatements() {
        return initStatements == null ? DEFAULT_INIT_STATEMENTS : initStatements;
    }

    public int getLoginTimeout() {
        return loginTimeout;
    }

    public void setLoginTimeout(int loginTimeout) {
        this.loginTimeout = loginTimeout;
    }
}
