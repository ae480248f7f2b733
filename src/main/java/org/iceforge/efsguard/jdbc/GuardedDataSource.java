package org.iceforge.efsguard.jdbc;

import org.iceforge.efsguard.lock.LockManager;
import org.iceforge.efsguard.lock.LockManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * {@link DataSource} whose connections take the distributed lock around writes and transactions.
 * <p>
 * Every {@link #getConnection()} opens a fresh physical connection with its own
 * {@link LockManager}. There is no pooling: a pooled connection would outlive the lock that
 * protected its view of the file.
 */
public class GuardedDataSource implements DataSource {

    private static final Logger log = LoggerFactory.getLogger(GuardedDataSource.class);

    private final ConnectionFactory connections;
    private final LockManagerFactory lockManagers;
    private final List<String> initStatements;

    private PrintWriter logWriter;
    private int loginTimeout;

    public GuardedDataSource(ConnectionFactory connections, LockManagerFactory lockManagers, List<String> initStatements) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.lockManagers = Objects.requireNonNull(lockManagers, "lockManagers");
        this.initStatements = initStatements == null ? List.of() : List.copyOf(initStatements);
    }

    public GuardedDataSource(ConnectionFactory connections, LockManagerFactory lockManagers) {
        this(connections, lockManagers, List.of());
    }

    /**
     * Open a connection. If a rollback journal exists, another transaction may be mid-flight,
     * so the lock is taken before opening; it is released once the connection is up.
     */
    @Override
    public GuardedConnection getConnection() throws SQLException {
        LockManager lock = lockManagers.create();
        if (lock.crashRecoveryCheck()) {
            log.warn("Rollback journal found. Acquiring lock before opening new database connection.");
            lock.acquire();
        }
        try {
            Connection raw = connections.open(loginTimeout);
            try {
                runInitStatements(raw);
            } catch (SQLException e) {
                raw.close();
                throw e;
            }
            return (GuardedConnection) Proxy.newProxyInstance(
                    GuardedDataSource.class.getClassLoader(),
                    new Class<?>[]{GuardedConnection.class},
                    new GuardedConnectionHandler(raw, lock));
        } finally {
            lock.release();
        }
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        throw new SQLFeatureNotSupportedException("Credentials are configured on the data source");
    }

    private void runInitStatements(Connection raw) throws SQLException {
        if (initStatements.isEmpty()) return;
        try (Statement st = raw.createStatement()) {
            for (String sql : initStatements) {
                if (sql == null || sql.isBlank()) continue;
                st.execute(sql);
            }
        }
    }

    @Override
    public PrintWriter getLogWriter() {
        return logWriter;
    }

    @Override
    public void setLogWriter(PrintWriter out) {
        this.logWriter = out;
    }

    @Override
    public void setLoginTimeout(int seconds) {
        this.loginTimeout = seconds;
    }

    @Override
    public int getLoginTimeout() {
        return loginTimeout;
    }

    @Override
    public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("java.util.logging is not used");
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        throw new SQLException("Not a wrapper for " + iface.getName());
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) {
        return iface.isInstance(this);
    }
}
