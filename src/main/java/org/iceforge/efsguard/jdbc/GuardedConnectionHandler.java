package org.iceforge.efsguard.jdbc;

import org.iceforge.efsguard.lock.GuardedOperation;
import org.iceforge.efsguard.lock.LockManager;
import org.iceforge.efsguard.lock.SqlClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * Connection proxy routing transaction boundaries and statements through a {@link LockManager}.
 * <p>
 * JDBC has no BEGIN statement: turning auto-commit off is the transaction start, and with
 * auto-commit off every statement after a commit/rollback implicitly opens the next one.
 */
final class GuardedConnectionHandler implements InvocationHandler {

    private static final Logger log = LoggerFactory.getLogger(GuardedConnectionHandler.class);

    private final Connection delegate;
    private final LockManager lock;
    private boolean closed;

    GuardedConnectionHandler(Connection delegate, LockManager lock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.lock = Objects.requireNonNull(lock, "lock");
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        switch (method.getName()) {
            case "lockManager":
                return lock;
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "GuardedConnection[" + lock.settings().resourceKey() + "]";
            case "unwrap":
                return GuardedResultHandler.unwrap(proxy, (Class<?>) args[0]);
            case "isWrapperFor":
                return ((Class<?>) args[0]).isInstance(proxy);
            case "getMetaData":
                return GuardedResultHandler.wrap(invokeOn(delegate, method, args), null, (Connection) proxy);
            case "isClosed":
                return closed || delegate.isClosed();
            case "createStatement":
                return wrap((Connection) proxy, (Statement) invokeOn(delegate, method, args), null, Statement.class);
            case "prepareStatement":
                return wrap((Connection) proxy, (Statement) invokeOn(delegate, method, args), (String) args[0], PreparedStatement.class);
            case "prepareCall":
                return wrap((Connection) proxy, (Statement) invokeOn(delegate, method, args), (String) args[0], CallableStatement.class);
            case "setAutoCommit":
                setAutoCommit((Boolean) args[0]);
                return null;
            case "commit":
                lock.commit(delegate::commit);
                return null;
            case "rollback":
                if (args == null || args.length == 0) {
                    lock.rollback(delegate::rollback);
                    return null;
                }
                // rollback to a savepoint keeps the transaction (and the lock)
                break;
            case "close":
                close();
                return null;
            default:
                break;
        }
        return invokeOn(delegate, method, args);
    }

    /**
     * Run a statement under the lock. With auto-commit off the statement belongs to a
     * transaction, so the lock is held until commit/rollback.
     */
    Object guard(String sql, GuardedOperation<Object, Exception> body) throws Exception {
        if (!delegate.getAutoCommit() && !lock.isInTransaction()) {
            lock.beginTransaction();
        }
        return lock.guardedOperation(sql, body);
    }

    private void setAutoCommit(boolean autoCommit) throws SQLException {
        boolean current = delegate.getAutoCommit();
        if (!autoCommit && current) {
            lock.guardedOperation(SqlClassifier.TRANSACTION_BEGIN_KEYWORD, () -> {
                delegate.setAutoCommit(false);
                return null;
            });
        } else if (autoCommit && !current && lock.isInTransaction()) {
            // switching auto-commit back on commits the open transaction
            lock.commit(() -> delegate.setAutoCommit(true));
        } else {
            delegate.setAutoCommit(autoCommit);
        }
    }

    /**
     * Close the connection. An open transaction is rolled back by the driver, so the lock is
     * (re)taken first. Without a transaction, a rollback journal means another process may be
     * mid-transaction and closing is skipped.
     */
    private void close() throws SQLException {
        if (closed) return;
        if (lock.isInTransaction()) {
            lock.acquire();
        } else if (lock.crashRecoveryCheck()) {
            log.warn("Rollback journal exists. Skip database connection closure.");
            return;
        }
        try {
            delegate.close();
            closed = true;
        } finally {
            lock.release();
        }
    }

    private <S extends Statement> Object wrap(Connection connectionProxy, Statement raw, String sql, Class<S> type) {
        return Proxy.newProxyInstance(
                GuardedConnectionHandler.class.getClassLoader(),
                new Class<?>[]{type},
                new GuardedStatementHandler(raw, sql, this, connectionProxy));
    }

    static Object invokeOn(Object target, Method method, Object[] args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }
}
