package org.iceforge.efsguard.jdbc;

import org.iceforge.efsguard.lock.SqlClassifier;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Statement proxy: every execute call runs as a guarded operation on the owning connection.
 * Batches are classified by their first write, so a batch with any write takes the lock.
 * Result sets come back wrapped so {@code getStatement()} answers this proxy.
 */
final class GuardedStatementHandler implements InvocationHandler {

    private final Statement delegate;
    private final String preparedSql;
    private final GuardedConnectionHandler connection;
    private final Connection connectionProxy;
    private final List<String> batch = new ArrayList<>();

    GuardedStatementHandler(Statement delegate, String preparedSql,
                            GuardedConnectionHandler connection, Connection connectionProxy) {
        this.delegate = delegate;
        this.preparedSql = preparedSql;
        this.connection = connection;
        this.connectionProxy = connectionProxy;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "GuardedStatement[" + (preparedSql == null ? "" : preparedSql) + "]";
            case "getConnection":
                return connectionProxy;
            case "unwrap":
                return GuardedResultHandler.unwrap(proxy, (Class<?>) args[0]);
            case "isWrapperFor":
                return ((Class<?>) args[0]).isInstance(proxy);
            case "addBatch":
                batch.add(sqlArgument(args));
                break;
            case "clearBatch":
                batch.clear();
                break;
            case "executeBatch":
            case "executeLargeBatch":
                try {
                    return connection.guard(batchSql(), () -> GuardedConnectionHandler.invokeOn(delegate, method, args));
                } finally {
                    batch.clear();
                }
            case "execute":
            case "executeQuery":
            case "executeUpdate":
            case "executeLargeUpdate":
                return wrapResult(proxy, connection.guard(sqlArgument(args),
                        () -> GuardedConnectionHandler.invokeOn(delegate, method, args)));
            default:
                break;
        }
        return wrapResult(proxy, GuardedConnectionHandler.invokeOn(delegate, method, args));
    }

    private Object wrapResult(Object proxy, Object result) {
        return GuardedResultHandler.wrap(result, (Statement) proxy, connectionProxy);
    }

    /** SQL text passed to the call, or the prepared statement's SQL for the no-arg variants. */
    private String sqlArgument(Object[] args) {
        if (args != null && args.length > 0 && args[0] instanceof String sql) {
            return sql;
        }
        return preparedSql;
    }

    private String batchSql() {
        for (String sql : batch) {
            if (SqlClassifier.isWrite(sql)) {
                return sql;
            }
        }
        return batch.isEmpty() ? preparedSql : batch.get(0);
    }
}
