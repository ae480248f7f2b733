package org.iceforge.efsguard.jdbc;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Proxy for objects handed out by guarded statements and connections ({@link ResultSet},
 * {@link DatabaseMetaData}). Their back references lead to the guarded statement and connection,
 * never to the driver's, so nothing reachable from a guarded connection can write unlocked.
 */
final class GuardedResultHandler implements InvocationHandler {

    private final Object delegate;
    private final Statement statementProxy;
    private final Connection connectionProxy;

    private GuardedResultHandler(Object delegate, Statement statementProxy, Connection connectionProxy) {
        this.delegate = delegate;
        this.statementProxy = statementProxy;
        this.connectionProxy = connectionProxy;
    }

    /**
     * Wrap {@code result} if it can lead back to the raw connection.
     *
     * @param statementProxy what {@code ResultSet.getStatement()} answers; null for metadata results
     */
    static Object wrap(Object result, Statement statementProxy, Connection connectionProxy) {
        if (result == null || Proxy.isProxyClass(result.getClass())) {
            return result;
        }
        Class<?> type;
        if (result instanceof ResultSet) {
            type = ResultSet.class;
        } else if (result instanceof DatabaseMetaData) {
            type = DatabaseMetaData.class;
        } else {
            return result;
        }
        return Proxy.newProxyInstance(
                GuardedResultHandler.class.getClassLoader(),
                new Class<?>[]{type},
                new GuardedResultHandler(result, statementProxy, connectionProxy));
    }

    /** {@code unwrap} for every guarded proxy: only the proxy itself is exposed. */
    static Object unwrap(Object proxy, Class<?> iface) throws SQLException {
        if (iface.isInstance(proxy)) {
            return proxy;
        }
        throw new SQLException("Guarded JDBC object does not expose " + iface.getName());
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "Guarded[" + delegate + "]";
            case "unwrap":
                return unwrap(proxy, (Class<?>) args[0]);
            case "isWrapperFor":
                return ((Class<?>) args[0]).isInstance(proxy);
            case "getStatement":
                return statementProxy;
            case "getConnection":
                return connectionProxy;
            default:
                break;
        }
        // result sets reached through metadata belong to no statement
        Statement owner = delegate instanceof DatabaseMetaData ? null : statementProxy;
        return wrap(GuardedConnectionHandler.invokeOn(delegate, method, args), owner, connectionProxy);
    }
}
