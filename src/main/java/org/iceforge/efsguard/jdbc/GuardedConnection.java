package org.iceforge.efsguard.jdbc;

import org.iceforge.efsguard.lock.LockManager;

import java.sql.Connection;

/**
 * Connection handed out by {@link GuardedDataSource}; exposes the lock manager it runs under.
 */
public interface GuardedConnection extends Connection {
    LockManager lockManager();
}
