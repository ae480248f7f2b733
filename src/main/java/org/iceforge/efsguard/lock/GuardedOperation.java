package org.iceforge.efsguard.lock;

/**
 * A database call run under {@link LockManager#guardedOperation(String, GuardedOperation)}.
 */
@FunctionalInterface
public interface GuardedOperation<T, E extends Exception> {
    T execute() throws E;
}
