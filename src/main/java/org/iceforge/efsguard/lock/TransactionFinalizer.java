package org.iceforge.efsguard.lock;

/**
 * The underlying commit or rollback call.
 */
@FunctionalInterface
public interface TransactionFinalizer<E extends Exception> {
    void finish() throws E;
}
