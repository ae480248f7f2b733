package org.iceforge.efsguard.lock;

/**
 * A transaction boundary was reached without holding the database lock.
 */
public class LockRequiredException extends LockException {
    public LockRequiredException(String message) { super(message); }
}
