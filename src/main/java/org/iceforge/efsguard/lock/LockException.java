package org.iceforge.efsguard.lock;

/**
 * Base type for failures surfaced by the lock manager.
 */
public class LockException extends RuntimeException {
    public LockException(String message, Throwable cause) { super(message, cause); }
    public LockException(String message) { super(message); }
}
