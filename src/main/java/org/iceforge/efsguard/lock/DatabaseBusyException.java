package org.iceforge.efsguard.lock;

/**
 * The database lock could not be acquired within the attempt and time budget.
 */
public class DatabaseBusyException extends LockException {
    public DatabaseBusyException(String message, Throwable cause) { super(message, cause); }
    public DatabaseBusyException(String message) { super(message); }
}
