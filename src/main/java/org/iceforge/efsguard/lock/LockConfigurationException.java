package org.iceforge.efsguard.lock;

/**
 * A required lock setting is missing or invalid.
 */
public class LockConfigurationException extends LockException {
    public LockConfigurationException(String message) { super(message); }
}
