package org.iceforge.efsguard.lock;

/**
 * The remote lock store failed for a reason other than a condition check.
 */
public class LockStoreException extends LockException {

    private final boolean clientSide;

    public LockStoreException(String message, Throwable cause, boolean clientSide) {
        super(message, cause);
        this.clientSide = clientSide;
    }

    /** True for network / SDK-side failures, false for errors returned by the service. */
    public boolean isClientSide() {
        return clientSide;
    }
}
