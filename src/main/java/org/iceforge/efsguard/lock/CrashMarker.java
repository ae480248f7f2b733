package org.iceforge.efsguard.lock;

/**
 * Filesystem signal that a transaction on the protected database was interrupted
 * or is still in flight in another process.
 */
@FunctionalInterface
public interface CrashMarker {

    boolean exists();

    static CrashMarker none() {
        return () -> false;
    }
}
