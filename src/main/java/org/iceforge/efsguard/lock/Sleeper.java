package org.iceforge.efsguard.lock;

import java.time.Duration;

/**
 * Blocking pause between acquisition attempts. Swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}
