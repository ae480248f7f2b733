package org.iceforge.efsguard.lock;

import java.time.Clock;
import java.util.Objects;

/**
 * Creates one {@link LockManager} per connection; managers never share state.
 */
public class LockManagerFactory {

    private final LockSettings settings;
    private final LockStore store;
    private final CrashMarker crashMarker;
    private final Clock clock;
    private final Sleeper sleeper;

    public LockManagerFactory(LockSettings settings, LockStore store, CrashMarker crashMarker, Clock clock, Sleeper sleeper) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.store = Objects.requireNonNull(store, "store");
        this.crashMarker = Objects.requireNonNull(crashMarker, "crashMarker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public LockManagerFactory(LockSettings settings, LockStore store, CrashMarker crashMarker) {
        this(settings, store, crashMarker, Clock.systemUTC(), Sleeper.system());
    }

    public LockManager create() {
        return new LockManager(settings, store, crashMarker, clock, sleeper);
    }

    public LockSettings settings() {
        return settings;
    }
}
