package net.checkin.core.spi;

import java.time.Duration;

/** Blocking pause used for jitter; swapped out in tests. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> {
            if (!d.isZero() && !d.isNegative()) Thread.sleep(d.toMillis());
        };
    }
}
