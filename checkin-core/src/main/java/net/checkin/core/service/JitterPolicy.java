package net.checkin.core.service;

import java.time.Duration;
import java.util.Random;

public interface JitterPolicy {
    Duration nextDelay();

    /** Uniform delay in {@code [min, max]}, millisecond resolution. */
    static JitterPolicy uniform(Duration min, Duration max) {
        return new UniformJitterPolicy(min, max, new Random());
    }

    static JitterPolicy none() {
        return () -> Duration.ZERO;
    }
}
