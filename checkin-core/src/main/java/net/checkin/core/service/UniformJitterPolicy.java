package net.checkin.core.service;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

final class UniformJitterPolicy implements JitterPolicy {
    private final long minMs;
    private final long maxMs;
    private final Random random;

    UniformJitterPolicy(Duration min, Duration max, Random random) {
        Objects.requireNonNull(min); Objects.requireNonNull(max);
        if (min.isNegative()) throw new IllegalArgumentException("jitter min must be >= 0: " + min);
        if (max.compareTo(min) < 0) throw new IllegalArgumentException("jitter max < min: " + max + " < " + min);
        this.minMs = min.toMillis();
        this.maxMs = max.toMillis();
        this.random = random;
    }

    @Override
    public Duration nextDelay() {
        if (minMs == maxMs) return Duration.ofMillis(minMs);
        return Duration.ofMillis(random.nextLong(minMs, maxMs + 1));
    }

    Duration min() { return Duration.ofMillis(minMs); }
    Duration max() { return Duration.ofMillis(maxMs); }
}
