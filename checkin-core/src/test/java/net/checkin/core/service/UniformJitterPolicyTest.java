package net.checkin.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UniformJitterPolicyTest {

    @Test
    void thousandSamples_stayInsideBounds_andVary() {
        JitterPolicy jitter = JitterPolicy.uniform(Duration.ofSeconds(30), Duration.ofSeconds(60));
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            long ms = jitter.nextDelay().toMillis();
            assertTrue(ms >= 30_000 && ms <= 60_000, "out of range: " + ms);
            seen.add(ms);
        }
        assertTrue(seen.size() > 1, "jitter is constant");
    }

    @Test
    void seededRandom_isReproducible() {
        var a = new UniformJitterPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), new Random(7));
        var b = new UniformJitterPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), new Random(7));
        for (int i = 0; i < 20; i++) assertEquals(a.nextDelay(), b.nextDelay());
    }

    @Test
    void equalBounds_returnThatValue() {
        JitterPolicy fixed = JitterPolicy.uniform(Duration.ofSeconds(5), Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(5), fixed.nextDelay());
        assertEquals(Duration.ZERO, JitterPolicy.none().nextDelay());
    }

    @Test
    void invalidBounds_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> JitterPolicy.uniform(Duration.ofSeconds(10), Duration.ofSeconds(5)));
        assertThrows(IllegalArgumentException.class,
                () -> JitterPolicy.uniform(Duration.ofSeconds(-1), Duration.ofSeconds(5)));
    }
}
