package net.checkin.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background ticker: wakes every {@code interval} and runs one orchestrator tick.
 * Units run on a separate cached pool so a slow check-in never delays the next wake.
 */
public final class CheckinTimerLoop {
    private static final Logger log = LoggerFactory.getLogger(CheckinTimerLoop.class);

    private final CheckinOrchestrator orchestrator;
    private final Duration interval;
    private final Duration shutdownTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService ticker;
    private ExecutorService units;
    private ScheduledFuture<?> future;

    public CheckinTimerLoop(CheckinOrchestrator orchestrator, Duration interval, Duration shutdownTimeout) {
        if (interval.isZero() || interval.isNegative()) throw new IllegalArgumentException("interval must be positive");
        this.orchestrator = orchestrator;
        this.interval = interval;
        this.shutdownTimeout = shutdownTimeout;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) return;
        ticker = Executors.newSingleThreadScheduledExecutor(named("checkin-timer", false));
        units = Executors.newCachedThreadPool(named("checkin-unit-", true));
        long ms = interval.toMillis();
        future = ticker.scheduleWithFixedDelay(this::wake, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Check-in timer started (interval {} ms)", ms);
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) return;
        log.info("Stopping check-in timer...");
        future.cancel(false);
        ticker.shutdown();
        // in-flight units may finish; nothing new is accepted
        units.shutdown();
        long budget = shutdownTimeout.toMillis();
        try {
            if (!ticker.awaitTermination(budget, TimeUnit.MILLISECONDS)) {
                log.warn("Timer thread did not stop within {} ms", budget);
            }
            if (!units.awaitTermination(budget, TimeUnit.MILLISECONDS)) {
                log.warn("Check-in units still running after {} ms; leaving them to finish", budget);
            } else {
                log.info("Check-in timer stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Check-in timer shutdown interrupted.");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void wake() {
        if (!running.get()) return;
        try {
            orchestrator.tick(units);
        } catch (RuntimeException e) {
            log.error("Check-in tick failed; timer keeps running", e);
        }
    }

    private static ThreadFactory named(String prefix, boolean numbered) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, numbered ? prefix + seq.incrementAndGet() : prefix);
            t.setDaemon(true);
            return t;
        };
    }
}
