package net.checkin.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Quartz-style cron evaluation on top of cron-utils, with a small LRU of parsed expressions. */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    // one expression per distinct trigger time, so 256 is plenty
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /** First fire instant strictly after {@code from}, evaluated on {@code zone}'s wall clock. */
    public static Instant nextAfter(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(from);

        ExecutionTime et = executionTime(cronExpr);
        ZonedDateTime base = from.atZone(zone);
        ZonedDateTime next = et.nextExecution(base).orElseThrow(
                () -> new IllegalStateException("No next execution for [" + cronExpr + "] at " + base));
        if (!next.toInstant().isAfter(from)) {
            ZonedDateTime probe = next;
            next = et.nextExecution(probe.plusSeconds(1)).orElseThrow(
                    () -> new IllegalStateException("No next execution for [" + cronExpr + "] after " + probe));
        }
        return next.toInstant();
    }

    /** Throws {@link IllegalArgumentException} when the expression does not parse. */
    public static void validate(String cronExpr) {
        executionTime(cronExpr);
    }

    private static ExecutionTime executionTime(String cronExpr) {
        synchronized (CACHE) {
            return CACHE.computeIfAbsent(cronExpr, expr -> ExecutionTime.forCron(PARSER.parse(expr)));
        }
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
