package net.checkin.core.service;

import net.checkin.core.model.Account;
import net.checkin.core.model.AccountRef;
import net.checkin.core.model.ScheduleEntry;
import net.checkin.core.model.TriggerTime;
import net.checkin.core.spi.Clock;
import net.checkin.core.spi.CronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory index of account -> next fire instant.
 * {@link #rebuild} and {@link #due} run under one lock; the table is replaced wholesale on rebuild.
 */
public final class ScheduleTable {
    private static final Logger log = LoggerFactory.getLogger(ScheduleTable.class);

    private static final Comparator<ScheduleEntry> FIRE_ORDER =
            Comparator.comparing(ScheduleEntry::nextFireAt).thenComparing(e -> e.account().name());

    private final CronCalculator cron;
    private final ZoneId zone;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private Map<Long, ScheduleEntry> entries = new LinkedHashMap<>();

    public ScheduleTable(CronCalculator cron, ZoneId zone, Clock clock) {
        this.cron = cron;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * Recomputes one entry per enabled account with a valid trigger time.
     * An occurrence that is already due and not yet fired survives the rebuild
     * when the account's trigger time is unchanged.
     *
     * @return number of scheduled accounts
     */
    public int rebuild(List<Account> accounts) {
        lock.lock();
        try {
            Instant now = clock.now();
            Map<Long, ScheduleEntry> next = new LinkedHashMap<>();
            for (Account a : accounts) {
                if (!a.enabled()) continue;
                if (a.id() == null) {
                    log.warn("Skipping account '{}' without id", a.name());
                    continue;
                }
                TriggerTime time;
                try {
                    time = TriggerTime.parse(a.checkinTime());
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping account '{}': {}", a.name(), e.getMessage());
                    continue;
                }
                String expr = time.toCronExpression();
                ScheduleEntry previous = entries.get(a.id());
                if (previous != null && previous.triggerTime().equals(time) && previous.isDue(now)) {
                    next.put(a.id(), new ScheduleEntry(a.ref(), time, expr, previous.nextFireAt()));
                    continue;
                }
                Instant fireAt;
                try {
                    fireAt = cron.next(now, expr, zone);
                } catch (RuntimeException e) {
                    log.warn("Skipping account '{}': cannot compute next fire for [{}]: {}", a.name(), expr, e.getMessage());
                    continue;
                }
                next.put(a.id(), new ScheduleEntry(a.ref(), time, expr, fireAt));
            }
            entries = next;
            log.info("Schedule rebuilt: {} account(s) scheduled", next.size());
            if (log.isDebugEnabled()) {
                next.values().forEach(e -> log.debug("  {} at {} -> next {}", e.account(), e.triggerTime(), e.nextFireAt()));
            }
            return next.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every account whose next fire instant is at or before {@code now}
     * and moves each returned entry to its next occurrence after {@code now}.
     */
    public List<AccountRef> due(Instant now) {
        lock.lock();
        try {
            List<ScheduleEntry> fired = new ArrayList<>();
            for (ScheduleEntry e : entries.values()) {
                if (e.isDue(now)) fired.add(e);
            }
            if (fired.isEmpty()) return List.of();

            fired.sort(FIRE_ORDER);
            List<AccountRef> out = new ArrayList<>(fired.size());
            for (ScheduleEntry e : fired) {
                Instant following;
                try {
                    following = cron.next(now, e.cronExpr(), zone);
                } catch (RuntimeException ex) {
                    // drop it rather than fire it again on every tick
                    log.warn("Unscheduling {}: cannot compute next fire: {}", e.account(), ex.getMessage());
                    entries.remove(e.account().id());
                    out.add(e.account());
                    continue;
                }
                entries.put(e.account().id(), e.advancedTo(following));
                out.add(e.account());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public List<ScheduleEntry> snapshot() {
        lock.lock();
        try {
            List<ScheduleEntry> list = new ArrayList<>(entries.values());
            list.sort(FIRE_ORDER);
            return List.copyOf(list);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ScheduleEntry> entryFor(long accountId) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(accountId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public ZoneId zone() { return zone; }
}
