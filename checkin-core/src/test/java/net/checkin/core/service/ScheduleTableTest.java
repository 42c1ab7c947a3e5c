package net.checkin.core.service;

import net.checkin.core.model.Account;
import net.checkin.core.model.AccountRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleTableTest {

    static final ZoneId UTC = ZoneId.of("UTC");

    Fakes.MutableClock clock;
    Fakes.InMemoryAccounts accounts;
    ScheduleTable table;

    @BeforeEach
    void setUp() {
        clock = new Fakes.MutableClock(Instant.parse("2024-03-10T00:00:00Z"));
        accounts = new Fakes.InMemoryAccounts();
        table = new ScheduleTable(new Fakes.DailyCron(), UTC, clock);
    }

    @Test
    void rebuild_thenDue_firesEachAccountOncePerOccurrence() {
        Account alice = accounts.put("alice", "01:00", true);
        assertEquals(1, table.rebuild(accounts.listEnabled()));
        assertEquals(Instant.parse("2024-03-10T01:00:00Z"), table.entryFor(alice.id()).orElseThrow().nextFireAt());

        assertTrue(table.due(Instant.parse("2024-03-10T00:59:59Z")).isEmpty());

        Instant t = Instant.parse("2024-03-10T01:00:30Z");
        assertThat(table.due(t)).containsExactly(alice.ref());
        // same occurrence, second check
        assertThat(table.due(t.plusSeconds(60))).isEmpty();
        assertEquals(Instant.parse("2024-03-11T01:00:00Z"), table.entryFor(alice.id()).orElseThrow().nextFireAt());
    }

    @Test
    void disabledAccount_isExcludedAfterRebuild() {
        Account bob = accounts.put("bob", "02:00", true);
        table.rebuild(accounts.listEnabled());

        accounts.replace(new Account(bob.id(), "bob", bob.credentials(), false, "02:00", null, null));
        assertEquals(0, table.rebuild(accounts.listEnabled()));

        assertThat(table.due(Instant.parse("2024-03-10T02:00:00Z"))).isEmpty();
        assertThat(table.snapshot()).isEmpty();
    }

    @Test
    void rebuild_ignoresDisabledFlagEvenWhenPassedIn() {
        accounts.put("carol", "03:00", false);
        assertEquals(0, table.rebuild(accounts.listAll()));
    }

    @Test
    void malformedTime_isSkippedOthersStillScheduled() {
        accounts.put("broken", "25:99", true);
        Account ok = accounts.put("ok", "04:15", true);

        assertEquals(1, table.rebuild(accounts.listEnabled()));
        assertThat(table.snapshot()).extracting(e -> e.account().name()).containsExactly("ok");
        assertEquals("0 15 4 * * ?", table.entryFor(ok.id()).orElseThrow().cronExpr());

        // a missing time is malformed too, and must not abort the whole rebuild
        Account noTime = new Account(99L, "no-time", "{\"cookies\":{}}", true, null, null, null);
        List<Account> withNull = new ArrayList<>(accounts.listEnabled());
        withNull.add(0, noTime);
        assertEquals(1, table.rebuild(withNull));
        assertThat(table.snapshot()).extracting(e -> e.account().name()).containsExactly("ok");
    }

    @Test
    void timeAlreadyPassedToday_schedulesTomorrow() {
        clock.set(Instant.parse("2024-03-10T05:00:00Z"));
        Account a = accounts.put("late", "01:00", true);
        table.rebuild(accounts.listEnabled());
        assertEquals(Instant.parse("2024-03-11T01:00:00Z"), table.entryFor(a.id()).orElseThrow().nextFireAt());
    }

    @Test
    void changedTriggerTime_takesEffectOnRebuild() {
        Account a = accounts.put("dave", "06:00", true);
        table.rebuild(accounts.listEnabled());

        accounts.replace(new Account(a.id(), "dave", a.credentials(), true, "07:30", null, null));
        table.rebuild(accounts.listEnabled());

        assertThat(table.due(Instant.parse("2024-03-10T06:00:00Z"))).isEmpty();
        assertThat(table.due(Instant.parse("2024-03-10T07:30:00Z"))).containsExactly(a.ref());
    }

    @Test
    void dueOccurrence_survivesRebuildWhenTimeUnchanged() {
        Account a = accounts.put("erin", "01:00", true);
        table.rebuild(accounts.listEnabled());

        // edit lands after 01:00 but before the timer wakes
        clock.set(Instant.parse("2024-03-10T01:00:20Z"));
        accounts.put("frank", "09:00", true);
        table.rebuild(accounts.listEnabled());

        assertThat(table.due(Instant.parse("2024-03-10T01:00:40Z"))).containsExactly(a.ref());
    }

    @Test
    void due_ordersByFireTimeThenName_andSkipsMissedDaysWithoutBurst() {
        Account b = accounts.put("b", "01:00", true);
        Account a = accounts.put("a", "01:00", true);
        Account c = accounts.put("c", "00:30", true);
        table.rebuild(accounts.listEnabled());

        // timer stalled for three days
        Instant late = Instant.parse("2024-03-13T12:00:00Z");
        List<AccountRef> due = table.due(late);
        assertThat(due).containsExactly(c.ref(), a.ref(), b.ref());
        assertThat(table.due(late.plus(Duration.ofHours(1)))).isEmpty();
        assertEquals(Instant.parse("2024-03-14T01:00:00Z"), table.entryFor(a.id()).orElseThrow().nextFireAt());
    }

    @Test
    void snapshot_isImmutable() {
        accounts.put("gina", "01:00", true);
        table.rebuild(accounts.listEnabled());
        var snap = table.snapshot();
        org.junit.jupiter.api.Assertions.assertThrows(UnsupportedOperationException.class, snap::clear);
        assertEquals(1, table.size());
    }
}
