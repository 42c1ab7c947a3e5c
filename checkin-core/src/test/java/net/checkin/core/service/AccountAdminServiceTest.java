package net.checkin.core.service;

import net.checkin.core.model.Account;
import net.checkin.core.model.CheckinResult;
import net.checkin.core.model.ExecutionAttempt;
import net.checkin.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccountAdminServiceTest {

    static final ZoneId UTC = ZoneId.of("UTC");

    Fakes.MutableClock clock;
    Fakes.InMemoryAccounts accounts;
    Fakes.InMemoryHistory history;
    ScheduleTable schedule;
    AccountAdminService admin;

    @BeforeEach
    void setUp() {
        clock = new Fakes.MutableClock(Instant.parse("2024-03-10T00:00:00Z"));
        accounts = new Fakes.InMemoryAccounts();
        history = new Fakes.InMemoryHistory();
        accounts.history = history;
        schedule = new ScheduleTable(new Fakes.DailyCron(), UTC, clock);
        var collaborators = new ExecutionUnit.Collaborators(accounts, acct -> CheckinResult.ok("ok"), history,
                new NotificationDispatcher(new Fakes.InMemorySettings(null), List.of(), TxRunner.direct(), null),
                TxRunner.direct(), clock, UTC);
        var orchestrator = new CheckinOrchestrator(schedule, collaborators, JitterPolicy.none(), d -> {});
        admin = new AccountAdminService(accounts, orchestrator, TxRunner.direct(), clock);
    }

    @Test
    void create_defaultsTimeAndSchedulesImmediately() throws Exception {
        Account a = admin.create(" alice ", "{\"cookies\":{\"s\":\"1\"}}", null);

        assertEquals("alice", a.name());
        assertEquals("01:00", a.checkinTime());
        assertTrue(a.enabled());
        assertEquals(clock.now(), a.createdAt());
        assertEquals(Instant.parse("2024-03-10T01:00:00Z"), schedule.entryFor(a.id()).orElseThrow().nextFireAt());
    }

    @Test
    void create_normalizesShortTime() throws Exception {
        assertEquals("07:05", admin.create("bob", "x", "7:05").checkinTime());
    }

    @Test
    void create_rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> admin.create("", "x", null));
        assertThrows(IllegalArgumentException.class, () -> admin.create("c", " ", null));
        assertThrows(IllegalArgumentException.class, () -> admin.create("c", "x", "24:00"));
        assertThrows(IllegalArgumentException.class, () -> admin.create("c", "x", "nine"));
        assertEquals(0, schedule.size());
    }

    @Test
    void create_rejectsDuplicateName() throws Exception {
        admin.create("dup", "x", null);
        var e = assertThrows(IllegalArgumentException.class, () -> admin.create("dup", "y", null));
        assertThat(e).hasMessageContaining("already exists");
    }

    @Test
    void disable_removesFromSchedule_enableRestores() throws Exception {
        Account a = admin.create("erin", "x", "09:00");

        Account off = admin.update(a.id(), AccountAdminService.AccountUpdate.enabled(false));
        assertFalse(off.enabled());
        assertTrue(schedule.entryFor(a.id()).isEmpty());

        admin.update(a.id(), AccountAdminService.AccountUpdate.enabled(true));
        assertTrue(schedule.entryFor(a.id()).isPresent());
    }

    @Test
    void update_changesTimeAndKeepsOtherFields() throws Exception {
        Account a = admin.create("frank", "secret", "09:00");
        Account b = admin.update(a.id(), AccountAdminService.AccountUpdate.checkinTime("10:30"));

        assertEquals("10:30", b.checkinTime());
        assertEquals("secret", b.credentials());
        assertEquals(Instant.parse("2024-03-10T10:30:00Z"), schedule.entryFor(a.id()).orElseThrow().nextFireAt());
    }

    @Test
    void update_unknownAccount() {
        assertThrows(NoSuchElementException.class,
                () -> admin.update(77, AccountAdminService.AccountUpdate.enabled(false)));
    }

    @Test
    void delete_removesAccountHistoryAndScheduleEntry() throws Exception {
        Account a = admin.create("gina", "x", "09:00");
        history.append(new ExecutionAttempt(null, a.id(), "gina", true, "ok", LocalDate.of(2024, 3, 9), Instant.EPOCH));

        admin.delete(a.id());

        assertTrue(admin.get(a.id()).isEmpty());
        assertThat(history.attempts).isEmpty();
        assertEquals(0, schedule.size());
        assertThrows(NoSuchElementException.class, () -> admin.delete(a.id()));
    }
}
