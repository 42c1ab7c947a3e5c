package net.checkin.core.service;

import net.checkin.core.model.Account;
import net.checkin.core.model.AccountRef;
import net.checkin.core.model.CheckinResult;
import net.checkin.core.model.ExecutionAttempt;
import net.checkin.core.spi.AccountRepository;
import net.checkin.core.spi.CheckinExecutor;
import net.checkin.core.spi.Clock;
import net.checkin.core.spi.HistoryRecorder;
import net.checkin.core.spi.Sleeper;
import net.checkin.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * One firing of one account: jitter, execute, record, notify.
 * Runs once; never throws past {@link #run()}.
 */
public final class ExecutionUnit implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionUnit.class);

    public enum State {
        PENDING, JITTERING, EXECUTING, RECORDED, NOTIFIED, DONE,
        /** Not executed: account gone, disabled or without credentials. Nothing recorded. */
        SKIPPED,
        /** Executor or internal fault. Recorded unless the append itself failed. */
        FAULTED;

        public boolean terminal() { return this == DONE || this == SKIPPED || this == FAULTED; }
    }

    public enum Trigger { SCHEDULED, MANUAL }

    /** Collaborators shared by every unit of one orchestrator. */
    public record Collaborators(
            AccountRepository accounts,
            CheckinExecutor executor,
            HistoryRecorder history,
            NotificationDispatcher dispatcher,
            TxRunner tx,
            Clock clock,
            ZoneId zone
    ) {}

    private final AccountRef account;
    private final Trigger trigger;
    private final Collaborators c;
    private final JitterPolicy jitter;
    private final Sleeper sleeper;

    private volatile State state = State.PENDING;
    private volatile ExecutionAttempt attempt;
    private volatile DispatchReport dispatch = DispatchReport.none();
    private volatile String skipReason;

    ExecutionUnit(AccountRef account, Trigger trigger, Collaborators c, JitterPolicy jitter, Sleeper sleeper) {
        this.account = account;
        this.trigger = trigger;
        this.c = c;
        this.jitter = jitter;
        this.sleeper = sleeper;
    }

    @Override
    public void run() {
        if (state != State.PENDING) throw new IllegalStateException("unit already ran: " + account);
        try {
            runSteps();
        } catch (Throwable e) {
            state = State.FAULTED;
            log.error("Check-in unit for {} faulted in an unexpected place", account, e);
        }
    }

    private void runSteps() throws Exception {
        if (trigger == Trigger.SCHEDULED) {
            moveTo(State.JITTERING);
            Duration delay = jitter.nextDelay();
            log.debug("{}: jitter {} ms", account, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                skip("interrupted during jitter");
                return;
            }
        }

        // re-read right before executing: a just-disabled account must not run
        Optional<Account> current = c.tx().required(() -> c.accounts().get(account.id()));
        if (current.isEmpty()) { skip("account no longer exists"); return; }
        Account acct = current.get();
        if (!acct.enabled()) { skip("account is disabled"); return; }
        if (!acct.hasCredentials()) { skip("account has no credential payload"); return; }

        moveTo(State.EXECUTING);
        boolean executorFault = false;
        CheckinResult result;
        try {
            result = c.executor().execute(acct);
            if (result == null) result = CheckinResult.failed("executor returned no result");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorFault = true;
            result = CheckinResult.fault(e);
        } catch (Throwable t) {
            // errors from a pluggable executor are recorded like any other fault
            executorFault = true;
            result = CheckinResult.fault(t);
            log.warn("Executor fault for {}: {}", account, result.message(), t);
        }

        Instant at = c.clock().now();
        ExecutionAttempt pending = ExecutionAttempt.of(acct.ref(), result, LocalDate.ofInstant(at, c.zone()), at);
        try {
            attempt = c.tx().requiresNew(() -> c.history().append(pending));
        } catch (Exception e) {
            state = State.FAULTED;
            // fallback record: the process log is the only trace left
            log.error("History append failed, attempt NOT recorded: account={} success={} date={} at={} message={}",
                    account, pending.success(), pending.checkinDate(), pending.createdAt(), pending.message(), e);
            return;
        }
        moveTo(State.RECORDED);
        log.info("Check-in for {} ({}): {} - {}", account.name(), trigger,
                result.success() ? "Success" : "Failed", result.message());

        try {
            dispatch = c.dispatcher().notify(acct.name(), result.success(), result.message());
        } catch (RuntimeException e) {
            state = State.FAULTED;
            log.error("Notification dispatch for {} faulted; attempt stays recorded", account, e);
            return;
        }
        moveTo(State.NOTIFIED);
        state = executorFault ? State.FAULTED : State.DONE;
    }

    private void moveTo(State next) {
        log.debug("{}: {} -> {}", account, state, next);
        state = next;
    }

    private void skip(String reason) {
        skipReason = reason;
        state = State.SKIPPED;
        log.warn("Check-in for {} skipped: {}", account, reason);
    }

    public AccountRef account() { return account; }
    public Trigger trigger() { return trigger; }
    public State state() { return state; }
    public Optional<ExecutionAttempt> attempt() { return Optional.ofNullable(attempt); }
    public DispatchReport dispatch() { return dispatch; }
    public Optional<String> skipReason() { return Optional.ofNullable(skipReason); }

    @Override public String toString() {
        return "ExecutionUnit{" + account + ", " + trigger + ", " + state + '}';
    }
}
