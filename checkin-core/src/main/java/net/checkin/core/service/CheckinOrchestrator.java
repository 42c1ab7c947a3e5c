package net.checkin.core.service;

import net.checkin.core.model.Account;
import net.checkin.core.model.AccountRef;
import net.checkin.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ties the schedule table to execution units.
 * Owns the {@link ScheduleTable}; everything else is a collaborator.
 */
public final class CheckinOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CheckinOrchestrator.class);

    private final ScheduleTable schedule;
    private final ExecutionUnit.Collaborators collaborators;
    private final JitterPolicy jitter;
    private final Sleeper sleeper;

    public CheckinOrchestrator(ScheduleTable schedule,
                               ExecutionUnit.Collaborators collaborators,
                               JitterPolicy jitter,
                               Sleeper sleeper) {
        this.schedule = schedule;
        this.collaborators = collaborators;
        this.jitter = jitter;
        this.sleeper = sleeper;
    }

    /** One timer wake: hand every due account to {@code units}, fire-and-forget. */
    public int tick(Executor units) {
        List<AccountRef> due = schedule.due(collaborators.clock().now());
        int started = 0;
        for (AccountRef ref : due) {
            ExecutionUnit unit = newUnit(ref, ExecutionUnit.Trigger.SCHEDULED);
            try {
                units.execute(unit);
                started++;
            } catch (RejectedExecutionException e) {
                log.warn("Not starting check-in for {}: scheduler is shutting down", ref);
            }
        }
        if (started > 0) log.info("Dispatched {} scheduled check-in(s)", started);
        return started;
    }

    /** Re-reads the enabled accounts and rebuilds the schedule. */
    public int reconcile() throws Exception {
        List<Account> enabled = collaborators.tx().required(() -> collaborators.accounts().listEnabled());
        return schedule.rebuild(enabled);
    }

    /**
     * Runs one unit now on the caller's thread, without jitter.
     *
     * @return the finished unit, or empty when no account has this id
     */
    public Optional<ExecutionUnit> triggerNow(long accountId) throws Exception {
        Optional<Account> acct = collaborators.tx().required(() -> collaborators.accounts().get(accountId));
        if (acct.isEmpty()) {
            log.warn("Manual check-in requested for unknown account id {}", accountId);
            return Optional.empty();
        }
        ExecutionUnit unit = newUnit(acct.get().ref(), ExecutionUnit.Trigger.MANUAL);
        unit.run();
        return Optional.of(unit);
    }

    ExecutionUnit newUnit(AccountRef ref, ExecutionUnit.Trigger trigger) {
        return new ExecutionUnit(ref, trigger, collaborators, jitter, sleeper);
    }

    public ScheduleTable schedule() { return schedule; }
}
