package net.checkin.core.service;

import net.checkin.core.model.Account;
import net.checkin.core.model.TriggerTime;
import net.checkin.core.spi.AccountRepository;
import net.checkin.core.spi.Clock;
import net.checkin.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Account writes. Every change is committed first, then the schedule is reconciled
 * before the call returns.
 */
public final class AccountAdminService {
    private static final Logger log = LoggerFactory.getLogger(AccountAdminService.class);

    private final AccountRepository accounts;
    private final CheckinOrchestrator orchestrator;
    private final TxRunner tx;
    private final Clock clock;

    public AccountAdminService(AccountRepository accounts, CheckinOrchestrator orchestrator, TxRunner tx, Clock clock) {
        this.accounts = accounts;
        this.orchestrator = orchestrator;
        this.tx = tx;
        this.clock = clock;
    }

    /** Partial update; null fields stay as they are. */
    public record AccountUpdate(Boolean enabled, String checkinTime, String credentials) {
        public static AccountUpdate enabled(boolean enabled) { return new AccountUpdate(enabled, null, null); }
        public static AccountUpdate checkinTime(String time) { return new AccountUpdate(null, time, null); }
        public static AccountUpdate credentials(String credentials) { return new AccountUpdate(null, null, credentials); }
    }

    public Account create(String name, String credentials, String checkinTime) throws Exception {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        requireCredentials(credentials);
        String time = normalizeTime(checkinTime == null || checkinTime.isBlank() ? Account.DEFAULT_CHECKIN_TIME : checkinTime);
        String trimmed = name.trim();

        Account stored = tx.required(() -> {
            if (accounts.findByName(trimmed).isPresent()) {
                throw new IllegalArgumentException("account already exists: " + trimmed);
            }
            var now = clock.now();
            return accounts.insert(new Account(null, trimmed, credentials, true, time, now, now));
        });
        log.info("Account created: {} at {}", stored.ref(), time);
        orchestrator.reconcile();
        return stored;
    }

    public Account update(long id, AccountUpdate change) throws Exception {
        if (change.checkinTime() != null) normalizeTime(change.checkinTime());
        if (change.credentials() != null) requireCredentials(change.credentials());

        Account updated = tx.required(() -> {
            Account cur = accounts.get(id).orElseThrow(() -> new NoSuchElementException("no account with id " + id));
            Account next = new Account(cur.id(), cur.name(),
                    change.credentials() != null ? change.credentials() : cur.credentials(),
                    change.enabled() != null ? change.enabled() : cur.enabled(),
                    change.checkinTime() != null ? normalizeTime(change.checkinTime()) : cur.checkinTime(),
                    cur.createdAt(), clock.now());
            if (!accounts.update(next)) throw new NoSuchElementException("no account with id " + id);
            return next;
        });
        log.info("Account updated: {} (enabled={}, time={})", updated.ref(), updated.enabled(), updated.checkinTime());
        orchestrator.reconcile();
        return updated;
    }

    /** Deletes the account and its history. */
    public void delete(long id) throws Exception {
        boolean removed = tx.required(() -> accounts.delete(id));
        if (!removed) throw new NoSuchElementException("no account with id " + id);
        log.info("Account deleted: id={}", id);
        orchestrator.reconcile();
    }

    public List<Account> list() throws Exception {
        return tx.required(accounts::listAll);
    }

    public Optional<Account> get(long id) throws Exception {
        return tx.required(() -> accounts.get(id));
    }

    private static void requireCredentials(String credentials) {
        if (credentials == null || credentials.isBlank()) {
            throw new IllegalArgumentException("credentials are required");
        }
    }

    private static String normalizeTime(String raw) {
        return TriggerTime.parse(raw).toString();
    }
}
