package net.checkin.adapter.jdbc;

import net.checkin.adapter.jdbc.repo.JdbcAccountRepository;
import net.checkin.core.model.Account;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcTxRunnerTest extends TestSupport {

    @Test
    void failureRollsBack_andRethrowsTheOriginal() throws Exception {
        var tx = new JdbcTxRunner(ds);
        var accounts = new JdbcAccountRepository(() -> Instant.EPOCH);
        var boom = new IllegalStateException("boom");

        var thrown = assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            accounts.insert(Account.ofNew("alice", "x", null));
            throw boom;
        }));
        assertSame(boom, thrown);
        assertEquals(0L, (long) tx.required(accounts::countAll));
        assertNull(TxContext.get());
    }

    @Test
    void requiredJoinsTheOuterConnection() throws Exception {
        var tx = new JdbcTxRunner(ds);
        tx.required(() -> {
            var outer = TxContext.get();
            tx.required(() -> { assertSame(outer, TxContext.get()); return null; });
            return null;
        });
    }

    @Test
    void outsideTransaction_repositoryRefuses() {
        var accounts = new JdbcAccountRepository(() -> Instant.EPOCH);
        assertThrows(IllegalStateException.class, accounts::listAll);
    }
}
