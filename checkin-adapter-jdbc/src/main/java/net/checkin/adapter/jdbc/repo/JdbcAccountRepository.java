package net.checkin.adapter.jdbc.repo;

import net.checkin.adapter.jdbc.JdbcUtil;
import net.checkin.adapter.jdbc.TxContext;
import net.checkin.adapter.jdbc.mapper.RowMappers;
import net.checkin.core.model.Account;
import net.checkin.core.spi.AccountRepository;
import net.checkin.core.spi.Clock;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcAccountRepository implements AccountRepository {
    private final Clock clock;

    public JdbcAccountRepository(Clock clock) { this.clock = clock; }

    @Override
    public List<Account> listEnabled() throws Exception {
        return list("SELECT * FROM TB_ACCOUNT WHERE ENABLED = 'Y' ORDER BY ID");
    }

    @Override
    public List<Account> listAll() throws Exception {
        return list("SELECT * FROM TB_ACCOUNT ORDER BY ID");
    }

    @Override
    public Optional<Account> get(long id) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("SELECT * FROM TB_ACCOUNT WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toAccount(rs));
            }
        }
    }

    @Override
    public Optional<Account> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.required().prepareStatement("SELECT * FROM TB_ACCOUNT WHERE NAME = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toAccount(rs));
            }
        }
    }

    @Override
    public long countAll() throws Exception {
        return count("SELECT COUNT(*) FROM TB_ACCOUNT");
    }

    @Override
    public long countEnabled() throws Exception {
        return count("SELECT COUNT(*) FROM TB_ACCOUNT WHERE ENABLED = 'Y'");
    }

    @Override
    public Account insert(Account account) throws Exception {
        Connection c = TxContext.required();
        Instant now = clock.now();
        long id;
        try (var ps = c.prepareStatement("""
                INSERT INTO TB_ACCOUNT(NAME, CREDENTIALS, ENABLED, CHECKIN_TIME, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
            int i = 1;
            ps.setString(i++, account.name());
            ps.setString(i++, account.credentials());
            ps.setString(i++, JdbcUtil.flag(account.enabled()));
            ps.setString(i++, account.checkinTime());
            JdbcUtil.setInstant(ps, i++, now);
            JdbcUtil.setInstant(ps, i, now);
            ps.executeUpdate();
            try (var k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new SQLException("no generated key for TB_ACCOUNT");
                id = k.getLong(1);
            }
        }
        return get(id).orElseThrow(() -> new IllegalStateException("insert failed to load account: " + account.name()));
    }

    @Override
    public boolean update(Account account) throws Exception {
        try (var ps = TxContext.required().prepareStatement("""
                UPDATE TB_ACCOUNT
                   SET CREDENTIALS  = ?,
                       ENABLED      = ?,
                       CHECKIN_TIME = ?,
                       UPDATED_AT   = ?
                 WHERE ID = ?
            """)) {
            ps.setString(1, account.credentials());
            ps.setString(2, JdbcUtil.flag(account.enabled()));
            ps.setString(3, account.checkinTime());
            JdbcUtil.setInstant(ps, 4, clock.now());
            ps.setLong(5, account.id());
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        Connection c = TxContext.required();
        // history first: foreign keys are not enforced on every SQLite connection
        try (var ps = c.prepareStatement("DELETE FROM TB_CHECKIN_HISTORY WHERE ACCOUNT_ID = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
        try (var ps = c.prepareStatement("DELETE FROM TB_ACCOUNT WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    private List<Account> list(String sql) throws SQLException {
        try (var ps = TxContext.required().prepareStatement(sql);
             var rs = ps.executeQuery()) {
            List<Account> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toAccount(rs));
            return out;
        }
    }

    private long count(String sql) throws SQLException {
        try (var ps = TxContext.required().prepareStatement(sql);
             var rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
