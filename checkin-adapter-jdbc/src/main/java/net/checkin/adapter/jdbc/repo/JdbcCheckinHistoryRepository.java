package net.checkin.adapter.jdbc.repo;

import net.checkin.adapter.jdbc.JdbcUtil;
import net.checkin.adapter.jdbc.TxContext;
import net.checkin.adapter.jdbc.mapper.RowMappers;
import net.checkin.core.model.DailyTotal;
import net.checkin.core.model.ExecutionAttempt;
import net.checkin.core.spi.HistoryRecorder;
import net.checkin.core.spi.HistoryReportRepository;

import java.sql.*;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only check-in history plus the reporting queries over it.
 */
public final class JdbcCheckinHistoryRepository implements HistoryRecorder, HistoryReportRepository {

    @Override
    public ExecutionAttempt append(ExecutionAttempt attempt) throws Exception {
        try (var ps = TxContext.required().prepareStatement("""
                INSERT INTO TB_CHECKIN_HISTORY(ACCOUNT_ID, SUCCESS, MESSAGE, CHECKIN_DATE, CREATED_AT)
                VALUES (?, ?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, attempt.accountId());
            ps.setString(2, JdbcUtil.flag(attempt.success()));
            ps.setString(3, attempt.message());
            ps.setString(4, JdbcUtil.date(attempt.checkinDate()));
            JdbcUtil.setInstant(ps, 5, attempt.createdAt());
            ps.executeUpdate();
            try (var k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new SQLException("no generated key for TB_CHECKIN_HISTORY");
                return attempt.withId(k.getLong(1));
            }
        }
    }

    @Override
    public List<ExecutionAttempt> findByDate(LocalDate date) throws Exception {
        try (var ps = TxContext.required().prepareStatement("""
                SELECT  h.*, a.NAME AS ACCOUNT_NAME
                FROM    TB_CHECKIN_HISTORY h
                LEFT JOIN TB_ACCOUNT a ON a.ID = h.ACCOUNT_ID
                WHERE   h.CHECKIN_DATE = ?
                ORDER BY h.CREATED_AT DESC, h.ID DESC
            """)) {
            ps.setString(1, JdbcUtil.date(date));
            try (var rs = ps.executeQuery()) {
                List<ExecutionAttempt> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toAttempt(rs));
                return out;
            }
        }
    }

    @Override
    public List<DailyTotal> dailyTotalsSince(LocalDate since) throws Exception {
        try (var ps = TxContext.required().prepareStatement("""
                SELECT  CHECKIN_DATE,
                        COUNT(*) AS TOTAL,
                        SUM(CASE WHEN SUCCESS = 'Y' THEN 1 ELSE 0 END) AS SUCCESSFUL
                FROM    TB_CHECKIN_HISTORY
                WHERE   CHECKIN_DATE >= ?
                GROUP BY CHECKIN_DATE
                ORDER BY CHECKIN_DATE DESC
            """)) {
            ps.setString(1, JdbcUtil.date(since));
            try (var rs = ps.executeQuery()) {
                List<DailyTotal> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toDailyTotal(rs));
                return out;
            }
        }
    }

    @Override
    public long countAll() throws Exception {
        return count("SELECT COUNT(*) FROM TB_CHECKIN_HISTORY");
    }

    @Override
    public long countSuccessful() throws Exception {
        return count("SELECT COUNT(*) FROM TB_CHECKIN_HISTORY WHERE SUCCESS = 'Y'");
    }

    private static long count(String sql) throws SQLException {
        try (var ps = TxContext.required().prepareStatement(sql);
             var rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
