package net.checkin.adapter.jdbc.mapper;

import net.checkin.adapter.jdbc.JdbcUtil;
import net.checkin.core.model.*;

import java.sql.*;

public final class RowMappers {
    private RowMappers() {}

    // --- Account ---
    public static Account toAccount(ResultSet rs) throws SQLException {
        return new Account(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("CREDENTIALS"),
                JdbcUtil.flag(rs, "ENABLED"),
                rs.getString("CHECKIN_TIME"),
                JdbcUtil.getInstant(rs, "CREATED_AT"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }

    // --- ExecutionAttempt (expects ACCOUNT_NAME from a join) ---
    public static ExecutionAttempt toAttempt(ResultSet rs) throws SQLException {
        return new ExecutionAttempt(
                rs.getLong("ID"),
                rs.getLong("ACCOUNT_ID"),
                rs.getString("ACCOUNT_NAME"),
                JdbcUtil.flag(rs, "SUCCESS"),
                rs.getString("MESSAGE"),
                JdbcUtil.getDate(rs, "CHECKIN_DATE"),
                JdbcUtil.getInstant(rs, "CREATED_AT")
        );
    }

    // --- DailyTotal ---
    public static DailyTotal toDailyTotal(ResultSet rs) throws SQLException {
        return new DailyTotal(
                JdbcUtil.getDate(rs, "CHECKIN_DATE"),
                rs.getLong("TOTAL"),
                rs.getLong("SUCCESSFUL")
        );
    }

    // --- NotificationConfig ---
    public static NotificationConfig toNotificationConfig(ResultSet rs) throws SQLException {
        return new NotificationConfig(
                JdbcUtil.flag(rs, "ENABLED"),
                rs.getString("TELEGRAM_BOT_TOKEN"),
                rs.getString("TELEGRAM_USER_ID"),
                rs.getString("WECOM_WEBHOOK_KEY"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }
}
