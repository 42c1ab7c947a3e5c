package net.checkin.adapter.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;

/** Column conventions: instants as epoch millis, flags as 'Y'/'N', dates as ISO text. */
public final class JdbcUtil {
    private JdbcUtil() {}

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.BIGINT);
        else ps.setLong(idx, i.toEpochMilli());
    }

    public static Instant getInstant(ResultSet rs, String col) throws SQLException {
        long v = rs.getLong(col);
        return rs.wasNull() ? null : Instant.ofEpochMilli(v);
    }

    public static String flag(boolean b) { return b ? "Y" : "N"; }

    public static boolean flag(ResultSet rs, String col) throws SQLException {
        return "Y".equals(rs.getString(col));
    }

    public static String date(LocalDate d) { return d.toString(); }

    public static LocalDate getDate(ResultSet rs, String col) throws SQLException {
        String s = rs.getString(col);
        return s == null ? null : LocalDate.parse(s);
    }
}
