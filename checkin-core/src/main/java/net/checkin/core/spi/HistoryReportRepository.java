package net.checkin.core.spi;

import net.checkin.core.model.DailyTotal;
import net.checkin.core.model.ExecutionAttempt;

import java.time.LocalDate;
import java.util.List;

public interface HistoryReportRepository {
    /** Attempts recorded for {@code date}, newest first, with account names. */
    List<ExecutionAttempt> findByDate(LocalDate date) throws Exception;

    /** Per-day totals for dates >= {@code since}, newest day first. */
    List<DailyTotal> dailyTotalsSince(LocalDate since) throws Exception;

    long countAll() throws Exception;
    long countSuccessful() throws Exception;
}
