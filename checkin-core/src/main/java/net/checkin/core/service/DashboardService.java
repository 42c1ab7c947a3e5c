package net.checkin.core.service;

import net.checkin.core.model.DashboardSummary;
import net.checkin.core.spi.AccountRepository;
import net.checkin.core.spi.Clock;
import net.checkin.core.spi.HistoryReportRepository;
import net.checkin.core.spi.TxRunner;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneId;

/** Read-only aggregates over accounts and check-in history. */
public final class DashboardService {
    private final AccountRepository accounts;
    private final HistoryReportRepository history;
    private final TxRunner tx;
    private final Clock clock;
    private final ZoneId zone;

    public DashboardService(AccountRepository accounts, HistoryReportRepository history,
                            TxRunner tx, Clock clock, ZoneId zone) {
        this.accounts = accounts;
        this.history = history;
        this.tx = tx;
        this.clock = clock;
        this.zone = zone;
    }

    /** @param days how many calendar days (today included) the daily history covers */
    public DashboardSummary summary(int days) throws Exception {
        if (days < 1) throw new IllegalArgumentException("days must be >= 1");
        LocalDate today = LocalDate.ofInstant(clock.now(), zone);
        return tx.required(() -> {
            long total = history.countAll();
            long ok = history.countSuccessful();
            return new DashboardSummary(
                    accounts.countAll(),
                    accounts.countEnabled(),
                    history.findByDate(today),
                    total,
                    ok,
                    successRate(ok, total),
                    history.dailyTotalsSince(today.minusDays(days - 1L)));
        });
    }

    static double successRate(long successful, long total) {
        if (total == 0) return 0.0;
        return BigDecimal.valueOf(successful * 100L)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
