package net.checkin.core.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** First fire instant strictly after {@code from}. */
    Instant next(Instant from, String cronExpr, ZoneId zone);
}
