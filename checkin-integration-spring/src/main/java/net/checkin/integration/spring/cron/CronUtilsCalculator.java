package net.checkin.integration.spring.cron;

import net.checkin.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.nextAfter(cronExpr, zone, from);
    }
}
