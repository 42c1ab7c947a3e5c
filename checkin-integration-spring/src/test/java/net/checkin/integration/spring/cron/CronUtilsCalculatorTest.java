package net.checkin.integration.spring.cron;

import net.checkin.core.model.TriggerTime;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronUtilsCalculatorTest {

    final CronUtilsCalculator cron = new CronUtilsCalculator();

    @Test
    void dailyTrigger_laterToday_orTomorrow() {
        ZoneId utc = ZoneId.of("UTC");
        String expr = TriggerTime.parse("09:00").toCronExpression();

        assertEquals(Instant.parse("2024-03-10T09:00:00Z"), cron.next(Instant.parse("2024-03-10T08:59:59Z"), expr, utc));
        assertEquals(Instant.parse("2024-03-11T09:00:00Z"), cron.next(Instant.parse("2024-03-10T09:00:01Z"), expr, utc));
    }

    @Test
    void exactlyAtFireTime_returnsTheFollowingDay() {
        ZoneId utc = ZoneId.of("UTC");
        assertEquals(Instant.parse("2024-03-11T01:00:00Z"),
                cron.next(Instant.parse("2024-03-10T01:00:00Z"), "0 0 1 * * ?", utc));
    }

    @Test
    void evaluatedOnTheZoneWallClock() {
        ZoneId shanghai = ZoneId.of("Asia/Shanghai");
        Instant from = ZonedDateTime.of(2024, 3, 10, 0, 0, 0, 0, shanghai).toInstant();
        Instant next = cron.next(from, "0 30 7 * * ?", shanghai);
        assertEquals(ZonedDateTime.of(2024, 3, 10, 7, 30, 0, 0, shanghai).toInstant(), next);
    }

    @Test
    void malformedExpression_rejected() {
        assertThrows(IllegalArgumentException.class, () -> CronSlotPlanner.validate("not a cron"));
    }
}
