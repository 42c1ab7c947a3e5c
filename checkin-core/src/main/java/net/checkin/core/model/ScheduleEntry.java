package net.checkin.core.model;

import java.time.Instant;

public record ScheduleEntry(
        AccountRef account,
        TriggerTime triggerTime,
        String cronExpr,
        Instant nextFireAt
) {
    public boolean isDue(Instant now) {
        return !nextFireAt.isAfter(now);
    }

    public ScheduleEntry advancedTo(Instant next) {
        return new ScheduleEntry(account, triggerTime, cronExpr, next);
    }
}
