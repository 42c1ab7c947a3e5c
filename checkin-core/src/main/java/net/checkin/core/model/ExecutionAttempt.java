package net.checkin.core.model;

import java.time.Instant;
import java.time.LocalDate;

public record ExecutionAttempt(
        Long id,
        long accountId,
        String accountName,
        boolean success,
        String message,
        LocalDate checkinDate,   // calendar date in the scheduler zone
        Instant createdAt
) {
    public static ExecutionAttempt of(AccountRef account, CheckinResult result,
                                      LocalDate date, Instant at) {
        return new ExecutionAttempt(null, account.id(), account.name(),
                result.success(), result.message(), date, at);
    }

    public ExecutionAttempt withId(long newId) {
        return new ExecutionAttempt(newId, accountId, accountName, success, message, checkinDate, createdAt);
    }
}
