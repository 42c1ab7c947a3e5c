package net.checkin.core.spi;

import net.checkin.core.model.ExecutionAttempt;

public interface HistoryRecorder {
    /** Append-only; the record is durable once this returns. */
    ExecutionAttempt append(ExecutionAttempt attempt) throws Exception;
}
