package net.checkin.core.spi;

import net.checkin.core.model.Account;
import net.checkin.core.model.CheckinResult;

/**
 * Performs one check-in for one account against the remote service.
 * Implementations bound their own I/O time; any exception is reported as a failed attempt.
 */
@FunctionalInterface
public interface CheckinExecutor {
    CheckinResult execute(Account account) throws Exception;
}
