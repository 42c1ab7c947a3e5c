package net.checkin.core.model;

import java.util.List;

public record DashboardSummary(
        long totalAccounts,
        long enabledAccounts,
        List<ExecutionAttempt> todayAttempts,   // newest first
        long totalAttempts,
        long successfulAttempts,
        double successRate,                     // percent, 2 decimals
        List<DailyTotal> recentHistory          // newest day first
) {}
