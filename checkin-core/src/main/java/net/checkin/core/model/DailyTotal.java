package net.checkin.core.model;

import java.time.LocalDate;

public record DailyTotal(LocalDate date, long total, long successful) {}
