package net.checkin.core.model;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/** Daily trigger time-of-day, minute granularity. */
public record TriggerTime(int hour, int minute) {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    public TriggerTime {
        if (hour < 0 || hour > 23) throw new IllegalArgumentException("hour out of range: " + hour);
        if (minute < 0 || minute > 59) throw new IllegalArgumentException("minute out of range: " + minute);
    }

    /**
     * Parses {@code H:mm} or {@code HH:mm}.
     *
     * @throws IllegalArgumentException on null, blank or malformed input
     */
    public static TriggerTime parse(String text) {
        if (text == null) throw new IllegalArgumentException("checkin time is required");
        String s = text.strip();
        if (s.length() == 4) s = "0" + s;
        try {
            LocalTime t = LocalTime.parse(s, FORMAT);
            return new TriggerTime(t.getHour(), t.getMinute());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid checkin time '" + text + "', expected HH:mm", e);
        }
    }

    public static boolean isValid(String text) {
        try { parse(text); return true; } catch (RuntimeException e) { return false; }
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }

    /** Quartz expression firing once a day at this time: {@code 0 m H * * ?}. */
    public String toCronExpression() {
        return "0 " + minute + " " + hour + " * * ?";
    }

    @Override public String toString() { return FORMAT.format(toLocalTime()); }
}
