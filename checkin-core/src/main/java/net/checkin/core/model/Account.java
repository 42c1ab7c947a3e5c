package net.checkin.core.model;

import java.time.Instant;

public record Account(
        Long id,
        String name,          // unique, immutable once created
        String credentials,   // opaque payload handed to the executor as-is
        boolean enabled,
        String checkinTime,   // "HH:mm", validated through TriggerTime
        Instant createdAt,
        Instant updatedAt
) {
    public static final String DEFAULT_CHECKIN_TIME = "01:00";

    public static Account ofNew(String name, String credentials, String checkinTime) {
        return new Account(null, name, credentials, true,
                checkinTime == null ? DEFAULT_CHECKIN_TIME : checkinTime, null, null);
    }

    public AccountRef ref() {
        return new AccountRef(id, name);
    }

    public boolean hasCredentials() {
        return credentials != null && !credentials.isBlank();
    }
}
