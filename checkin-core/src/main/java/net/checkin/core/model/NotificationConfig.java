package net.checkin.core.model;

import java.time.Instant;

public record NotificationConfig(
        boolean enabled,
        String telegramBotToken,
        String telegramUserId,
        String wecomWebhookKey,
        Instant updatedAt
) {
    public static NotificationConfig disabled() {
        return new NotificationConfig(false, null, null, null, null);
    }

    public boolean hasTelegram() {
        return present(telegramBotToken) && present(telegramUserId);
    }

    public boolean hasWecom() {
        return present(wecomWebhookKey);
    }

    private static boolean present(String s) { return s != null && !s.isBlank(); }
}
