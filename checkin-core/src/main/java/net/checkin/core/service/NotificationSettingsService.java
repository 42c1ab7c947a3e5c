package net.checkin.core.service;

import net.checkin.core.model.NotificationConfig;
import net.checkin.core.spi.Clock;
import net.checkin.core.spi.NotificationSettingsRepository;
import net.checkin.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NotificationSettingsService {
    private static final Logger log = LoggerFactory.getLogger(NotificationSettingsService.class);

    private final NotificationSettingsRepository settings;
    private final TxRunner tx;
    private final Clock clock;

    public NotificationSettingsService(NotificationSettingsRepository settings, TxRunner tx, Clock clock) {
        this.settings = settings;
        this.tx = tx;
        this.clock = clock;
    }

    /** Current settings; {@link NotificationConfig#disabled()} when nothing was stored yet. */
    public NotificationConfig get() throws Exception {
        return tx.required(settings::find).orElseGet(NotificationConfig::disabled);
    }

    public NotificationConfig update(NotificationConfig config) throws Exception {
        NotificationConfig stamped = stamp(config);
        tx.required(() -> { settings.save(stamped); return stamped; });
        log.info("Notification settings updated (enabled={}, telegram={}, wecom={})",
                stamped.enabled(), stamped.hasTelegram(), stamped.hasWecom());
        return stamped;
    }

    /** Stores {@code seed} only when no settings row exists. Returns true when it was stored. */
    public boolean seedIfAbsent(NotificationConfig seed) throws Exception {
        NotificationConfig stamped = stamp(seed);
        boolean stored = tx.required(() -> {
            if (settings.find().isPresent()) return false;
            settings.save(stamped);
            return true;
        });
        if (stored) log.info("Notification settings seeded from configuration");
        return stored;
    }

    private NotificationConfig stamp(NotificationConfig c) {
        return new NotificationConfig(c.enabled(), blankToNull(c.telegramBotToken()),
                blankToNull(c.telegramUserId()), blankToNull(c.wecomWebhookKey()), clock.now());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
