package net.checkin.core.service;

import net.checkin.core.model.NotificationConfig;
import net.checkin.core.spi.NotificationChannel;
import net.checkin.core.spi.NotificationSettingsRepository;
import net.checkin.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort fan-out of one check-in outcome to every configured channel.
 * Never throws; channel faults are logged and isolated from each other.
 */
public final class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    public static final String DEFAULT_TITLE_PREFIX = "Check-in";

    private final NotificationSettingsRepository settings;
    private final List<NotificationChannel> channels;
    private final TxRunner tx;
    private final String titlePrefix;

    public NotificationDispatcher(NotificationSettingsRepository settings,
                                  List<NotificationChannel> channels,
                                  TxRunner tx,
                                  String titlePrefix) {
        this.settings = settings;
        this.channels = List.copyOf(channels);
        this.tx = tx;
        this.titlePrefix = titlePrefix == null || titlePrefix.isBlank() ? DEFAULT_TITLE_PREFIX : titlePrefix;
    }

    public DispatchReport notify(String accountName, boolean success, String message) {
        NotificationConfig config;
        try {
            config = tx.required(settings::find).orElse(null);
        } catch (Exception e) {
            log.warn("Notification skipped for '{}': settings unavailable: {}", accountName, e.toString());
            return DispatchReport.none();
        }
        if (config == null || !config.enabled()) return DispatchReport.none();

        String title = title(accountName);
        String body = body(success, message);

        List<String> delivered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (NotificationChannel ch : channels) {
            if (!ch.isConfigured(config)) continue;
            try {
                ch.deliver(config, title, body);
                delivered.add(ch.name());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed.add(ch.name());
                log.warn("Notification via {} interrupted for '{}'", ch.name(), accountName);
            } catch (Exception e) {
                failed.add(ch.name());
                log.warn("Notification via {} failed for '{}': {}", ch.name(), accountName, e.toString());
            }
        }
        if (!delivered.isEmpty() || !failed.isEmpty()) {
            log.debug("Notification for '{}': delivered={} failed={}", accountName, delivered, failed);
        }
        return new DispatchReport(delivered, failed);
    }

    String title(String accountName) {
        return titlePrefix + ": " + accountName;
    }

    static String body(boolean success, String message) {
        return (success ? "✅ Success" : "❌ Failed") + ": " + (message == null ? "" : message);
    }
}
