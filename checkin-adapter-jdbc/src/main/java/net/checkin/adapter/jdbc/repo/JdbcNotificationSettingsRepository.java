package net.checkin.adapter.jdbc.repo;

import net.checkin.adapter.jdbc.JdbcUtil;
import net.checkin.adapter.jdbc.TxContext;
import net.checkin.adapter.jdbc.mapper.RowMappers;
import net.checkin.core.model.NotificationConfig;
import net.checkin.core.spi.Clock;
import net.checkin.core.spi.NotificationSettingsRepository;

import java.util.Optional;

/** Single-row table, ID is always 1. */
public final class JdbcNotificationSettingsRepository implements NotificationSettingsRepository {
    private final Clock clock;

    public JdbcNotificationSettingsRepository(Clock clock) { this.clock = clock; }

    @Override
    public Optional<NotificationConfig> find() throws Exception {
        try (var ps = TxContext.required().prepareStatement("SELECT * FROM TB_NOTIFICATION_SETTINGS WHERE ID = 1");
             var rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toNotificationConfig(rs));
        }
    }

    @Override
    public void save(NotificationConfig config) throws Exception {
        try (var ps = TxContext.required().prepareStatement("""
                INSERT INTO TB_NOTIFICATION_SETTINGS(ID, ENABLED, TELEGRAM_BOT_TOKEN, TELEGRAM_USER_ID, WECOM_WEBHOOK_KEY, UPDATED_AT)
                VALUES (1, ?, ?, ?, ?, ?)
                ON CONFLICT(ID) DO UPDATE SET
                       ENABLED            = excluded.ENABLED,
                       TELEGRAM_BOT_TOKEN = excluded.TELEGRAM_BOT_TOKEN,
                       TELEGRAM_USER_ID   = excluded.TELEGRAM_USER_ID,
                       WECOM_WEBHOOK_KEY  = excluded.WECOM_WEBHOOK_KEY,
                       UPDATED_AT         = excluded.UPDATED_AT
            """)) {
            int i = 1;
            ps.setString(i++, JdbcUtil.flag(config.enabled()));
            ps.setString(i++, config.telegramBotToken());
            ps.setString(i++, config.telegramUserId());
            ps.setString(i++, config.wecomWebhookKey());
            JdbcUtil.setInstant(ps, i, config.updatedAt() != null ? config.updatedAt() : clock.now());
            ps.executeUpdate();
        }
    }
}
