package net.checkin.core.spi;

import net.checkin.core.model.NotificationConfig;

import java.util.Optional;

public interface NotificationSettingsRepository {
    Optional<NotificationConfig> find() throws Exception;

    /** Replaces the single settings row (creates it when missing). */
    void save(NotificationConfig config) throws Exception;
}
