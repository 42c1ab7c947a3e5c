package net.checkin.core.spi;

import net.checkin.core.model.NotificationConfig;

/** One notification backend. */
public interface NotificationChannel {
    String name();

    /** Whether {@code config} carries this channel's credentials. */
    boolean isConfigured(NotificationConfig config);

    /**
     * Delivers one message. Throws when the backend rejects it or cannot be reached.
     */
    void deliver(NotificationConfig config, String title, String body) throws Exception;
}
