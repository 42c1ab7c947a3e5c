package net.checkin.adapter.http.notify;

import net.checkin.adapter.http.JsonHttp;
import net.checkin.core.model.NotificationConfig;
import net.checkin.core.spi.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends notifications via a Telegram bot ({@code sendMessage}).
 */
public final class TelegramChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(TelegramChannel.class);

    public static final String DEFAULT_API_URL = "https://api.telegram.org";

    private final JsonHttp http;
    private final String apiUrl;

    public TelegramChannel(JsonHttp http, String apiUrl) {
        this.http = http;
        this.apiUrl = stripSlash(apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl);
    }

    @Override
    public String name() { return "telegram"; }

    @Override
    public boolean isConfigured(NotificationConfig config) { return config.hasTelegram(); }

    @Override
    public void deliver(NotificationConfig config, String title, String body) throws Exception {
        URI uri = URI.create(apiUrl + "/bot" + config.telegramBotToken() + "/sendMessage");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", config.telegramUserId());
        payload.put("text", Messages.combine(title, body));
        payload.put("disable_web_page_preview", true);

        JsonHttp.Reply reply = http.postJson(uri, payload);
        if (!reply.is2xx() || !reply.body().path("ok").asBoolean(false)) {
            String desc = reply.body().path("description").asText("");
            throw new IOException("Telegram rejected message: HTTP " + reply.status() + (desc.isEmpty() ? "" : " " + desc));
        }
        log.debug("Telegram message sent to chat {}", config.telegramUserId());
    }

    static String stripSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
