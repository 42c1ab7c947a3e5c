package net.checkin.adapter.http.notify;

import net.checkin.adapter.http.JsonHttp;
import net.checkin.core.model.NotificationConfig;
import net.checkin.core.spi.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * WeCom (Enterprise WeChat) group robot webhook.
 */
public final class WecomChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(WecomChannel.class);

    public static final String DEFAULT_API_URL = "https://qyapi.weixin.qq.com";

    private final JsonHttp http;
    private final String apiUrl;

    public WecomChannel(JsonHttp http, String apiUrl) {
        this.http = http;
        this.apiUrl = TelegramChannel.stripSlash(apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl);
    }

    @Override
    public String name() { return "wecom"; }

    @Override
    public boolean isConfigured(NotificationConfig config) { return config.hasWecom(); }

    @Override
    public void deliver(NotificationConfig config, String title, String body) throws Exception {
        URI uri = URI.create(apiUrl + "/cgi-bin/webhook/send?key="
                + URLEncoder.encode(config.wecomWebhookKey(), StandardCharsets.UTF_8));
        Map<String, Object> payload = Map.of(
                "msgtype", "text",
                "text", Map.of("content", Messages.combine(title, body)));

        JsonHttp.Reply reply = http.postJson(uri, payload);
        int errcode = reply.body().path("errcode").asInt(-1);
        if (!reply.is2xx() || errcode != 0) {
            throw new IOException("WeCom rejected message: HTTP " + reply.status()
                    + " errcode=" + errcode + " " + reply.body().path("errmsg").asText(""));
        }
        log.debug("WeCom message sent");
    }
}
