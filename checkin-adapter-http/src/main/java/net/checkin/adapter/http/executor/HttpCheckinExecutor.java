package net.checkin.adapter.http.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.checkin.core.model.Account;
import net.checkin.core.model.CheckinResult;
import net.checkin.core.spi.CheckinExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Performs a check-in as one HTTP request built from the account's credential payload.
 * <p>
 * The payload is a JSON object; {@code cookies} and {@code headers} (string maps) are sent
 * with the request and {@code body}, when present, is sent as the JSON request body.
 * A wrapping {@code token_data} object is unwrapped first.
 */
public final class HttpCheckinExecutor implements CheckinExecutor {
    private static final Logger log = LoggerFactory.getLogger(HttpCheckinExecutor.class);

    static final int MAX_MESSAGE_LENGTH = 200;

    public record Settings(URI url, String method, Duration timeout, String userAgent, List<String> successKeywords) {
        public Settings {
            if (url == null) throw new IllegalArgumentException("check-in url is required");
            method = method == null || method.isBlank() ? "POST" : method.trim().toUpperCase(Locale.ROOT);
            timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
            successKeywords = successKeywords == null ? List.of() : List.copyOf(successKeywords);
        }
    }

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Settings settings;

    public HttpCheckinExecutor(HttpClient client, ObjectMapper mapper, Settings settings) {
        this.client = client;
        this.mapper = mapper;
        this.settings = settings;
    }

    @Override
    public CheckinResult execute(Account account) throws Exception {
        JsonNode creds = credentials(account);

        HttpRequest.Builder req = HttpRequest.newBuilder(settings.url()).timeout(settings.timeout());
        if (settings.userAgent() != null && !settings.userAgent().isBlank()) {
            req.header("User-Agent", settings.userAgent());
        }
        String cookie = cookieHeader(creds.path("cookies"));
        if (!cookie.isEmpty()) req.header("Cookie", cookie);
        for (Map.Entry<String, String> h : stringFields(creds.path("headers"))) {
            req.header(h.getKey(), h.getValue());
        }

        JsonNode body = creds.path("body");
        if (body.isMissingNode() || body.isNull()) {
            req.method(settings.method(), HttpRequest.BodyPublishers.noBody());
        } else {
            req.header("Content-Type", "application/json; charset=UTF-8");
            req.method(settings.method(), HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body), StandardCharsets.UTF_8));
        }

        log.debug("Check-in request for {}: {} {}", account.name(), settings.method(), settings.url());
        HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return interpret(resp.statusCode(), resp.body());
    }

    CheckinResult interpret(int status, String body) {
        String text = body == null ? "" : body;
        String message = message(status, text);
        if (status < 200 || status >= 300) {
            return CheckinResult.failed("HTTP " + status + (message.isEmpty() ? "" : ": " + message));
        }
        if (!settings.successKeywords().isEmpty()) {
            String lower = text.toLowerCase(Locale.ROOT);
            boolean hit = settings.successKeywords().stream()
                    .anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));
            if (!hit) return CheckinResult.failed(message.isEmpty() ? "no success marker in response" : message);
        }
        return CheckinResult.ok(message.isEmpty() ? "HTTP " + status : message);
    }

    private String message(int status, String body) {
        if (body.isBlank()) return "";
        try {
            JsonNode json = mapper.readTree(body);
            for (String field : new String[]{"message", "msg", "detail"}) {
                if (json.path(field).isTextual()) return abbreviate(json.path(field).asText());
            }
        } catch (IOException e) {
            log.trace("Response body is not JSON (HTTP {})", status);
        }
        return abbreviate(body.strip());
    }

    private JsonNode credentials(Account account) {
        JsonNode root;
        try {
            root = mapper.readTree(account.credentials());
        } catch (IOException e) {
            throw new IllegalArgumentException("credentials of '" + account.name() + "' are not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("credentials of '" + account.name() + "' must be a JSON object");
        }
        JsonNode wrapped = root.path("token_data");
        return wrapped.isObject() ? wrapped : root;
    }

    static String cookieHeader(JsonNode cookies) {
        StringJoiner j = new StringJoiner("; ");
        for (Map.Entry<String, String> c : stringFields(cookies)) j.add(c.getKey() + "=" + c.getValue());
        return j.toString();
    }

    private static List<Map.Entry<String, String>> stringFields(JsonNode node) {
        if (!node.isObject()) return List.of();
        List<Map.Entry<String, String>> out = new java.util.ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            var e = it.next();
            if (e.getValue().isValueNode()) out.add(Map.entry(e.getKey(), e.getValue().asText()));
        }
        return out;
    }

    static String abbreviate(String s) {
        if (s.length() <= MAX_MESSAGE_LENGTH) return s;
        int end = MAX_MESSAGE_LENGTH;
        // never split a surrogate pair
        if (Character.isHighSurrogate(s.charAt(end - 1))) end--;
        return s.substring(0, end) + "...";
    }
}
