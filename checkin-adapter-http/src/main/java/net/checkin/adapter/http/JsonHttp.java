package net.checkin.adapter.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** Small JSON-over-HTTP helper shared by the notification channels. */
public final class JsonHttp {
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public JsonHttp(HttpClient client, ObjectMapper mapper, Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    public static HttpClient defaultClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public ObjectMapper mapper() { return mapper; }

    public record Reply(int status, JsonNode body) {
        public boolean is2xx() { return status >= 200 && status < 300; }
    }

    /** POSTs {@code payload} as JSON; a body that is not JSON comes back as a text node. */
    public Reply postJson(URI uri, Object payload) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json; charset=UTF-8")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new Reply(resp.statusCode(), parse(resp.body()));
    }

    JsonNode parse(String body) {
        if (body == null || body.isBlank()) return mapper.missingNode();
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            return mapper.getNodeFactory().textNode(body);
        }
    }
}
