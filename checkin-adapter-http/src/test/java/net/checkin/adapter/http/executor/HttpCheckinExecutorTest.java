package net.checkin.adapter.http.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.checkin.core.model.Account;
import net.checkin.core.model.CheckinResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HttpCheckinExecutorTest {

    final ObjectMapper mapper = new ObjectMapper();
    MockWebServer server;

    @BeforeEach
    void start() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stop() throws IOException {
        server.shutdown();
    }

    HttpCheckinExecutor executor(List<String> keywords, Duration timeout) {
        var settings = new HttpCheckinExecutor.Settings(
                URI.create(server.url("/api/checkin").toString()), "post", timeout, "Mozilla/5.0 test", keywords);
        return new HttpCheckinExecutor(HttpClient.newHttpClient(), mapper, settings);
    }

    static Account account(String credentials) {
        return new Account(1L, "alice", credentials, true, "09:00", null, null);
    }

    @Test
    void sendsCookiesHeadersAndUserAgent_andReadsMessage() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"message\":\"Check-in successful, +5 points\"}"));

        CheckinResult r = executor(List.of("successful"), Duration.ofSeconds(5)).execute(account("""
                {"cookies": {"session": "abc", "remember": "1"}, "headers": {"X-Token": "t1"}}
                """));

        assertTrue(r.success());
        assertEquals("Check-in successful, +5 points", r.message());

        RecordedRequest req = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(req);
        assertEquals("POST", req.getMethod());
        assertEquals("/api/checkin", req.getPath());
        assertEquals("session=abc; remember=1", req.getHeader("Cookie"));
        assertEquals("t1", req.getHeader("X-Token"));
        assertEquals("Mozilla/5.0 test", req.getHeader("User-Agent"));
    }

    @Test
    void tokenDataWrapper_andJsonBody() throws Exception {
        server.enqueue(new MockResponse().setBody("ok"));

        executor(List.of(), Duration.ofSeconds(5)).execute(account("""
                {"token_data": {"cookies": {"sid": "z"}, "body": {"action": "checkin"}}}
                """));

        RecordedRequest req = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(req);
        assertEquals("sid=z", req.getHeader("Cookie"));
        assertEquals("checkin", mapper.readTree(req.getBody().readUtf8()).path("action").asText());
    }

    @Test
    void non2xx_isFailedResult() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"msg\":\"login expired\"}"));

        CheckinResult r = executor(List.of(), Duration.ofSeconds(5)).execute(account("{\"cookies\":{}}"));

        assertFalse(r.success());
        assertEquals("HTTP 401: login expired", r.message());
    }

    @Test
    void missingSuccessKeyword_isFailedResult() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"message\":\"already checked in today\"}"));

        CheckinResult r = executor(List.of("successful", "签到成功"), Duration.ofSeconds(5)).execute(account("{}"));

        assertFalse(r.success());
        assertEquals("already checked in today", r.message());
    }

    @Test
    void emptyBody_okWithStatusMessage() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        CheckinResult r = executor(List.of(), Duration.ofSeconds(5)).execute(account("{}"));
        assertTrue(r.success());
        assertEquals("HTTP 204", r.message());
    }

    @Test
    void invalidCredentials_throw() {
        var ex = executor(List.of(), Duration.ofSeconds(5));
        assertThrows(IllegalArgumentException.class, () -> ex.execute(account("not json")));
        assertThrows(IllegalArgumentException.class, () -> ex.execute(account("[1,2]")));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void slowServer_timesOut() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(3, TimeUnit.SECONDS));
        var ex = executor(List.of(), Duration.ofMillis(300));
        assertThrows(HttpTimeoutException.class, () -> ex.execute(account("{}")));
    }

    @Test
    void longMessages_areAbbreviated() {
        String longText = "x".repeat(500);
        CheckinResult r = executor(List.of(), Duration.ofSeconds(1)).interpret(200, longText);
        assertThat(r.message()).hasSize(HttpCheckinExecutor.MAX_MESSAGE_LENGTH + 3).endsWith("...");
    }

    @Test
    void abbreviation_neverSplitsASurrogatePair() {
        // the emoji's high surrogate sits at the last kept index
        String text = "x".repeat(HttpCheckinExecutor.MAX_MESSAGE_LENGTH - 1) + "\uD83D\uDE00" + "tail";
        String cut = HttpCheckinExecutor.abbreviate(text);
        assertThat(cut).isEqualTo("x".repeat(HttpCheckinExecutor.MAX_MESSAGE_LENGTH - 1) + "...");
        assertThat(Character.isHighSurrogate(cut.charAt(cut.length() - 4))).isFalse();
    }
}
