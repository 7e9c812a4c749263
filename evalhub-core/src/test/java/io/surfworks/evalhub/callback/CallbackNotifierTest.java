package io.surfworks.evalhub.callback;

import com.fasterxml.jackson.databind.JsonNode;
import io.surfworks.evalhub.StubServer;
import io.surfworks.evalhub.config.CallbackConfig;
import io.surfworks.evalhub.json.EvalHubJson;
import io.surfworks.evalhub.result.EvaluationResponse;
import io.surfworks.evalhub.status.RequestStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CallbackNotifier against an in-process HTTP server.
 */
class CallbackNotifierTest {

    private final EvalHubJson json = new EvalHubJson();
    private StubServer server;
    private CallbackNotifier notifier;
    private EvaluationResponse response;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubServer();
        notifier = new CallbackNotifier(new CallbackConfig(Duration.ofSeconds(5), 3, Duration.ofMillis(10)), json);
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        response = new EvaluationResponse("req-1", RequestStatus.COMPLETED, 1, 1, 0, List.of(), Map.of(),
                null, now, now, now, 100.0, null);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void postsResponseJson() throws Exception {
        notifier.send(server.url() + "/hooks/done", response);

        List<StubServer.Recorded> requests = server.requests();
        assertEquals(1, requests.size());
        assertEquals("POST", requests.get(0).method());
        assertEquals("/hooks/done", requests.get(0).path());

        JsonNode body = json.parse(requests.get(0).body());
        assertEquals("req-1", body.get("request_id").asText());
        assertEquals("completed", body.get("status").asText());
    }

    @Test
    void anyTwoHundredStatusCounts() throws Exception {
        server.respond(r -> new StubServer.Reply(202, ""));
        notifier.send(server.url() + "/hooks", response);
        assertEquals(1, server.requests().size());
    }

    @Test
    void retriesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server.respond(r -> calls.incrementAndGet() < 3
                ? new StubServer.Reply(503, "busy")
                : StubServer.Reply.ok("{}"));

        notifier.send(server.url() + "/hooks", response);

        assertEquals(3, server.requests().size());
    }

    @Test
    void givesUpAfterAttemptBudget() {
        server.respond(r -> new StubServer.Reply(500, "error"));

        CallbackException e = assertThrows(CallbackException.class,
                () -> notifier.send(server.url() + "/hooks", response));

        assertEquals(3, e.attempts());
        assertEquals(3, server.requests().size());
        assertTrue(e.getMessage().contains("failed after 3 attempts"));
        assertTrue(e.getMessage().contains("HTTP 500"));
    }

    @Test
    void invalidUrlFailsWithoutAttempts() {
        CallbackException e = assertThrows(CallbackException.class, () -> notifier.send("not a url", response));
        assertEquals(0, e.attempts());
    }
}
