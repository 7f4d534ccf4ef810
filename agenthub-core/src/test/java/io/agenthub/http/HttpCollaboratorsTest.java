package io.agenthub.http;

import com.sun.net.httpserver.HttpServer;
import io.agenthub.model.ApprovalDecision;
import io.agenthub.model.ApprovalRequest;
import io.agenthub.model.AuditEvent;
import io.agenthub.spi.CollaboratorException;
import io.agenthub.translate.ChannelPayload;
import io.agenthub.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpCollaboratorsTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private HttpServer server;
    private String baseUrl;
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Reply> replies = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            String path = exchange.getRequestURI().getRawPath();
            requests.add(new Recorded(exchange.getRequestMethod(), path, body,
                exchange.getRequestHeaders().getFirst("Authorization")));
            Reply reply = replies.getOrDefault(path, new Reply(200, "{}"));
            byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(reply.status(), bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private Map<String, Object> lastBody() {
        return JsonCodec.getDefault().parseObject(requests.get(requests.size() - 1).body());
    }

    // ── Matrix channel ───────────────────────────────────────────

    @Test
    void createRoomPostsPrivateRoom() throws Exception {
        replies.put("/_matrix/client/v3/createRoom", new Reply(200, "{\"room_id\":\"!abc:hub.test\"}"));
        MatrixChannelClient client = new MatrixChannelClient(baseUrl + "/", "secret", TIMEOUT);

        String roomId = client.createRoom("agenthub:agent:A1");

        assertEquals("!abc:hub.test", roomId);
        Recorded request = requests.get(0);
        assertEquals("POST", request.method());
        assertEquals("Bearer secret", request.authorization());
        assertEquals("agenthub:agent:A1", lastBody().get("name"));
        assertEquals("private_chat", lastBody().get("preset"));
    }

    @Test
    void sendUsesTransactionIdInPath() throws Exception {
        String path = "/_matrix/client/v3/rooms/%21abc%3Ahub.test/send/m.room.message/d%201";
        replies.put(path, new Reply(200, "{\"event_id\":\"$e1\"}"));
        MatrixChannelClient client = new MatrixChannelClient(baseUrl, "secret", TIMEOUT);

        String eventId = client.send("!abc:hub.test", ChannelPayload.of("m.text", "hi"), "d 1");

        assertEquals("$e1", eventId);
        assertEquals("PUT", requests.get(0).method());
        assertEquals(path, requests.get(0).path());
        assertEquals("hi", lastBody().get("body"));
    }

    @Test
    void serverErrorsAreTransientClientErrorsPermanent() {
        replies.put("/_matrix/client/v3/createRoom", new Reply(503, "{\"errcode\":\"M_UNAVAILABLE\"}"));
        MatrixChannelClient client = new MatrixChannelClient(baseUrl, "secret", TIMEOUT);

        HttpStatusException unavailable = assertThrows(HttpStatusException.class, () -> client.createRoom("r"));
        assertEquals(503, unavailable.statusCode());
        assertTrue(unavailable.isTransient());

        replies.put("/_matrix/client/v3/createRoom", new Reply(403, "{\"errcode\":\"M_FORBIDDEN\"}"));
        HttpStatusException forbidden = assertThrows(HttpStatusException.class, () -> client.createRoom("r"));
        assertFalse(forbidden.isTransient());

        replies.put("/_matrix/client/v3/createRoom", new Reply(429, "{}"));
        assertTrue(assertThrows(HttpStatusException.class, () -> client.createRoom("r")).isTransient());
    }

    @Test
    void missingRoomIdIsPermanent() {
        MatrixChannelClient client = new MatrixChannelClient(baseUrl, "secret", TIMEOUT);

        CollaboratorException ex = assertThrows(CollaboratorException.class, () -> client.createRoom("r"));
        assertFalse(ex.isTransient());
    }

    @Test
    void unreachableServerIsTransient() {
        server.stop(0);
        MatrixChannelClient client = new MatrixChannelClient(baseUrl, "secret", TIMEOUT);

        CollaboratorException ex = assertThrows(CollaboratorException.class, () -> client.createRoom("r"));
        assertTrue(ex.isTransient());
    }

    // ── Chain registrar ──────────────────────────────────────────

    @Test
    void registerDidReturnsIssuedDid() throws Exception {
        replies.put("/did/register", new Reply(200, "{\"did\":\"did:chain:0xabc\"}"));
        HttpChainRegistrar registrar = new HttpChainRegistrar(baseUrl, "hub", TIMEOUT);

        assertEquals("did:chain:0xabc", registrar.registerDid("A1", "U1"));
        assertEquals(Map.of("agent_id", "A1", "owner_id", "U1"), lastBody());
    }

    @Test
    void registerDidFallsBackToLocalDid() throws Exception {
        HttpChainRegistrar registrar = new HttpChainRegistrar(baseUrl, "hub", TIMEOUT);

        assertEquals("did:hub:local:A1", registrar.registerDid("A1", null));
    }

    @Test
    void lookupDidMapsNotFoundToEmpty() throws Exception {
        replies.put("/did/did%3Ahub%3Alocal%3AA1", new Reply(200, "{\"agent_id\":\"A1\"}"));
        replies.put("/did/did%3Ahub%3Alocal%3AA9", new Reply(404, "{}"));
        HttpChainRegistrar registrar = new HttpChainRegistrar(baseUrl, "hub", TIMEOUT);

        assertEquals(Optional.of(Map.of("agent_id", "A1")), registrar.lookupDid("did:hub:local:A1"));
        assertTrue(registrar.lookupDid("did:hub:local:A9").isEmpty());
    }

    // ── Audit ────────────────────────────────────────────────────

    @Test
    void auditReporterPostsMessageAndApproval() throws Exception {
        HttpAuditReporter reporter = new HttpAuditReporter(baseUrl + "/audit/message",
            baseUrl + "/audit/approval", TIMEOUT);

        reporter.reportMessage(new AuditEvent("d1", "A0", "A1", "!r", Instant.ofEpochMilli(1000)));
        Map<String, Object> message = lastBody();
        assertEquals("d1", message.get("message_id"));
        assertEquals("!r", message.get("room_id"));
        assertEquals(1000L, message.get("timestamp"));

        ApprovalRequest request = ApprovalRequest.pending("R1", Map.of("action", "deploy"), Instant.EPOCH)
            .resolved(new ApprovalDecision("R1", "approved", "U1", null, Instant.ofEpochSecond(60)));
        reporter.reportApproval(request);
        Map<String, Object> approval = lastBody();
        assertEquals("/audit/approval", requests.get(1).path());
        assertEquals("approved", approval.get("decision"));
        assertEquals(Map.of("action", "deploy"), approval.get("payload"));
        assertEquals("1970-01-01T00:01:00Z", approval.get("resolved_at"));
    }

    @Test
    void auditReporterSkipsUnconfiguredEndpoints() throws Exception {
        HttpAuditReporter reporter = new HttpAuditReporter(null, " ", TIMEOUT);

        reporter.reportMessage(new AuditEvent("d1", "A0", "A1", "!r", Instant.EPOCH));

        assertTrue(requests.isEmpty());
    }

    @Test
    void permissionInitializerPostsAgent() throws Exception {
        new HttpPermissionInitializer(baseUrl + "/permissions/init", TIMEOUT).agentRegistered("A1", "U1");

        assertEquals("/permissions/init", requests.get(0).path());
        assertEquals("A1", lastBody().get("agent_id"));
    }

    private record Recorded(String method, String path, String body, String authorization) {}

    private record Reply(int status, String body) {}
}
