package io.agenthub.server;

import com.jayway.jsonpath.JsonPath;
import io.agenthub.spi.ChannelProvisioner;
import io.agenthub.spi.ChannelSender;
import io.agenthub.translate.ChannelPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "agenthub.matrix.homeserver=https://matrix.hub.test",
    "agenthub.api-base=https://hub.test/api/v1"
})
@AutoConfigureMockMvc
class ServerApiTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    StubChannel channel;

    @BeforeEach
    void resetChannel() {
        channel.failSends.set(false);
    }

    @Test
    void discoveryDocumentIsServedAtWellKnownPath() throws Exception {
        mvc.perform(get("/.well-known/agenthub-matrix"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.matrix_homeserver").value("https://matrix.hub.test"))
            .andExpect(jsonPath("$.api_base").value("https://hub.test/api/v1"));
    }

    @Test
    void healthAndReadiness() throws Exception {
        mvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
        mvc.perform(get("/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    void sendToRegisteredAgentCompletesAndRepeatIsDuplicate() throws Exception {
        registerAgent("agent-send");
        String body = """
            {"sender_agent_id": "ops", "receiver_agent_id": "agent-send",
             "delivery_id": "d-send-1", "content": {"msgtype": "m.text", "body": "hello"}}
            """;

        mvc.perform(post("/api/v1/agent/send").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.delivery_id").value("d-send-1"))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.duplicate").value(false));

        mvc.perform(post("/api/v1/agent/send").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    void sendWithoutDeliveryIdGeneratesOne() throws Exception {
        registerAgent("agent-noid");
        mvc.perform(post("/api/v1/agent/send").contentType(MediaType.APPLICATION_JSON).content("""
                {"receiver_agent_id": "agent-noid", "content": {"body": "ping"}}
                """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.delivery_id").isNotEmpty());
    }

    @Test
    void sendToUnknownAgentIsNotFound() throws Exception {
        mvc.perform(post("/api/v1/agent/send").contentType(MediaType.APPLICATION_JSON).content("""
                {"receiver_agent_id": "nobody", "delivery_id": "d-404", "content": {"body": "x"}}
                """))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void failedSendIsBadGateway() throws Exception {
        registerAgent("agent-fail");
        channel.failSends.set(true);
        mvc.perform(post("/api/v1/agent/send").contentType(MediaType.APPLICATION_JSON).content("""
                {"receiver_agent_id": "agent-fail", "delivery_id": "d-502", "content": {"body": "x"}}
                """))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.delivery_id").value("d-502"))
            .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void missingContentIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/agent/send").contentType(MediaType.APPLICATION_JSON).content("""
                {"receiver_agent_id": "agent-x"}
                """))
            .andExpect(status().isBadRequest());
    }

    @Test
    void approvalCallbackKeepsFirstDecision() throws Exception {
        mvc.perform(post("/api/v1/approval").contentType(MediaType.APPLICATION_JSON).content("""
                {"request_id": "req-1", "payload": {"action": "deploy"}}
                """))
            .andExpect(status().isOk());
        mvc.perform(get("/api/v1/approval/req-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PENDING"));

        mvc.perform(post("/api/v1/approval/callback").contentType(MediaType.APPLICATION_JSON).content("""
                {"request_id": "req-1", "decision": "approve", "approver_id": "alice"}
                """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.decision").value("approve"));
        mvc.perform(post("/api/v1/approval/callback").contentType(MediaType.APPLICATION_JSON).content("""
                {"request_id": "req-1", "decision": "reject"}
                """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.decision").value("approve"));

        mvc.perform(get("/api/v1/approval/req-1"))
            .andExpect(jsonPath("$.status").value("RESOLVED"))
            .andExpect(jsonPath("$.approverId").value("alice"));
    }

    @Test
    void callbackForUnknownRequestIsNotFound() throws Exception {
        mvc.perform(post("/api/v1/approval/callback").contentType(MediaType.APPLICATION_JSON).content("""
                {"request_id": "missing", "decision": "approve"}
                """))
            .andExpect(status().isNotFound());
    }

    @Test
    void ownerBindingAndRelationships() throws Exception {
        mvc.perform(post("/api/v1/owners").contentType(MediaType.APPLICATION_JSON).content("""
                {"owner_id": "owner-1"}
                """))
            .andExpect(status().isOk());
        registerAgent("parent-1");
        registerAgent("child-1");

        mvc.perform(post("/api/v1/agents/parent-1/bind/owner-1"))
            .andExpect(status().isOk());
        mvc.perform(post("/api/v1/agents/parent-1/children/child-1"))
            .andExpect(status().isOk());
        mvc.perform(post("/api/v1/agents/child-1/children/parent-1"))
            .andExpect(status().isConflict());

        mvc.perform(get("/api/v1/agents/parent-1/owner-history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
        mvc.perform(get("/api/v1/agents/missing/relationships"))
            .andExpect(status().isNotFound());
    }

    @Test
    void duplicateAgentRegistrationIsConflict() throws Exception {
        registerAgent("agent-dup");
        mvc.perform(post("/api/v1/agents").contentType(MediaType.APPLICATION_JSON).content("""
                {"agent_id": "agent-dup", "metadata": {"role": "other"}}
                """))
            .andExpect(status().isConflict());
    }

    @Test
    void pairingCodeRegistersAgentOnce() throws Exception {
        mvc.perform(post("/api/v1/owners").contentType(MediaType.APPLICATION_JSON).content("""
                {"owner_id": "owner-pair"}
                """))
            .andExpect(status().isOk());
        String created = mvc.perform(post("/api/v1/owners/owner-pair/pairing-codes")
                .contentType(MediaType.APPLICATION_JSON).content("{\"ttl_seconds\": 300}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.owner_id").value("owner-pair"))
            .andReturn().getResponse().getContentAsString();
        String code = JsonPath.read(created, "$.code");

        String pair = "{\"code\": \"" + code + "\", \"agent_id\": \"agent-paired\"}";
        mvc.perform(post("/api/v1/agents/pair").contentType(MediaType.APPLICATION_JSON).content(pair))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ownerId").value("owner-pair"))
            .andExpect(jsonPath("$.status").value("ACTIVE"));
        mvc.perform(post("/api/v1/agents/pair").contentType(MediaType.APPLICATION_JSON)
                .content(pair.replace("agent-paired", "agent-again")))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.retryable").value(false));
        mvc.perform(post("/api/v1/owners/missing/pairing-codes"))
            .andExpect(status().isNotFound());
    }

    @Test
    void heartbeatMarksAgentOnline() throws Exception {
        registerAgent("agent-live");
        mvc.perform(post("/api/v1/agents/agent-live/heartbeat").contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"busy\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("busy"));
    }

    private void registerAgent(String agentId) throws Exception {
        mvc.perform(post("/api/v1/agents").contentType(MediaType.APPLICATION_JSON)
                .content("{\"agent_id\": \"" + agentId + "\"}"))
            .andExpect(status().isOk());
    }

    static class StubChannel implements ChannelProvisioner, ChannelSender {
        final AtomicInteger rooms = new AtomicInteger();
        final AtomicBoolean failSends = new AtomicBoolean();

        @Override
        public String createRoom(String name) {
            return "!room" + rooms.incrementAndGet() + ":hub.test";
        }

        @Override
        public String send(String roomId, ChannelPayload payload, String transactionId) {
            if (failSends.get()) {
                throw new IllegalStateException("homeserver rejected the event");
            }
            return "$" + transactionId;
        }
    }

    @TestConfiguration
    static class ChannelConfig {
        @Bean
        StubChannel stubChannel() {
            return new StubChannel();
        }
    }
}
