package io.agenthub.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.ulid.UlidCreator;
import io.agenthub.AgentHub;
import io.agenthub.delivery.DeliveryResult;
import io.agenthub.identity.AgentRelationships;
import io.agenthub.identity.Initiator;
import io.agenthub.model.Agent;
import io.agenthub.model.BindingChange;
import io.agenthub.model.Owner;
import io.agenthub.model.PairingCode;
import io.agenthub.model.Presence;
import io.agenthub.translate.MessageContent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity, presence and delivery endpoints.
 */
@RestController
@RequestMapping("/api/v1")
public class AgentController {

    private static final long DEFAULT_PAIRING_TTL_SECONDS = 600;

    private final AgentHub hub;

    public AgentController(AgentHub hub) {
        this.hub = hub;
    }

    public record SendRequest(
        @JsonProperty("sender_agent_id") String senderAgentId,
        @JsonProperty("receiver_agent_id") String receiverAgentId,
        @JsonProperty("content") Map<String, Object> content,
        @JsonProperty("delivery_id") String deliveryId) {
    }

    public record OwnerRequest(
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("metadata") Map<String, String> metadata) {
    }

    public record AgentRequest(
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("owner_id") String ownerId,
        @JsonProperty("initiator") Initiator initiator,
        @JsonProperty("metadata") Map<String, String> metadata) {
    }

    public record PairingCodeRequest(
        @JsonProperty("ttl_seconds") Long ttlSeconds,
        @JsonProperty("agent_display_name") String agentDisplayName) {
    }

    public record PairRequest(
        @JsonProperty("code") String code,
        @JsonProperty("agent_id") String agentId,
        @JsonProperty("metadata") Map<String, String> metadata) {
    }

    public record StatusRequest(@JsonProperty("status") String status) {
    }

    @PostMapping("/agent/send")
    public Map<String, Object> send(@RequestBody SendRequest request) {
        if (request.content() == null) {
            throw new IllegalArgumentException("content is required");
        }
        String deliveryId = request.deliveryId() != null && !request.deliveryId().isBlank()
            ? request.deliveryId() : UlidCreator.getMonotonicUlid().toString();
        DeliveryResult result = hub.deliveries().send(deliveryId, request.senderAgentId(),
            request.receiverAgentId(), MessageContent.fromMap(request.content()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("delivery_id", result.deliveryId());
        body.put("status", result.status().name());
        body.put("room_id", result.roomId());
        body.put("duplicate", result.duplicate());
        body.put("warnings", result.warnings());
        return body;
    }

    @PostMapping("/owners")
    public Owner registerOwner(@RequestBody OwnerRequest request) {
        return hub.identity().registerOwner(request.ownerId(),
            request.metadata() == null ? Map.of() : request.metadata());
    }

    @PostMapping("/agents")
    public Agent registerAgent(@RequestBody AgentRequest request) {
        Initiator initiator = request.initiator() == null ? Initiator.HUMAN : request.initiator();
        Map<String, String> metadata = request.metadata() == null ? Map.of() : request.metadata();
        if (request.ownerId() == null) {
            return hub.identity().registerAgent(initiator, request.agentId(), metadata);
        }
        return hub.identity().registerAgent(initiator, request.agentId(), request.ownerId(), metadata);
    }

    @PostMapping("/owners/{ownerId}/pairing-codes")
    public Map<String, Object> createPairingCode(@PathVariable String ownerId,
            @RequestBody(required = false) PairingCodeRequest request) {
        long ttlSeconds = request == null || request.ttlSeconds() == null
            ? DEFAULT_PAIRING_TTL_SECONDS : request.ttlSeconds();
        PairingCode pairing = hub.identity().createPairingCode(ownerId, Duration.ofSeconds(ttlSeconds),
            request == null ? null : request.agentDisplayName());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", pairing.code());
        body.put("owner_id", pairing.ownerId());
        body.put("expires_at", pairing.expiresAt().toString());
        return body;
    }

    @PostMapping("/agents/pair")
    public Agent pair(@RequestBody PairRequest request) {
        return hub.identity().submitPairingCode(request.code(), request.agentId(),
            request.metadata() == null ? Map.of() : request.metadata());
    }

    @PostMapping("/agents/{agentId}/bind/{ownerId}")
    public Agent bind(@PathVariable String agentId, @PathVariable String ownerId) {
        return hub.identity().bind(ownerId, agentId);
    }

    @PostMapping("/agents/{parentId}/children/{childId}")
    public Map<String, Object> registerSubAgent(@PathVariable String parentId, @PathVariable String childId) {
        hub.identity().registerSubAgent(parentId, childId);
        return Map.of("parent_agent_id", parentId, "child_agent_id", childId);
    }

    @GetMapping("/agents/{agentId}/relationships")
    public AgentRelationships relationships(@PathVariable String agentId) {
        return hub.identity().relationships(agentId);
    }

    @GetMapping("/agents/{agentId}/owner-history")
    public List<BindingChange> ownerHistory(@PathVariable String agentId) {
        return hub.identity().bindingHistory(agentId);
    }

    @PostMapping("/agents/{agentId}/online")
    public Presence online(@PathVariable String agentId, @RequestBody(required = false) StatusRequest request) {
        return hub.presence().online(agentId, request == null ? null : request.status());
    }

    @PostMapping("/agents/{agentId}/heartbeat")
    public Presence heartbeat(@PathVariable String agentId, @RequestBody(required = false) StatusRequest request) {
        return hub.presence().heartbeat(agentId, request == null ? null : request.status());
    }
}
