package io.agenthub.server;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.agenthub.AgentHub;
import io.agenthub.approval.ApprovalResult;
import io.agenthub.model.ApprovalRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/approval")
public class ApprovalController {

    private final AgentHub hub;

    public ApprovalController(AgentHub hub) {
        this.hub = hub;
    }

    public record CreateRequest(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("payload") Map<String, Object> payload) {
    }

    public record CallbackRequest(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("decision") String decision,
        @JsonProperty("approver_id") String approverId,
        @JsonProperty("comment") String comment) {
    }

    @PostMapping
    public ApprovalRequest create(@RequestBody CreateRequest request) {
        return hub.approvals().createRequest(request.requestId(),
            request.payload() == null ? Map.of() : request.payload());
    }

    /**
     * Records the approver's decision. Repeated callbacks return the first decision.
     */
    @PostMapping("/callback")
    public ApprovalResult callback(@RequestBody CallbackRequest request) {
        return hub.approvals().resolve(request.requestId(), request.decision(),
            request.approverId(), request.comment());
    }

    @GetMapping("/{requestId}")
    public ApprovalResult result(@PathVariable String requestId) {
        return hub.approvals().getResult(requestId);
    }
}
