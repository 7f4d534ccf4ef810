package io.agenthub.server;

import io.agenthub.AgentHubException;
import io.agenthub.CycleDetectedException;
import io.agenthub.DeliveryFailedException;
import io.agenthub.DuplicateAgentException;
import io.agenthub.DuplicateRequestException;
import io.agenthub.IdentityConflictException;
import io.agenthub.InvalidPairingCodeException;
import io.agenthub.RoomProvisioningException;
import io.agenthub.StorageUnavailableException;
import io.agenthub.UnknownAgentException;
import io.agenthub.UnknownOwnerException;
import io.agenthub.UnknownRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps hub errors to HTTP statuses. The body always carries {@code error} and
 * {@code retryable}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({UnknownAgentException.class, UnknownOwnerException.class, UnknownRequestException.class})
    public ResponseEntity<Map<String, Object>> notFound(AgentHubException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), e.isRetryable());
    }

    @ExceptionHandler({IdentityConflictException.class, DuplicateAgentException.class,
        DuplicateRequestException.class, CycleDetectedException.class})
    public ResponseEntity<Map<String, Object>> conflict(AgentHubException e) {
        return error(HttpStatus.CONFLICT, e.getMessage(), false);
    }

    @ExceptionHandler(InvalidPairingCodeException.class)
    public ResponseEntity<Map<String, Object>> invalidPairingCode(InvalidPairingCodeException e) {
        return error(e.isExpired() ? HttpStatus.GONE : HttpStatus.NOT_FOUND, e.getMessage(), false);
    }

    @ExceptionHandler(DeliveryFailedException.class)
    public ResponseEntity<Map<String, Object>> deliveryFailed(DeliveryFailedException e) {
        log.warn("Delivery {} failed after {} attempt(s)", e.deliveryId(), e.attempts());
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.BAD_GATEWAY, e.getMessage(), true);
        response.getBody().put("delivery_id", e.deliveryId());
        return response;
    }

    @ExceptionHandler(RoomProvisioningException.class)
    public ResponseEntity<Map<String, Object>> roomFailed(RoomProvisioningException e) {
        log.warn("Room provisioning failed for {}", e.scopeKey(), e);
        return error(HttpStatus.BAD_GATEWAY, e.getMessage(), true);
    }

    @ExceptionHandler({StorageUnavailableException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> unavailable(RuntimeException e) {
        log.error("Service unavailable", e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), true);
    }

    @ExceptionHandler({IllegalArgumentException.class, NullPointerException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), false);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("retryable", retryable);
        return ResponseEntity.status(status).body(body);
    }
}
