package io.agenthub.http;

import io.agenthub.spi.CollaboratorException;
import io.agenthub.spi.PermissionInitializer;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PermissionInitializer} posting {@code {agent_id, owner_id}} to the audit
 * service's permission-initialization endpoint.
 */
public final class HttpPermissionInitializer implements PermissionInitializer {
  private final String url;
  private final JsonHttp http;

  public HttpPermissionInitializer(String url, Duration timeout) {
    this(url, JsonHttp.defaultClient(timeout), timeout);
  }

  HttpPermissionInitializer(String url, HttpClient client, Duration timeout) {
    this.url = Objects.requireNonNull(url, "url");
    this.http = new JsonHttp(client, timeout, null);
  }

  @Override
  public void agentRegistered(String agentId, String ownerId) throws CollaboratorException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("agent_id", agentId);
    body.put("owner_id", ownerId);
    http.post(url, body);
  }
}
