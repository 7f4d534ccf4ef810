package io.agenthub.http;

import io.agenthub.spi.ChainRegistrar;
import io.agenthub.spi.CollaboratorException;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ChainRegistrar} over the chain service's HTTP API:
 * {@code POST {baseUrl}/did/register} and {@code GET {baseUrl}/did/{did}}.
 *
 * <p>When the service answers without a {@code did} the identifier defaults to
 * {@code did:<namespace>:local:<agentId>}.
 */
public final class HttpChainRegistrar implements ChainRegistrar {
  private final String baseUrl;
  private final String namespace;
  private final JsonHttp http;

  public HttpChainRegistrar(String baseUrl, String namespace, Duration timeout) {
    this(baseUrl, namespace, JsonHttp.defaultClient(timeout), timeout);
  }

  HttpChainRegistrar(String baseUrl, String namespace, HttpClient client, Duration timeout) {
    this.baseUrl = JsonHttp.trimTrailingSlash(baseUrl);
    this.namespace = namespace == null || namespace.isBlank() ? "agenthub" : namespace;
    this.http = new JsonHttp(client, timeout, null);
  }

  public static String localDid(String namespace, String agentId) {
    return "did:" + namespace + ":local:" + agentId;
  }

  @Override
  public String registerDid(String agentId, String ownerId) throws CollaboratorException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("agent_id", agentId);
    body.put("owner_id", ownerId);
    Object did = http.post(baseUrl + "/did/register", body).body().get("did");
    return did == null || did.toString().isBlank() ? localDid(namespace, agentId) : did.toString();
  }

  @Override
  public Optional<Map<String, Object>> lookupDid(String did) throws CollaboratorException {
    try {
      return Optional.of(http.get(baseUrl + "/did/" + URLEncoder.encode(did, StandardCharsets.UTF_8)).body());
    } catch (HttpStatusException e) {
      if (e.statusCode() == 404) {
        return Optional.empty();
      }
      throw e;
    }
  }
}
