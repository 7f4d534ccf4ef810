package io.agenthub.http;

import io.agenthub.spi.CollaboratorException;
import io.agenthub.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Small JSON-over-HTTP helper shared by the collaborator clients.
 *
 * <p>Maps outcomes onto {@link CollaboratorException}: network errors, timeouts,
 * {@code 429} and {@code 5xx} are transient; other non-2xx statuses are permanent.
 */
final class JsonHttp {
  private final HttpClient client;
  private final JsonCodec jsonCodec;
  private final Duration requestTimeout;
  private final String bearerToken;

  JsonHttp(HttpClient client, Duration requestTimeout, String bearerToken) {
    this.client = Objects.requireNonNull(client, "client");
    this.jsonCodec = JsonCodec.getDefault();
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.bearerToken = bearerToken;
  }

  static HttpClient defaultClient(Duration connectTimeout) {
    return HttpClient.newBuilder().connectTimeout(connectTimeout).build();
  }

  static String trimTrailingSlash(String url) {
    Objects.requireNonNull(url, "url");
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  Response post(String url, Map<String, Object> body) throws CollaboratorException {
    return send(request(url).POST(HttpRequest.BodyPublishers.ofString(jsonCodec.toJson(body),
        StandardCharsets.UTF_8)));
  }

  Response put(String url, Map<String, Object> body) throws CollaboratorException {
    return send(request(url).PUT(HttpRequest.BodyPublishers.ofString(jsonCodec.toJson(body),
        StandardCharsets.UTF_8)));
  }

  Response get(String url) throws CollaboratorException {
    return send(request(url).GET());
  }

  private HttpRequest.Builder request(String url) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
        .timeout(requestTimeout)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json");
    if (bearerToken != null && !bearerToken.isBlank()) {
      builder.header("Authorization", "Bearer " + bearerToken);
    }
    return builder;
  }

  private Response send(HttpRequest.Builder builder) throws CollaboratorException {
    HttpRequest request = builder.build();
    HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      // includes HttpTimeoutException
      throw new CollaboratorException(request.method() + " " + request.uri() + " failed: " + e, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CollaboratorException("Interrupted calling " + request.uri(), e, false);
    }
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new HttpStatusException(status, request.method() + " " + request.uri() + " returned "
          + status + ": " + response.body());
    }
    return new Response(status, parseBody(response.body(), request));
  }

  private Map<String, Object> parseBody(String body, HttpRequest request) throws CollaboratorException {
    try {
      return jsonCodec.parseObject(body);
    } catch (IllegalArgumentException e) {
      throw new CollaboratorException("Invalid JSON from " + request.uri(), e, false);
    }
  }

  record Response(int status, Map<String, Object> body) {}
}
