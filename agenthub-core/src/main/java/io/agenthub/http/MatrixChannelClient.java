package io.agenthub.http;

import io.agenthub.spi.ChannelProvisioner;
import io.agenthub.spi.ChannelSender;
import io.agenthub.spi.CollaboratorException;
import io.agenthub.translate.ChannelPayload;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal Matrix client-server API client: room creation and message sending as the
 * hub's bot user.
 *
 * <p>Messages are sent with {@code PUT /rooms/{roomId}/send/m.room.message/{txnId}}; the
 * homeserver deduplicates by transaction id, so retries of one delivery post one event.
 */
public final class MatrixChannelClient implements ChannelProvisioner, ChannelSender {
  private static final String API = "/_matrix/client/v3";

  private final String homeserverUrl;
  private final JsonHttp http;

  public MatrixChannelClient(String homeserverUrl, String accessToken, Duration timeout) {
    this(homeserverUrl, accessToken, JsonHttp.defaultClient(timeout), timeout);
  }

  MatrixChannelClient(String homeserverUrl, String accessToken, HttpClient client, Duration timeout) {
    this.homeserverUrl = JsonHttp.trimTrailingSlash(homeserverUrl);
    this.http = new JsonHttp(client, timeout, accessToken);
  }

  public String homeserverUrl() {
    return homeserverUrl;
  }

  @Override
  public String createRoom(String name) throws CollaboratorException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("name", name);
    body.put("preset", "private_chat");
    Object roomId = http.post(homeserverUrl + API + "/createRoom", body).body().get("room_id");
    if (roomId == null) {
      throw CollaboratorException.permanent("createRoom response has no room_id");
    }
    return roomId.toString();
  }

  @Override
  public String send(String roomId, ChannelPayload payload, String transactionId) throws CollaboratorException {
    String url = homeserverUrl + API + "/rooms/" + encode(roomId) + "/send/m.room.message/"
        + encode(transactionId);
    Object eventId = http.put(url, payload.content()).body().get("event_id");
    if (eventId == null) {
      throw CollaboratorException.permanent("send response has no event_id");
    }
    return eventId.toString();
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
