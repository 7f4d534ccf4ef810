package io.agenthub;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What clients need to find the hub: the Matrix homeserver and, optionally, the base
 * URL of the hub's own API.
 *
 * @param apiBase {@code null} when not advertised
 */
public record DiscoveryDocument(String matrixHomeserver, String apiBase, String version) {
  public static final String CURRENT_VERSION = "1.0";

  public DiscoveryDocument {
    Objects.requireNonNull(matrixHomeserver, "matrixHomeserver");
    Objects.requireNonNull(version, "version");
  }

  /**
   * Wire form; {@code api_base} is omitted when unset.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("matrix_homeserver", matrixHomeserver);
    if (apiBase != null && !apiBase.isBlank()) {
      map.put("api_base", apiBase);
    }
    map.put("version", version);
    return map;
  }
}
