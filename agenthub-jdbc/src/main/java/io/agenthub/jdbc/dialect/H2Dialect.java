package io.agenthub.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Covers the in-memory test database and the embedded file store
 * ({@code jdbc:h2:file:}).
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
