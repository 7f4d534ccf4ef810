package io.agenthub.translate;

import java.util.List;
import java.util.Objects;

/**
 * Result of a translation together with the warnings for fields that had no
 * equivalent and were dropped.
 */
public record Translation<T>(T value, List<String> warnings) {

  public Translation {
    Objects.requireNonNull(value, "value");
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public boolean isLossless() {
    return warnings.isEmpty();
  }
}
