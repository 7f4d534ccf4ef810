package io.agenthub.util;

/**
 * Argument checks for caller-supplied identifiers.
 */
public final class Ids {

  /**
   * Longest owner or agent id accepted at registration. Keys derived from two ids, such as
   * {@code <len>:<parent>/<child>} relationship keys, must stay within the store's
   * 255-character key limit.
   */
  public static final int MAX_ID_LENGTH = 120;

  private Ids() {}

  /**
   * @throws IllegalArgumentException if {@code value} is null or blank
   */
  public static String require(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return value;
  }

  /**
   * Validates a new owner or agent id.
   *
   * @throws IllegalArgumentException if {@code value} is blank or longer than {@link #MAX_ID_LENGTH}
   */
  public static String requireIdentity(String value, String name) {
    require(value, name);
    if (value.length() > MAX_ID_LENGTH) {
      throw new IllegalArgumentException(name + " must be at most " + MAX_ID_LENGTH
          + " characters, got " + value.length());
    }
    return value;
  }

  /**
   * Whether {@code value} could name a registered owner or agent.
   */
  public static boolean isIdentity(String value) {
    return value != null && !value.isBlank() && value.length() <= MAX_ID_LENGTH;
  }
}
