package com.consullo.prover.core;

import java.util.Locale;

/**
 * Severity of a prover message.
 *
 * @since 1.0
 */
public enum MessageLevel {
  DEBUG,
  INFO,
  NOTICE,
  WARNING,
  ERROR;

  /**
   * Parses the lowercase wire name of a level.
   *
   * @param wireName level name, e.g. {@code "warning"}
   * @return the level
   * @throws IllegalArgumentException if the name is unknown
   */
  public static MessageLevel fromWireName(final String wireName) {
    if (wireName == null) {
      throw new IllegalArgumentException("message level must not be null");
    }
    return valueOf(wireName.toUpperCase(Locale.ROOT));
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
