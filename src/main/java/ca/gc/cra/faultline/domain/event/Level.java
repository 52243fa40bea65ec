package ca.gc.cra.faultline.domain.event;

import java.util.Locale;

/**
 * Severity carried by an {@link Event} and by {@link Breadcrumb}s.
 *
 * @since 0.1.0
 */
public enum Level {
  DEBUG,
  INFO,
  WARNING,
  ERROR,
  FATAL;

  /**
   * Returns the lowercase wire name (e.g., {@code "error"}).
   *
   * @return wire representation
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a level from its wire or enum name, case-insensitively.
   *
   * @param value level name; {@code null} or blank yields {@link #ERROR}
   * @return matching level
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Level fromWireName(String value) {
    if (value == null || value.isBlank()) {
      return ERROR;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if ("WARN".equals(normalized)) {
      return WARNING;
    }
    return Level.valueOf(normalized);
  }
}
