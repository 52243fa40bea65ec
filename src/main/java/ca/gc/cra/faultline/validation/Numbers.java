package ca.gc.cra.faultline.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by faultline configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid sample rates, pool sizes, and timeouts before the
 * dispatcher and transports allocate resources.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., connections, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a probability lies within {@code [0.0, 1.0]}.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate probability
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN or outside the unit interval
   */
  public static double requireFraction(String name, double value) {
    if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
      throw new IllegalArgumentException(label(name) + " must be between 0.0 and 1.0 (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer configuration value, falling back to a default when absent.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw raw text; {@code null} or blank selects {@code defaultValue}
   * @param defaultValue fallback value
   * @return parsed integer
   * @throws IllegalArgumentException if {@code raw} is not an integer
   */
  public static int parseInt(String name, String raw, int defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw + "')", ex);
    }
  }

  /**
   * Parses a decimal configuration value, falling back to a default when absent.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw raw text; {@code null} or blank selects {@code defaultValue}
   * @param defaultValue fallback value
   * @return parsed double
   * @throws IllegalArgumentException if {@code raw} is not a number
   */
  public static double parseDouble(String name, String raw, double defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was '" + raw + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
