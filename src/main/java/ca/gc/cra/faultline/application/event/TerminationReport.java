package ca.gc.cra.faultline.application.event;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Abnormal termination of a monitored execution unit.
 *
 * @param kind how the unit terminated
 * @param reason termination reason; a {@link Throwable} is captured through the exception path, anything else is
 *     rendered with {@link String#valueOf(Object)}
 * @param stacktrace frames reported alongside the reason; may be empty
 * @since 0.1.0
 */
public record TerminationReport(Kind kind, Object reason, List<StackTraceElement> stacktrace) {
  public TerminationReport {
    Objects.requireNonNull(kind, "kind");
    stacktrace = stacktrace == null ? List.of() : List.copyOf(stacktrace);
  }

  /**
   * Reports an exit with a non-exception reason and no frames.
   *
   * @param reason exit reason (e.g., {@code :bad_exit})
   * @return report
   */
  public static TerminationReport exit(Object reason) {
    return new TerminationReport(Kind.EXIT, reason, List.of());
  }

  /** Termination kinds. */
  public enum Kind {
    ERROR,
    EXIT,
    THROW;

    /** @return lowercase label used as the exception type (e.g., {@code exit}) */
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a label, case-insensitively.
     *
     * @param value label; {@code null} or blank yields {@link #ERROR}
     * @return kind
     * @throws IllegalArgumentException when the label is unknown
     */
    public static Kind fromLabel(String value) {
      if (value == null || value.isBlank()) {
        return ERROR;
      }
      return Kind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
  }
}
