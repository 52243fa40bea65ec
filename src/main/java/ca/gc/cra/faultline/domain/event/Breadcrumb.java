package ca.gc.cra.faultline.domain.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Timestamped diagnostic note recorded before a failure.
 * <p><strong>Why:</strong> Gives operators the trail of actions that led up to a captured error.</p>
 * <p><strong>Thread-safety:</strong> Immutable; {@code data} is defensively copied.</p>
 *
 * @param timestamp when the note was recorded
 * @param category free-form grouping label; may be {@code null}
 * @param message human-readable note; may be {@code null}
 * @param level severity of the note
 * @param data structured attributes; never {@code null}
 * @since 0.1.0
 */
public record Breadcrumb(Instant timestamp, String category, String message, Level level, Map<String, Object> data) {
  public Breadcrumb {
    Objects.requireNonNull(timestamp, "timestamp");
    level = level == null ? Level.INFO : level;
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  /**
   * Creates an info-level breadcrumb with no data.
   *
   * @param timestamp when the note was recorded
   * @param category grouping label
   * @param message note text
   * @return breadcrumb
   */
  public static Breadcrumb of(Instant timestamp, String category, String message) {
    return new Breadcrumb(timestamp, category, message, Level.INFO, Map.of());
  }
}
