package ca.gc.cra.faultline.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to event finalization and transport auth.
 * <p><strong>Why:</strong> Gives tests a deterministic time source for event timestamps and
 * {@code sentry_timestamp} header values.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads happen on capturing
 * threads and on dispatcher workers.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z, subject to system clock adjustments
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
