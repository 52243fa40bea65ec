package ca.gc.cra.faultline.application.port;

/**
 * Outcome of a single transmission attempt.
 *
 * <p>Transmission failures are values, not exceptions: a {@link Failure} is what the caller observes when it
 * awaits a dispatch handle, and nothing at all when it does not.</p>
 *
 * @since 0.1.0
 */
public sealed interface SendResult permits SendResult.Success, SendResult.Failure {

  /** @return {@code true} when the collector accepted the event */
  boolean succeeded();

  /**
   * Collector accepted the event.
   *
   * @param id identifier assigned by the collector
   */
  record Success(String id) implements SendResult {
    public Success {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("id must not be blank");
      }
    }

    @Override
    public boolean succeeded() {
      return true;
    }
  }

  /**
   * Transmission failed.
   *
   * @param reason human-readable cause (status line, IO error message, rejection)
   * @param status HTTP status code, or {@code -1} when no response was received
   */
  record Failure(String reason, int status) implements SendResult {
    /** Status used when no HTTP response exists. */
    public static final int NO_STATUS = -1;

    public Failure {
      reason = reason == null ? "unknown" : reason;
    }

    /**
     * Creates a failure that never reached the collector.
     *
     * @param reason human-readable cause
     * @return failure with {@link #NO_STATUS}
     */
    public static Failure of(String reason) {
      return new Failure(reason, NO_STATUS);
    }

    @Override
    public boolean succeeded() {
      return false;
    }
  }
}
