package ca.gc.cra.faultline.application.capture;

import ca.gc.cra.faultline.application.filter.Exclusion;
import ca.gc.cra.faultline.application.port.SendResult;
import ca.gc.cra.faultline.domain.event.Event;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of a capture call. Capture calls always return one of these promptly and never throw.
 *
 * @since 0.1.0
 */
public sealed interface CaptureResult
    permits CaptureResult.Sent, CaptureResult.Excluded, CaptureResult.Unparsable {

  /**
   * The event was handed to the dispatcher.
   *
   * @param event event being transmitted
   * @param handle completes with the transmission outcome; may be ignored
   */
  record Sent(Event event, CompletableFuture<SendResult> handle) implements CaptureResult {
    public Sent {
      Objects.requireNonNull(event, "event");
      Objects.requireNonNull(handle, "handle");
    }
  }

  /**
   * The event was built but not sent.
   *
   * @param event built event
   * @param reason which stage excluded it
   */
  record Excluded(Event event, Exclusion reason) implements CaptureResult {
    public Excluded {
      Objects.requireNonNull(reason, "reason");
    }
  }

  /**
   * Neither a message nor exception data could be extracted.
   *
   * @param reason diagnostic description
   */
  record Unparsable(String reason) implements CaptureResult {}
}
