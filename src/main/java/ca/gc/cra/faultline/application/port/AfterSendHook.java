package ca.gc.cra.faultline.application.port;

import ca.gc.cra.faultline.domain.event.Event;

/**
 * Side-effect hook invoked on the dispatcher thread once a transmission attempt finishes.
 * Exceptions thrown by the hook are logged and ignored.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AfterSendHook {
  /**
   * Observes the outcome of a send.
   *
   * @param event event that was sent
   * @param result transmission outcome
   */
  void afterSend(Event event, SendResult result);

  /** Hook that does nothing. */
  AfterSendHook NONE = (event, result) -> {};
}
