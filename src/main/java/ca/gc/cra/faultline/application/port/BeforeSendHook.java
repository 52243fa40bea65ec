package ca.gc.cra.faultline.application.port;

import ca.gc.cra.faultline.domain.event.Event;

/**
 * Hook invoked on each built event before the filter and sampler run.
 *
 * <p>Returning {@code null} suppresses the event; returning a different instance replaces it.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BeforeSendHook {
  /**
   * Inspects or rewrites an event.
   *
   * @param event built event
   * @return event to continue with, or {@code null} to drop it
   */
  Event beforeSend(Event event);

  /** Hook that passes every event through unchanged. */
  BeforeSendHook IDENTITY = event -> event;
}
