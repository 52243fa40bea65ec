package ca.gc.cra.faultline.application.port;

import ca.gc.cra.faultline.domain.event.Event;

/**
 * <strong>What:</strong> Output port that delivers a finished {@link Event} to the collector.
 * <p><strong>Why:</strong> Lets the dispatcher stay agnostic of HTTP, Kafka, or test doubles.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code HttpTransport} and {@code KafkaTransport}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize the event to the wire schema.</li>
 *   <li>Make at most one delivery attempt; no retries.</li>
 *   <li>Report the outcome as a {@link SendResult} instead of throwing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent {@code send} calls from
 * dispatcher workers.</p>
 * <p><strong>Performance:</strong> {@code send} blocks on network I/O and is only invoked from pool threads.</p>
 *
 * @implNote Extends {@link AutoCloseable} so connection pools and producers are released on shutdown.
 * @since 0.1.0
 */
public interface Transport extends AutoCloseable {
  /**
   * Delivers the event.
   *
   * @param event finalized event; must not be {@code null}
   * @return success with the collector-assigned id, or failure with the reason
   */
  SendResult send(Event event);

  /**
   * Releases transport resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
