package ca.gc.cra.faultline.application.filter;

import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.ExceptionValue;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides whether a built event is sent.
 * <p><strong>Order:</strong> DSN configured, then environment membership, then the {@link EventFilter} (only for
 * events carrying an exception), then the {@link Sampler}. The first rejection wins.</p>
 * <p><strong>Error handling:</strong> A filter that throws is logged at WARN and treated as not excluding.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the filter and sampler must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class EventGate {
  private static final Logger log = LoggerFactory.getLogger(EventGate.class);

  private final boolean enabled;
  private final String environment;
  private final Set<String> includedEnvironments;
  private final EventFilter filter;
  private final Sampler sampler;

  /**
   * @param enabled whether a DSN is configured
   * @param environment active environment
   * @param includedEnvironments environments whose events are sent
   * @param filter exception filter
   * @param sampler sampler
   */
  public EventGate(
      boolean enabled, String environment, Set<String> includedEnvironments, EventFilter filter, Sampler sampler) {
    this.enabled = enabled;
    this.environment = environment;
    this.includedEnvironments = Set.copyOf(includedEnvironments);
    this.filter = Objects.requireNonNull(filter, "filter");
    this.sampler = Objects.requireNonNull(sampler, "sampler");
  }

  /**
   * Evaluates the gate.
   *
   * @param event candidate event
   * @param source capture source passed to the filter; may be {@code null}
   * @return the exclusion reason, or empty when the event should be sent
   */
  public Optional<Exclusion> decide(Event event, String source) {
    if (!enabled) {
      return Optional.of(Exclusion.DISABLED);
    }
    if (environment == null || !includedEnvironments.contains(environment)) {
      return Optional.of(Exclusion.ENVIRONMENT);
    }
    ExceptionValue exception = event.primaryException();
    if (exception != null && excluded(exception, source)) {
      return Optional.of(Exclusion.FILTERED);
    }
    if (!sampler.sample()) {
      return Optional.of(Exclusion.SAMPLED);
    }
    return Optional.empty();
  }

  // A failing filter keeps the event.
  private boolean excluded(ExceptionValue exception, String source) {
    try {
      return filter.excludeException(exception, source);
    } catch (RuntimeException ex) {
      log.warn("Event filter {} failed; keeping event", filter.getClass().getName(), ex);
      return false;
    }
  }

  /**
   * Boolean form of {@link #decide}.
   *
   * @param event candidate event
   * @param source capture source
   * @return {@code true} when the event should be sent
   */
  public boolean shouldSend(Event event, String source) {
    return decide(event, source).isEmpty();
  }
}
