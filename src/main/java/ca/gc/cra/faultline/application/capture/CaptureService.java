package ca.gc.cra.faultline.application.capture;

import ca.gc.cra.faultline.application.dispatch.Dispatcher;
import ca.gc.cra.faultline.application.event.CaptureOptions;
import ca.gc.cra.faultline.application.event.EventBuilder;
import ca.gc.cra.faultline.application.event.TerminationReport;
import ca.gc.cra.faultline.application.filter.EventGate;
import ca.gc.cra.faultline.application.filter.Exclusion;
import ca.gc.cra.faultline.application.port.BeforeSendHook;
import ca.gc.cra.faultline.application.port.MetricsPort;
import ca.gc.cra.faultline.domain.event.Event;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point for explicit captures and for the adapters.
 * <p><strong>Pipeline:</strong> build, reject non-transmittable events, run the before-send hook, apply the
 * {@link EventGate}, then hand off to the {@link Dispatcher}.</p>
 * <p><strong>Error handling:</strong> Never throws to the caller; every path yields a {@link CaptureResult}.</p>
 * <p><strong>Thread-safety:</strong> Stateless beyond its immutable collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emits {@code capture.unparsable}, {@code capture.excluded.<reason>}, and
 * {@code capture.dispatched}.</p>
 *
 * @since 0.1.0
 */
public final class CaptureService {
  private static final Logger log = LoggerFactory.getLogger(CaptureService.class);

  private final EventBuilder builder;
  private final BeforeSendHook beforeSend;
  private final EventGate gate;
  private final Dispatcher dispatcher;
  private final MetricsPort metrics;

  /**
   * @param builder event builder
   * @param beforeSend hook applied before the gate; {@code null} passes events through
   * @param gate send decision
   * @param dispatcher asynchronous sender
   * @param metrics metrics sink
   */
  public CaptureService(
      EventBuilder builder,
      BeforeSendHook beforeSend,
      EventGate gate,
      Dispatcher dispatcher,
      MetricsPort metrics) {
    this.builder = Objects.requireNonNull(builder, "builder");
    this.beforeSend = beforeSend == null ? BeforeSendHook.IDENTITY : beforeSend;
    this.gate = Objects.requireNonNull(gate, "gate");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Captures a Throwable.
   *
   * @param throwable exception to report
   * @param options capture options; {@code null} for none
   * @return capture outcome
   */
  public CaptureResult captureException(Throwable throwable, CaptureOptions options) {
    return capture(() -> builder.buildFromException(throwable, options), options);
  }

  /**
   * Captures a free-text message.
   *
   * @param message message to report
   * @param options capture options; {@code null} for none
   * @return capture outcome
   */
  public CaptureResult captureMessage(String message, CaptureOptions options) {
    return capture(() -> builder.buildFromMessage(message, options), options);
  }

  /**
   * Captures an abnormal termination.
   *
   * @param report termination report
   * @param options capture options; {@code null} for none
   * @return capture outcome
   */
  public CaptureResult captureTermination(TerminationReport report, CaptureOptions options) {
    return capture(() -> builder.buildFromTermination(report, options), options);
  }

  /**
   * Captures a rendered failure report.
   *
   * @param renderedReport report text
   * @param options capture options; {@code null} for none
   * @return capture outcome
   */
  public CaptureResult captureText(String renderedReport, CaptureOptions options) {
    return capture(() -> builder.buildFromText(renderedReport, options), options);
  }

  private CaptureResult capture(Supplier<Event> build, CaptureOptions options) {
    String source = options == null ? null : options.source();
    Event event;
    try {
      event = build.get();
    } catch (RuntimeException ex) {
      log.warn("Unable to build event", ex);
      metrics.increment("capture.unparsable");
      return new CaptureResult.Unparsable(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
    if (!event.isTransmittable()) {
      metrics.increment("capture.unparsable");
      return new CaptureResult.Unparsable("no message or exception could be extracted");
    }

    Event candidate;
    try {
      candidate = beforeSend.beforeSend(event);
    } catch (RuntimeException ex) {
      log.warn("Before-send hook failed for event {}; sending unchanged", event.eventId(), ex);
      candidate = event;
    }
    if (candidate == null) {
      return excluded(event, Exclusion.BEFORE_SEND);
    }

    Optional<Exclusion> exclusion = gate.decide(candidate, source);
    if (exclusion.isPresent()) {
      return excluded(candidate, exclusion.get());
    }
    metrics.increment("capture.dispatched");
    return new CaptureResult.Sent(candidate, dispatcher.dispatch(candidate));
  }

  private CaptureResult excluded(Event event, Exclusion reason) {
    metrics.increment("capture.excluded." + reason.metricSuffix());
    log.debug("Event {} excluded: {}", event.eventId(), reason);
    return new CaptureResult.Excluded(event, reason);
  }
}
