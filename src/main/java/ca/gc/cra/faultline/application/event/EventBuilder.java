package ca.gc.cra.faultline.application.event;

import ca.gc.cra.faultline.application.context.ErrorContext;
import ca.gc.cra.faultline.application.port.ClockPort;
import ca.gc.cra.faultline.application.source.SourceContext;
import ca.gc.cra.faultline.application.source.SourceContextResolver;
import ca.gc.cra.faultline.config.ClientConfig;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.EventIds;
import ca.gc.cra.faultline.domain.event.ExceptionValue;
import ca.gc.cra.faultline.domain.event.Frame;
import ca.gc.cra.faultline.domain.event.Level;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Normalizes Throwables, termination reports, messages, and rendered traces into
 * {@link Event}s.
 * <p><strong>Why:</strong> Every capture path must produce the same schema regardless of how much structure the
 * failure arrived with.</p>
 * <p><strong>Role:</strong> Application service invoked synchronously on the capturing thread.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map exception chains (thrown exception first, causes after) and frames (outer to inner).</li>
 *   <li>Render non-exception terminations as {@code ** (kind) reason} entries.</li>
 *   <li>Finalize ids, timestamps, and merge config, context, and option data.</li>
 *   <li>Attach source windows to in-app frames when source context is enabled.</li>
 * </ul>
 * <p><strong>Error handling:</strong> Never throws for malformed failure input; degrades to a partial event that may
 * be non-transmittable.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class EventBuilder {
  private final ClientConfig config;
  private final SourceContextResolver sourceResolver;
  private final ClockPort clock;
  private final InAppClassifier classifier;
  private final TextTraceParser textParser;

  /**
   * Creates a builder.
   *
   * @param config client configuration; must not be {@code null}
   * @param sourceResolver source lookup; {@code null} disables source context regardless of configuration
   * @param clock timestamp source; must not be {@code null}
   */
  public EventBuilder(ClientConfig config, SourceContextResolver sourceResolver, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.sourceResolver = sourceResolver;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.classifier = new InAppClassifier(config.inApp().includes(), config.inApp().excludes());
    this.textParser = new TextTraceParser(classifier);
  }

  /**
   * Builds an event from a Throwable and its cause chain.
   *
   * @param throwable captured exception; {@code null} yields a non-transmittable event
   * @param options capture options; {@code null} is treated as {@link CaptureOptions#NONE}
   * @return finalized event
   */
  public Event buildFromException(Throwable throwable, CaptureOptions options) {
    CaptureOptions opts = options == null ? CaptureOptions.NONE : options;
    Event.Builder builder = Event.builder();
    if (throwable != null) {
      builder.exceptions(exceptionChain(throwable));
      List<StackTraceElement> elements = opts.stacktrace().isEmpty()
          ? Arrays.asList(throwable.getStackTrace())
          : opts.stacktrace();
      builder.frames(StackFrames.toFrames(elements, classifier));
    }
    return finish(builder, opts);
  }

  /**
   * Builds an event from an abnormal termination.
   *
   * <p>A Throwable reason goes through {@link #buildFromException}; the report's frames win over the Throwable's own
   * when present. Any other reason becomes a single {@code {type: kind, value: "** (kind) reason"}} entry.</p>
   *
   * @param report termination report; {@code null} yields a non-transmittable event
   * @param options capture options
   * @return finalized event
   */
  public Event buildFromTermination(TerminationReport report, CaptureOptions options) {
    CaptureOptions opts = options == null ? CaptureOptions.NONE : options;
    if (report == null) {
      return finish(Event.builder(), opts);
    }
    if (report.reason() instanceof Throwable throwable) {
      CaptureOptions withFrames = report.stacktrace().isEmpty()
          ? opts
          : opts.toBuilder().stacktrace(report.stacktrace()).build();
      return buildFromException(throwable, withFrames);
    }
    String label = report.kind().label();
    Event.Builder builder = Event.builder()
        .addException(ExceptionValue.of(label, "** (" + label + ") " + String.valueOf(report.reason())));
    List<StackTraceElement> elements = opts.stacktrace().isEmpty() ? report.stacktrace() : opts.stacktrace();
    builder.frames(StackFrames.toFrames(elements, classifier));
    return finish(builder, opts);
  }

  /**
   * Builds a message-only event.
   *
   * @param message free text; {@code null} yields a non-transmittable event
   * @param options capture options
   * @return finalized event
   */
  public Event buildFromMessage(String message, CaptureOptions options) {
    CaptureOptions opts = options == null ? CaptureOptions.NONE : options;
    return finish(Event.builder().message(message), opts);
  }

  /**
   * Builds an event from a rendered failure report using {@link TextTraceParser}.
   *
   * @param renderedReport report text; {@code null} yields a non-transmittable event
   * @param options capture options
   * @return finalized event
   */
  public Event buildFromText(String renderedReport, CaptureOptions options) {
    CaptureOptions opts = options == null ? CaptureOptions.NONE : options;
    Event.Builder builder = Event.builder();
    textParser.parse(renderedReport, builder);
    return finish(builder, opts);
  }

  private Event finish(Event.Builder builder, CaptureOptions options) {
    ErrorContext.Snapshot context = options.context() == null
        ? ErrorContext.Snapshot.EMPTY
        : options.context().snapshot();

    List<Frame> frames = builder.frames();
    if (builder.culprit() == null && !frames.isEmpty()) {
      builder.culprit(frames.get(frames.size() - 1).qualifiedFunction());
    }
    if (config.sourceContext().enabled() && sourceResolver != null) {
      builder.frames(withSourceContext(frames));
    }

    return builder
        .eventId(EventIds.next())
        .timestamp(Instant.ofEpochMilli(clock.nowMillis()))
        .level(options.level() == null ? Level.ERROR : options.level())
        .serverName(config.serverName())
        .release(config.release())
        .environment(config.environment())
        .tags(config.tags())
        .tags(context.tags())
        .tags(options.tags())
        .extra(context.extra())
        .extra(options.extra())
        .user(context.user())
        .user(options.user())
        .breadcrumbs(context.breadcrumbs())
        .build();
  }

  private List<Frame> withSourceContext(List<Frame> frames) {
    int window = config.sourceContext().lines();
    List<Frame> enriched = new ArrayList<>(frames.size());
    for (Frame frame : frames) {
      if (!frame.inApp()) {
        enriched.add(frame);
        continue;
      }
      Optional<SourceContext> context =
          sourceResolver.resolveFrame(frame.module(), frame.filename(), frame.lineno(), window);
      enriched.add(context
          .map(c -> frame.withSourceContext(c.contextLine(), c.preContext(), c.postContext()))
          .orElse(frame));
    }
    return enriched;
  }

  private static List<ExceptionValue> exceptionChain(Throwable throwable) {
    List<ExceptionValue> values = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable current = throwable;
    while (current != null && seen.add(current)) {
      values.add(toExceptionValue(current));
      current = current.getCause();
    }
    return values;
  }

  private static ExceptionValue toExceptionValue(Throwable throwable) {
    Class<?> type = throwable.getClass();
    String simpleName = type.getSimpleName().isEmpty() ? type.getName() : type.getSimpleName();
    String module = type.getPackageName().isEmpty() ? null : type.getPackageName();
    return new ExceptionValue(simpleName, throwable.getMessage(), module);
  }
}
