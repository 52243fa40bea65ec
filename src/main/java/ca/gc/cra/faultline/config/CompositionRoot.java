package ca.gc.cra.faultline.config;

import ca.gc.cra.faultline.adapter.kafka.KafkaTransport;
import ca.gc.cra.faultline.adapter.report.ErrorReportHandler;
import ca.gc.cra.faultline.adapter.report.TerminationReporter;
import ca.gc.cra.faultline.application.capture.CaptureService;
import ca.gc.cra.faultline.application.dispatch.Dispatcher;
import ca.gc.cra.faultline.application.event.EventBuilder;
import ca.gc.cra.faultline.application.filter.EventFilter;
import ca.gc.cra.faultline.application.filter.EventGate;
import ca.gc.cra.faultline.application.filter.Sampler;
import ca.gc.cra.faultline.application.port.AfterSendHook;
import ca.gc.cra.faultline.application.port.BeforeSendHook;
import ca.gc.cra.faultline.application.port.ClockPort;
import ca.gc.cra.faultline.application.port.MetricsPort;
import ca.gc.cra.faultline.application.port.SendResult;
import ca.gc.cra.faultline.application.port.Transport;
import ca.gc.cra.faultline.application.source.SourceContextResolver;
import ca.gc.cra.faultline.config.ClientConfig.SourceContextSettings;
import ca.gc.cra.faultline.config.ClientConfig.TransportSettings;
import ca.gc.cra.faultline.infrastructure.json.EventJsonWriter;
import ca.gc.cra.faultline.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.faultline.infrastructure.transport.http.HttpTransport;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the capture pipeline to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate a {@link ClientConfig} into a running client.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning build, gate, dispatch, and transport stages.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the HTTP or Kafka transport, or a refusing transport when no DSN is configured.</li>
 *   <li>Preload source files when source context is enabled.</li>
 *   <li>Expose the capture service and the report adapters built on it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construction is single-threaded; exposed components are thread-safe.</p>
 * <p><strong>Observability:</strong> Creates an {@link OpenTelemetryMetricsAdapter} unless a metrics port is
 * supplied.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ClientConfig config;
  private final MetricsPort metrics;
  private final OpenTelemetryMetricsAdapter ownedMetrics;
  private final SourceContextResolver sourceResolver;
  private final Dispatcher dispatcher;
  private final CaptureService captureService;
  private final ErrorReportHandler reportHandler;
  private final TerminationReporter terminationReporter;

  /**
   * Wires a client with default hooks, system clock, and OpenTelemetry metrics.
   *
   * @param config resolved configuration
   */
  public CompositionRoot(ClientConfig config) {
    this(config, null, null, ClockPort.SYSTEM, null);
  }

  /**
   * Wires a client.
   *
   * @param config resolved configuration
   * @param beforeSend hook run before the send decision; {@code null} passes events through
   * @param afterSend hook run after every send attempt; {@code null} disables it
   * @param clock clock for timestamps and auth headers
   * @param metrics metrics sink; {@code null} creates an {@link OpenTelemetryMetricsAdapter} owned by this root
   */
  public CompositionRoot(
      ClientConfig config,
      BeforeSendHook beforeSend,
      AfterSendHook afterSend,
      ClockPort clock,
      MetricsPort metrics) {
    this(config, beforeSend, afterSend, clock, metrics, null);
  }

  CompositionRoot(
      ClientConfig config,
      BeforeSendHook beforeSend,
      AfterSendHook afterSend,
      ClockPort clock,
      MetricsPort metrics,
      Transport transportOverride) {
    this.config = Objects.requireNonNull(config, "config");
    ClockPort effectiveClock = clock == null ? ClockPort.SYSTEM : clock;
    if (metrics == null) {
      this.ownedMetrics = new OpenTelemetryMetricsAdapter();
      this.metrics = ownedMetrics;
    } else {
      this.ownedMetrics = null;
      this.metrics = metrics;
    }

    this.sourceResolver = createSourceResolver(config.sourceContext());
    EventBuilder builder = new EventBuilder(config, sourceResolver, effectiveClock);
    EventFilter filter = config.filterClass() == null
        ? EventFilter.NONE
        : EventFilter.load(config.filterClass(), Thread.currentThread().getContextClassLoader());
    EventGate gate = new EventGate(config.enabled(), config.environment(), config.includedEnvironments(), filter,
        new Sampler(config.sampleRate()));

    Transport transport = transportOverride != null ? transportOverride : createTransport(config, effectiveClock);
    this.dispatcher = new Dispatcher(transport, afterSend, this.metrics, effectiveClock,
        config.dispatch().workers(), config.dispatch().queueCapacity());
    this.captureService = new CaptureService(builder, beforeSend, gate, dispatcher, this.metrics);
    this.reportHandler = new ErrorReportHandler(captureService);
    this.terminationReporter = new TerminationReporter(reportHandler, config::newContext, null);
    log.info("faultline client ready (enabled={}, environment={}, transport={})",
        config.enabled(), config.environment(), config.transport().type());
  }

  /**
   * Loads YAML configuration and wires a client.
   *
   * @param path YAML file; a missing file yields the default (disabled) configuration
   * @param profile profile section merged over {@code common}
   * @return wired client
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the configuration is invalid
   */
  public static CompositionRoot fromYaml(Path path, String profile) throws IOException {
    Map<String, String> values = YamlConfigLoader.load(path, profile).orElse(Map.of());
    return new CompositionRoot(ClientConfig.fromMap(values));
  }

  public ClientConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public CaptureService captureService() {
    return captureService;
  }

  public ErrorReportHandler errorReportHandler() {
    return reportHandler;
  }

  public TerminationReporter terminationReporter() {
    return terminationReporter;
  }

  /**
   * Returns the source resolver, if source context is enabled.
   *
   * @return resolver or {@code null}
   */
  public SourceContextResolver sourceResolver() {
    return sourceResolver;
  }

  /** Drains the dispatcher, closes the transport, and flushes owned metrics. */
  @Override
  public void close() {
    dispatcher.close();
    if (ownedMetrics != null) {
      ownedMetrics.close();
    }
  }

  private static SourceContextResolver createSourceResolver(SourceContextSettings settings) {
    if (!settings.enabled()) {
      return null;
    }
    SourceContextResolver resolver =
        new SourceContextResolver(settings.rootPath(), settings.glob(), settings.excludes());
    try {
      resolver.preload();
    } catch (IOException ex) {
      log.warn("Source preload from {} failed; files will be read on demand", settings.rootPath(), ex);
    }
    return resolver;
  }

  private static Transport createTransport(ClientConfig config, ClockPort clock) {
    if (!config.enabled()) {
      return event -> SendResult.Failure.of("no DSN configured");
    }
    TransportSettings settings = config.transport();
    EventJsonWriter writer = new EventJsonWriter();
    return switch (settings.type()) {
      case HTTP -> new HttpTransport(config.dsn(), settings, writer, clock);
      case KAFKA -> new KafkaTransport(settings.kafkaBootstrap(), settings.kafkaTopic(), writer,
          Duration.ofMillis(settings.readTimeoutMillis()));
    };
  }
}
