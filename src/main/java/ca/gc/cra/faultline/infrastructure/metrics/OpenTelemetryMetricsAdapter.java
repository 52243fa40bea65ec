package ca.gc.cra.faultline.infrastructure.metrics;

import ca.gc.cra.faultline.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} that records faultline counters and histograms through OpenTelemetry.
 * Instruments are created lazily, one per metric key.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("faultline.metric.key");
  private static final String FALLBACK_METRIC_NAME = "faultline.metric";
  private static final String NAME_PREFIX = "faultline.";

  private final OpenTelemetryBootstrap.Handle handle;
  private final MetricsPort delegate;

  /** Creates an adapter configured from {@code otel.*} system properties or {@code OTEL_*} variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.delegate = handle.isNoop() ? MetricsPort.NO_OP : new Instruments(handle.meter());
  }

  @Override
  public void increment(String key) {
    delegate.increment(Objects.requireNonNull(key, "key"));
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(Objects.requireNonNull(key, "key"), value);
  }

  /** @return {@code true} when no exporter is configured */
  public boolean isNoop() {
    return handle.isNoop();
  }

  void forceFlush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.close();
  }

  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(NAME_PREFIX.length() + lower.length()).append(NAME_PREFIX);
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private static final class Instruments implements MetricsPort {
    private final Meter meter;
    private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

    private Instruments(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, this::counter).add(1, attributes(key));
    }

    @Override
    public void observe(String key, long value) {
      histograms.computeIfAbsent(key, this::histogram).record(value, attributes(key));
    }

    private LongCounter counter(String key) {
      String name = instrumentName(key);
      log.debug("Registering counter {} for {}", name, key);
      return meter.counterBuilder(name).setUnit("1").setDescription("Faultline counter for " + key).build();
    }

    private LongHistogram histogram(String key) {
      String name = instrumentName(key);
      log.debug("Registering histogram {} for {}", name, key);
      return meter.histogramBuilder(name).ofLongs().setDescription("Faultline observation for " + key).build();
    }

    private static Attributes attributes(String key) {
      return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
    }
  }
}
