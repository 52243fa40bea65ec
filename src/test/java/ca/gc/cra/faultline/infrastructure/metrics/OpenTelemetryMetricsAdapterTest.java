package ca.gc.cra.faultline.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("faultline.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("capture.excluded.sampled");
    adapter.increment("capture.excluded.sampled");
    adapter.increment("capture.excluded.sampled");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "faultline.capture.excluded.sampled");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("capture.excluded.sampled", point.getAttributes().get(KEY_ATTRIBUTE));

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("faultline", counter.getResource().getAttribute(serviceName));
    AttributeKey<String> serviceNamespace = AttributeKey.stringKey("service.namespace");
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(serviceNamespace));
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("dispatch.latencyMillis", 10L);
    adapter.observe("dispatch.latencyMillis", 20L);
    adapter.observe("dispatch.latencyMillis", 30L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "faultline.dispatch.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(3L, point.getCount());
    assertEquals(60.0, point.getSum());
    assertEquals("dispatch.latencyMillis", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("faultline.capture.excluded.before_send",
        OpenTelemetryMetricsAdapter.instrumentName("capture.excluded.before_send"));
    assertEquals("faultline.a_b", OpenTelemetryMetricsAdapter.instrumentName("A B"));
    assertEquals("faultline.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
