package ca.gc.cra.docwatch.infrastructure.metrics;

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
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.withReader(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("delivery.attempts");
    adapter.increment("delivery.attempts");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "delivery.attempts").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("delivery.attempts",
        point.getAttributes().get(AttributeKey.stringKey("docwatch.metric.key")));
    assertEquals("docwatch", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("delivery.attempt.latencyMillis", 40);
    adapter.observe("delivery.attempt.latencyMillis", 60);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "delivery.attempt.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum());
  }

  @Test
  void sanitizesInstrumentNames() {
    assertEquals("delivery.attempt.failure.auth_failure",
        OpenTelemetryMetricsAdapter.sanitizeName("delivery.attempt.failure.AUTH_FAILURE"));
    assertEquals("m1st_run", OpenTelemetryMetricsAdapter.sanitizeName("1st run"));
    assertEquals("docwatch.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    String previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
    try {
      OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize());
      assertTrue(noop.isNoop());
      noop.increment("ignored");
      noop.close();
    } finally {
      if (previous == null) {
        System.clearProperty("otel.metrics.exporter");
      } else {
        System.setProperty("otel.metrics.exporter", previous);
      }
    }
  }

  @Test
  void unknownExporterDisablesMetrics() {
    String previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "prometheus");
    try {
      OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize());
      assertTrue(disabled.isNoop());
      disabled.close();
    } finally {
      if (previous == null) {
        System.clearProperty("otel.metrics.exporter");
      } else {
        System.setProperty("otel.metrics.exporter", previous);
      }
    }
  }

  @Test
  void pointsCarryDocwatchServiceName() {
    adapter.increment("reminder.candidates");
    adapter.forceFlush();

    MetricData metric = find(reader.collectAllMetrics(), "reminder.candidates").orElseThrow();
    assertEquals("docwatch", metric.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
