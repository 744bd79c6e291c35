package ca.gc.cra.docwatch.infrastructure.metrics;

import ca.gc.cra.docwatch.application.port.MetricsPort;
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
 * Forwards DOCWATCH counters and histograms to OpenTelemetry.
 *
 * <p>Counter and histogram names are the metric keys lower-cased with unsupported characters replaced by
 * {@code _}; the original key travels as the {@code docwatch.metric.key} attribute. Closing the adapter
 * flushes and shuts down the meter provider.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("docwatch.metric.key");
  private static final String FALLBACK_METRIC_NAME = "docwatch.metric";

  private final MetricsPort delegate;
  private final OpenTelemetryBootstrap.MeterHandle meters;

  /**
   * Creates an adapter wired to the exporter selected by {@code otel.metrics.exporter}.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle meters) {
    this.meters = Objects.requireNonNull(meters, "meters");
    this.delegate = meters.isNoop() ? MetricsPort.NO_OP : new OtelDelegate(meters.meter());
  }

  @Override
  public void increment(String key) {
    delegate.increment(key);
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(key, value);
  }

  boolean isNoop() {
    return meters.isNoop();
  }

  void forceFlush() {
    meters.flush();
  }

  @Override
  public void close() {
    meters.flush();
    meters.close();
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private static final class OtelDelegate implements MetricsPort {
    private final Meter meter;
    private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      CounterInstrument instrument =
          counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
      instrument.counter().add(1, instrument.attributes());
    }

    @Override
    public void observe(String key, long value) {
      HistogramInstrument instrument =
          histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
      instrument.histogram().record(value, instrument.attributes());
    }

    private CounterInstrument createCounter(String key) {
      String sanitized = sanitizeName(key);
      LongCounter counter = meter
          .counterBuilder(sanitized)
          .setUnit("1")
          .setDescription("DOCWATCH counter for " + key)
          .build();
      if (!sanitized.equals(key)) {
        log.debug("Sanitized counter name '{}' -> '{}'", key, sanitized);
      }
      return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private HistogramInstrument createHistogram(String key) {
      String sanitized = sanitizeName(key);
      LongHistogram histogram = meter
          .histogramBuilder(sanitized)
          .ofLongs()
          .setDescription("DOCWATCH observation for " + key)
          .build();
      if (!sanitized.equals(key)) {
        log.debug("Sanitized histogram name '{}' -> '{}'", key, sanitized);
      }
      return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
