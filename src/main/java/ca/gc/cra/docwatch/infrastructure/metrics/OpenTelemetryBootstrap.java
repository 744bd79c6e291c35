package ca.gc.cra.docwatch.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the meter for a DOCWATCH run from {@code otel.metrics.exporter} and {@code otel.exporter.otlp.endpoint},
 * the properties {@code TelemetryConfigurator} sets from the command line.
 *
 * <p>Anything but {@code otlp} yields a noop meter. With {@code otlp}, points go out every 10 s over gRPC and
 * once more when the handle closes.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.docwatch";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_SECONDS = 5;
  private static final Resource RESOURCE = Resource.getDefault()
      .merge(Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), "docwatch")));

  private OpenTelemetryBootstrap() {}

  static MeterHandle initialize() {
    String exporter = System.getProperty("otel.metrics.exporter", "none").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp")) {
      if (!exporter.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; metrics are disabled", exporter);
      }
      return MeterHandle.noop();
    }
    String endpoint = System.getProperty("otel.exporter.otlp.endpoint", DEFAULT_ENDPOINT);
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.info("Exporting metrics over OTLP to {}", endpoint);
      return withReader(reader);
    } catch (RuntimeException ex) {
      log.error("Unable to export metrics to {}; metrics are disabled", endpoint, ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle withReader(MetricReader reader) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(RESOURCE)
        .registerMetricReader(reader)
        .build();
    return new MeterHandle(provider.get(SCOPE), provider);
  }

  /** Meter plus the provider that must be flushed when the run ends; the provider is null for noop. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void flush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      if (!result.join(SHUTDOWN_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Metrics {} did not complete within {} s", action, SHUTDOWN_SECONDS);
      }
    }
  }
}
