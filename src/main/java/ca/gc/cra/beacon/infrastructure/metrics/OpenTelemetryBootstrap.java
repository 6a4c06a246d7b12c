package ca.gc.cra.beacon.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
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
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings come from system properties first, then environment variables:</p>
 * <ul>
 *   <li>{@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}: {@code otlp} or {@code none} (default).</li>
 *   <li>{@code otel.exporter.otlp.endpoint} / {@code OTEL_EXPORTER_OTLP_ENDPOINT}: gRPC endpoint, default
 *   {@value #DEFAULT_ENDPOINT}.</li>
 *   <li>{@code otel.metric.export.interval} / {@code OTEL_METRIC_EXPORT_INTERVAL}: export interval in
 *   milliseconds, default 30000.</li>
 * </ul>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.beacon";
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final long DEFAULT_INTERVAL_MILLIS = 30_000L;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    return initialize(System.getenv());
  }

  static BootstrapResult initialize(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    try {
      String exporter = setting("otel.metrics.exporter", env.get("OTEL_METRICS_EXPORTER"), "none");
      if (!"otlp".equals(exporter.toLowerCase(Locale.ROOT))) {
        if (!"none".equals(exporter.toLowerCase(Locale.ROOT))) {
          log.warn("Unknown OTEL_METRICS_EXPORTER value '{}'; metrics disabled", exporter);
        }
        return BootstrapResult.noop();
      }
      String endpoint = setting("otel.exporter.otlp.endpoint", env.get("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_ENDPOINT);
      long intervalMillis = parseInterval(
          setting("otel.metric.export.interval", env.get("OTEL_METRIC_EXPORT_INTERVAL"), ""));
      OtlpGrpcMetricExporter exporterImpl = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(exporterImpl)
          .setInterval(Duration.ofMillis(intervalMillis))
          .build();
      log.info("OpenTelemetry metrics exporting via OTLP to {} every {} ms", endpoint, intervalMillis);
      return withReader(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop meter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult withReader(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new BootstrapResult(meter, provider);
  }

  private static Resource resource(String version) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "beacon")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String impl = pkg == null ? null : pkg.getImplementationVersion();
    return impl == null || impl.isBlank() ? "0.1.0-dev" : impl;
  }

  private static long parseInterval(String raw) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_INTERVAL_MILLIS;
    }
    try {
      long value = Long.parseLong(raw.trim());
      return value > 0 ? value : DEFAULT_INTERVAL_MILLIS;
    } catch (NumberFormatException ex) {
      log.warn("Ignoring invalid metric export interval '{}'", raw);
      return DEFAULT_INTERVAL_MILLIS;
    }
  }

  private static String setting(String property, String envValue, String defaultValue) {
    String fromProperty = System.getProperty(property);
    if (fromProperty != null && !fromProperty.isBlank()) {
      return fromProperty.trim();
    }
    if (envValue != null && !envValue.isBlank()) {
      return envValue.trim();
    }
    return defaultValue;
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
