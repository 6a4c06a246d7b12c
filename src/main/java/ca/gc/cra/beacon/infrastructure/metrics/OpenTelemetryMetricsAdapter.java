package ca.gc.cra.beacon.infrastructure.metrics;

import ca.gc.cra.beacon.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards Beacon counters and histograms to OpenTelemetry.
 * <p><strong>Why:</strong> Performance tracker health ({@code performance.recorded},
 * {@code performance.sink.failures}, ...) can be scraped alongside the host application's metrics.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; safe for concurrent use.</p>
 *
 * @implNote Instrument names are lower-cased and prefixed with {@code beacon.}; characters outside
 *     {@code [a-z0-9._-]} become underscores. The original key is attached as the {@code beacon.metric.key}
 *     attribute.
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("beacon.metric.key");
  private static final String PREFIX = "beacon.";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  private OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  /**
   * Creates an adapter configured from {@code OTEL_*} system properties and environment variables.
   *
   * @return adapter; backed by a noop meter when exporting is disabled or fails to initialize
   */
  public static OpenTelemetryMetricsAdapter fromEnvironment() {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize());
  }

  /**
   * Creates an adapter exporting through the given reader, for example an in-memory reader in tests.
   *
   * @param reader metric reader; must not be {@code null}
   * @return adapter backed by a dedicated SDK meter provider
   */
  public static OpenTelemetryMetricsAdapter withReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.withReader(reader));
  }

  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Instrument<LongCounter> instrument = counters.computeIfAbsent(effectiveKey, k -> new Instrument<>(
        meter.counterBuilder(instrumentName(k)).setUnit("1").setDescription("Beacon counter for " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(effectiveKey, k -> new Instrument<>(
        meter.histogramBuilder(instrumentName(k)).ofLongs().setDescription("Beacon observation for " + k).build(),
        Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().record(value, instrument.attributes());
  }

  /** Flushes pending measurements to the configured reader. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  static String instrumentName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return PREFIX + "metric";
    }
    StringBuilder result = new StringBuilder(PREFIX.length() + trimmed.length());
    result.append(PREFIX);
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T handle, Attributes attributes) {}
}
