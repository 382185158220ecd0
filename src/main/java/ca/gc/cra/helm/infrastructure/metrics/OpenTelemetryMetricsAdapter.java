package ca.gc.cra.helm.infrastructure.metrics;

import ca.gc.cra.helm.application.port.MetricsPort;
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
 * Metrics adapter that forwards HELM counters and histograms to OpenTelemetry.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("helm.metric.key");
  private static final String FALLBACK_METRIC_NAME = "helm.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Instrument<LongCounter> instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.meter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.meter().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes and shuts down the underlying meter provider.
   */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("HELM counter for " + key)
        .build();
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("HELM observation for " + key)
        .build();
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
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
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T meter, Attributes attributes) {}
}
