package ca.gc.cra.helm.infrastructure.metrics;

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
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter used by {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings resolve from a system property first, then the matching {@code OTEL_*} environment variable:</p>
 * <ul>
 *   <li>{@code otel.metrics.exporter}: {@code otlp} (default) or {@code none}</li>
 *   <li>{@code otel.exporter.otlp.endpoint}: collector endpoint, default {@code http://localhost:4317}</li>
 *   <li>{@code otel.metric.export.interval}: export interval in milliseconds, default 30 s</li>
 * </ul>
 * <p>Any failure while building the exporter degrades to a noop meter.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.helm";
  private static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    BootstrapConfig config = BootstrapConfig.fromEnvironment();
    if (config.exporter() == ExporterMode.NONE) {
      log.info("OpenTelemetry metrics disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(config.endpoint()).build())
          .setInterval(config.interval())
          .build();
      log.info("Exporting HELM metrics to {} every {}", config.endpoint(), config.interval());
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("Could not start OpenTelemetry metrics export; continuing without metrics", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null || pkg.getImplementationVersion() == null
        ? "0.0.0-dev"
        : pkg.getImplementationVersion();
    Attributes service = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "helm")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), instanceId())
        .build();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(Resource.create(service)))
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  private static String instanceId() {
    try {
      return InetAddress.getLocalHost().getHostName() + "-" + ProcessHandle.current().pid();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable; using pid as instance id", ex);
      return "pid-" + ProcessHandle.current().pid();
    }
  }

  private static String setting(String property, String env, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  record BootstrapConfig(ExporterMode exporter, String endpoint, Duration interval) {
    static BootstrapConfig fromEnvironment() {
      String rawInterval = setting("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL", "");
      Duration interval = DEFAULT_INTERVAL;
      if (!rawInterval.isEmpty()) {
        try {
          interval = Duration.ofMillis(Long.parseLong(rawInterval));
        } catch (NumberFormatException ex) {
          log.warn("Ignoring non-numeric metric export interval '{}'", rawInterval);
        }
      }
      return new BootstrapConfig(
          ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp")),
          setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317"),
          interval);
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("none")) {
        return NONE;
      }
      if (!normalized.equals("otlp")) {
        log.warn("Unsupported metrics exporter '{}'; using otlp", raw);
      }
      return OTLP;
    }
  }

  /** Meter plus the provider that owns it; the provider is {@code null} in noop mode. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !await(provider.forceFlush())) {
        log.warn("Metric flush did not finish within {}s", SHUTDOWN_TIMEOUT_SECONDS);
      }
    }

    @Override
    public void close() {
      if (provider != null && !await(provider.shutdown())) {
        log.warn("Meter provider shutdown did not finish within {}s", SHUTDOWN_TIMEOUT_SECONDS);
      }
    }

    private static boolean await(CompletableResultCode result) {
      return result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess();
    }
  }
}
