package ca.gc.cra.helm.config;

import ca.gc.cra.helm.application.control.Multireceiver;
import ca.gc.cra.helm.application.entity.Character;
import ca.gc.cra.helm.application.entity.Wanderer;
import ca.gc.cra.helm.application.port.MetricsPort;
import ca.gc.cra.helm.application.port.Receiver;
import ca.gc.cra.helm.application.session.PlayerRegistry;
import ca.gc.cra.helm.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the session registry, group aggregators and metrics from a {@link HelmConfig}.
 * <p><strong>Role:</strong> Composition root used by the CLI and by embedding transports.</p>
 * <p><strong>Thread-safety:</strong> Construct and use from one thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final HelmConfig config;
  private final MetricsPort metrics;
  private final PlayerRegistry registry;

  /**
   * Creates a composition root whose metrics backend follows {@link HelmConfig#metricsExporter()}.
   *
   * @param config runtime configuration; must not be {@code null}
   */
  public CompositionRoot(HelmConfig config) {
    this(config, createMetrics(Objects.requireNonNull(config, "config")));
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config runtime configuration; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public CompositionRoot(HelmConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = MetricsPort.orNoOp(metrics);
    this.registry = new PlayerRegistry(this.metrics);
  }

  public HelmConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public PlayerRegistry registry() {
    return registry;
  }

  /**
   * Builds a group over {@code members} using the configured dedup factor.
   *
   * @param members member receivers in iteration order
   * @return new, detached group
   */
  public Multireceiver group(List<? extends Receiver> members) {
    return new Multireceiver(members, config.dedupFactor(), metrics);
  }

  /**
   * Builds the receiver the console session drives: a group of wanderers when a party is configured, otherwise a
   * single wanderer.
   *
   * @return detached receiver
   */
  public Receiver consoleReceiver() {
    if (config.party().isEmpty()) {
      return new Wanderer(config.characterName());
    }
    List<Character> party = new ArrayList<>();
    for (String name : config.party()) {
      party.add(new Wanderer(name));
    }
    log.debug("Console drives a party of {}", config.party());
    return group(party);
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter adapter) {
      adapter.close();
    }
  }

  private static MetricsPort createMetrics(HelmConfig config) {
    return switch (config.metricsExporter()) {
      case NONE -> MetricsPort.NO_OP;
      case OTLP -> new OpenTelemetryMetricsAdapter();
    };
  }
}
