package ca.gc.cra.helm.application.port;

/**
 * <strong>What:</strong> Port through which routing and session code reports counters and samples.
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} when metrics are off.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from whichever thread drives sessions.</p>
 * <p><strong>Observability:</strong> Keys are dotted names grouped by component, e.g.
 * {@code multireceiver.member.evicted} or {@code session.connected}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Adds one to the named counter.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Adds a sample to the named histogram.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value sample, e.g. the number of members a command was copied to
   */
  void observe(String key, long value);

  /** Sink that drops everything. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };

  /**
   * Substitutes {@link #NO_OP} for a missing sink.
   *
   * @param metrics candidate sink, may be {@code null}
   * @return {@code metrics}, or {@link #NO_OP} when it is {@code null}
   */
  static MetricsPort orNoOp(MetricsPort metrics) {
    return metrics == null ? NO_OP : metrics;
  }
}
