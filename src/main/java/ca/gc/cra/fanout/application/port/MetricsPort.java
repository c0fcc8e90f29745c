package ca.gc.cra.fanout.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for fan-out runs.
 * <p><strong>Why:</strong> Lets the dispatcher and executor count outcomes and record latencies without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Driven port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every worker thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code fanout.host.latencyMillis}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g., {@code fanout.host.success}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value in the unit implied by the name
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
