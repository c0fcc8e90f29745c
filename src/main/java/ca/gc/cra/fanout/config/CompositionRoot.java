package ca.gc.cra.fanout.config;

import ca.gc.cra.fanout.application.dispatch.FanoutDispatcher;
import ca.gc.cra.fanout.application.dispatch.RemoteExecutor;
import ca.gc.cra.fanout.application.port.ClockPort;
import ca.gc.cra.fanout.application.port.MetricsPort;
import ca.gc.cra.fanout.application.port.RemoteShellTransport;
import ca.gc.cra.fanout.application.port.ResultReporter;
import ca.gc.cra.fanout.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.fanout.infrastructure.ssh.OpenSshTransport;
import ca.gc.cra.fanout.infrastructure.time.SystemClockAdapter;
import java.io.OutputStream;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the dispatcher to its concrete adapters for one run.
 * <p><strong>Why:</strong> Keeps adapter selection (OpenSSH transport, report format, OpenTelemetry metrics) in a
 * single place so the CLI only deals with configuration and exit codes.</p>
 * <p><strong>Thread-safety:</strong> Factory methods are called from the CLI thread during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final FanoutConfig config;
  private final Supplier<MetricsPort> metricsFactory;
  private final ClockPort clock;
  private MetricsPort metrics;

  /**
   * Creates a root exporting metrics through OpenTelemetry as configured by {@code otel.*} system properties.
   *
   * @param config validated run configuration
   */
  public CompositionRoot(FanoutConfig config) {
    this(config, OpenTelemetryMetricsAdapter::new, new SystemClockAdapter());
  }

  CompositionRoot(FanoutConfig config, Supplier<MetricsPort> metricsFactory, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metricsFactory = Objects.requireNonNull(metricsFactory, "metricsFactory");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public FanoutConfig config() {
    return config;
  }

  /**
   * Returns the run's metrics port, creating it on first use.
   *
   * @return shared metrics port
   */
  public MetricsPort metrics() {
    if (metrics == null) {
      metrics = metricsFactory.get();
    }
    return metrics;
  }

  public OpenSshTransport transport() {
    return new OpenSshTransport(config.ssh());
  }

  /**
   * Builds the dispatcher over the given transport and report stream.
   *
   * @param transport remote shell transport
   * @param reportStream destination for report lines
   * @return dispatcher ready for {@link FanoutDispatcher#dispatch}
   */
  public FanoutDispatcher dispatcher(RemoteShellTransport transport, OutputStream reportStream) {
    ResultReporter reporter = config.format().open(reportStream, config.separator());
    RemoteExecutor executor = new RemoteExecutor(transport, metrics(), clock);
    return new FanoutDispatcher(executor, reporter, metrics(), clock);
  }

  /** Flushes and releases the metrics pipeline. */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
