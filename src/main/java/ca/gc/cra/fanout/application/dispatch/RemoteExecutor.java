package ca.gc.cra.fanout.application.dispatch;

import ca.gc.cra.fanout.application.port.ClockPort;
import ca.gc.cra.fanout.application.port.CommandOutcome;
import ca.gc.cra.fanout.application.port.MetricsPort;
import ca.gc.cra.fanout.application.port.RemoteSession;
import ca.gc.cra.fanout.application.port.RemoteShellException;
import ca.gc.cra.fanout.application.port.RemoteShellTransport;
import ca.gc.cra.fanout.application.port.RemoteTarget;
import ca.gc.cra.fanout.domain.job.ExecutionResult;
import ca.gc.cra.fanout.domain.job.FailureKind;
import ca.gc.cra.fanout.domain.job.Job;
import ca.gc.cra.fanout.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one job on one host and turns every outcome into an {@link ExecutionResult}.
 * <p><strong>Why:</strong> The dispatcher's accounting depends on each host yielding exactly one result, so no
 * per-host failure may escape this boundary.</p>
 * <p><strong>Role:</strong> Application service invoked by worker threads.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open a session through {@link RemoteShellTransport} within the connect timeout.</li>
 *   <li>Stream the script as the remote shell's standard input and capture combined output.</li>
 *   <li>Classify failures into {@link FailureKind}s and record {@code fanout.host.*} metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; shared by all workers.</p>
 *
 * @since 0.1.0
 */
public final class RemoteExecutor {
  private static final Logger log = LoggerFactory.getLogger(RemoteExecutor.class);
  private static final int LOG_OUTPUT_BYTES = 256;

  private final RemoteShellTransport transport;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates an executor.
   *
   * @param transport remote shell transport; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock used for elapsed-time accounting; must not be {@code null}
   */
  public RemoteExecutor(RemoteShellTransport transport, MetricsPort metrics, ClockPort clock) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Executes {@code job} and returns its result.
   *
   * @param job job to run
   * @param connectTimeout bound on connection establishment
   * @return success or failure result; never {@code null}
   * @throws InterruptedException only when the whole run is being cancelled
   */
  public ExecutionResult execute(Job job, Duration connectTimeout) throws InterruptedException {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    RemoteTarget target = new RemoteTarget(job.host(), job.jumpbox());
    long start = clock.nowMillis();
    ExecutionResult result;
    RemoteSession session = null;
    try {
      session = transport.open(target, connectTimeout);
      CommandOutcome outcome = session.runWithStdin(job.script());
      long elapsed = clock.nowMillis() - start;
      if (outcome.succeeded()) {
        result = ExecutionResult.success(job.host(), outcome.output(), elapsed);
      } else {
        result = ExecutionResult.failure(
            job.host(),
            FailureKind.SCRIPT_EXECUTION_ERROR,
            outcome.output(),
            "remote command exited with status " + outcome.exitStatus(),
            elapsed);
      }
    } catch (RemoteShellException ex) {
      result = ExecutionResult.failure(
          job.host(), ex.kind(), ex.capturedOutput(), ex.getMessage(), clock.nowMillis() - start);
    } catch (RuntimeException ex) {
      FailureKind kind = session == null ? FailureKind.HOST_UNREACHABLE : FailureKind.SCRIPT_EXECUTION_ERROR;
      log.error("Unexpected transport failure for {}", target.describe(), ex);
      result = ExecutionResult.failure(
          job.host(), kind, "", "unexpected transport failure: " + ex, clock.nowMillis() - start);
    } finally {
      if (session != null) {
        session.close();
      }
    }
    record(result);
    return result;
  }

  private void record(ExecutionResult result) {
    metrics.observe("fanout.host.latencyMillis", result.elapsedMillis());
    if (result.succeeded()) {
      metrics.increment("fanout.host.success");
      if (log.isDebugEnabled()) {
        log.debug("Host {} succeeded in {} ms: {}",
            result.host(), result.elapsedMillis(), Logs.truncate(result.output(), LOG_OUTPUT_BYTES));
      }
      return;
    }
    FailureKind kind = result.failureKind();
    metrics.increment("fanout.host.failure." + kind.metricSuffix());
    log.warn("Host {} failed after {} ms: {}: {}",
        result.host(), result.elapsedMillis(), kind.label(), result.detail());
  }
}
