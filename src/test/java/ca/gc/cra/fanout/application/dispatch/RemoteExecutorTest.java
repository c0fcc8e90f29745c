package ca.gc.cra.fanout.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fanout.application.port.ClockPort;
import ca.gc.cra.fanout.application.port.RemoteTarget;
import ca.gc.cra.fanout.domain.job.ExecutionResult;
import ca.gc.cra.fanout.domain.job.FailureKind;
import ca.gc.cra.fanout.domain.job.Job;
import ca.gc.cra.fanout.domain.job.ScriptBody;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RemoteExecutorTest {
  private static final ScriptBody SCRIPT =
      ScriptBody.of("ping.sh", "pong\n".getBytes(StandardCharsets.UTF_8));
  private static final Duration CONNECT = Duration.ofSeconds(1);

  private FakeTransport transport;
  private RecordingMetricsPort metrics;
  private RemoteExecutor executor;

  @BeforeEach
  void setUp() {
    transport = new FakeTransport();
    metrics = new RecordingMetricsPort();
    AtomicLong ticks = new AtomicLong();
    ClockPort clock = () -> ticks.getAndAdd(10);
    executor = new RemoteExecutor(transport, metrics, clock);
  }

  @Test
  void successfulRunReportsFlattenedOutput() throws Exception {
    ExecutionResult result = executor.execute(job("web1"), CONNECT);

    assertTrue(result.succeeded());
    assertEquals("pong", result.output());
    assertEquals(10L, result.elapsedMillis());
    assertEquals(1, metrics.count("fanout.host.success"));
    assertEquals(List.of(10L), metrics.observed("fanout.host.latencyMillis"));
    assertEquals(1, transport.closedSessions());
  }

  @Test
  void nonZeroExitIsScriptExecutionError() throws Exception {
    transport.respond("web1", "disk full\n", 3);

    ExecutionResult result = executor.execute(job("web1"), CONNECT);

    assertFalse(result.succeeded());
    assertEquals(FailureKind.SCRIPT_EXECUTION_ERROR, result.failureKind());
    assertEquals("disk full", result.output());
    assertEquals("remote command exited with status 3", result.detail());
    assertEquals(1, metrics.count("fanout.host.failure.script"));
  }

  @Test
  void transportFailureKeepsItsKind() throws Exception {
    transport.failOnOpen("web1", FailureKind.AUTHENTICATION_FAILURE, "Permission denied (publickey)");

    ExecutionResult result = executor.execute(job("web1"), CONNECT);

    assertEquals(FailureKind.AUTHENTICATION_FAILURE, result.failureKind());
    assertEquals("Permission denied (publickey)", result.detail());
    assertEquals(1, metrics.count("fanout.host.failure.auth"));
    assertEquals(0, transport.closedSessions());
  }

  @Test
  void failureDuringRunCarriesPartialOutputAndClosesSession() throws Exception {
    transport.failOnRun("web1", FailureKind.SCRIPT_EXECUTION_ERROR, "timed out after 5s", "step 1\n");

    ExecutionResult result = executor.execute(job("web1"), CONNECT);

    assertEquals(FailureKind.SCRIPT_EXECUTION_ERROR, result.failureKind());
    assertEquals("step 1", result.output());
    assertEquals(1, transport.closedSessions());
  }

  @Test
  void unexpectedRuntimeFailureBeforeSessionIsUnreachable() throws Exception {
    transport.crashOnOpen("web1");

    ExecutionResult result = executor.execute(job("web1"), CONNECT);

    assertEquals(FailureKind.HOST_UNREACHABLE, result.failureKind());
    assertTrue(result.detail().contains("transport exploded"), result.detail());
  }

  @Test
  void jumpboxIsPassedToTransport() throws Exception {
    executor.execute(new Job("web1", SCRIPT, Optional.of("bastion.example.org")), CONNECT);

    assertEquals(List.of(new RemoteTarget("web1", Optional.of("bastion.example.org"))), transport.opened());
  }

  private static Job job(String host) {
    return new Job(host, SCRIPT, Optional.empty());
  }
}
