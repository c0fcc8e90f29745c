package ca.gc.cra.fanout.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fanout.application.port.CommandOutcome;
import ca.gc.cra.fanout.application.port.RemoteSession;
import ca.gc.cra.fanout.application.port.RemoteShellException;
import ca.gc.cra.fanout.application.port.RemoteShellTransport;
import ca.gc.cra.fanout.application.port.RemoteTarget;
import ca.gc.cra.fanout.domain.job.FailureKind;
import ca.gc.cra.fanout.domain.job.ScriptBody;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private ByteArrayOutputStream stdout;
  private AtomicInteger transportRequests;
  private RecordingTransport transport;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    stdout = new ByteArrayOutputStream();
    CliPrinter.setStreamForTesting(stdout);
    transportRequests = new AtomicInteger();
    transport = new RecordingTransport();
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestStream();
  }

  @Test
  void missingScriptAbortsBeforeAnyConnection() {
    ExitCode code = run("run",
        "hosts=web{1..3}",
        "script=" + tempDir.resolve("missing.sh"));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertEquals(0, transportRequests.get());
    assertEquals(0, transport.calls.size());
    String out = output();
    assertTrue(out.startsWith("usage: fanout run"), out);
    assertFalse(out.contains("web1"), out);
    assertTrue(loggedError("Cannot use script"));
  }

  @Test
  void successfulRunPrintsOneLinePerHost() throws IOException {
    Path script = script("echo pong\n");

    ExitCode code = run("run", "hosts=web{1..3}", "script=" + script, "processes=2");

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Arrays.asList(output().split("\n"));
    assertEquals(Set.of("web1, pong", "web2, pong", "web3, pong"), Set.copyOf(lines));
    assertEquals(3, lines.size());
  }

  @Test
  void anyFailedHostYieldsHostFailuresExit() throws IOException {
    Path script = script("echo pong\n");
    transport.unreachable.add("web2");

    ExitCode code = run("run", "hosts=web{1..3}", "script=" + script);

    assertEquals(ExitCode.HOST_FAILURES, code);
    String out = output();
    assertTrue(out.contains("web2, HostUnreachable: ssh: Could not resolve hostname web2"), out);
    assertTrue(out.contains("web1, pong"), out);
  }

  @Test
  void jumpboxIsAppliedToEveryHost() throws IOException {
    Path script = script("uptime\n");

    ExitCode code = run("run", "hosts={a,b}serv{1,2}", "script=" + script, "jumpbox=ops@bastion");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(4, transport.calls.size());
    assertEquals(Set.of("ops@bastion"),
        transport.calls.stream().map(t -> t.jumpbox().orElse("")).collect(Collectors.toSet()));
  }

  @Test
  void singleRunsExactlyOneHost() throws IOException {
    Path script = script("hostname\n");

    ExitCode code = run("single", "host=deploy@db1", "script=" + script);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("deploy@db1"),
        transport.calls.stream().map(RemoteTarget::host).collect(Collectors.toList()));
  }

  @Test
  void zeroProcessesIsRejectedBeforeDispatch() throws IOException {
    Path script = script("true\n");

    ExitCode code = run("run", "hosts=web1", "script=" + script, "processes=0");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertEquals(0, transportRequests.get());
    assertTrue(loggedError("processes must be a positive integer"));
  }

  @Test
  void malformedPatternIsInvalidArgs() throws IOException {
    Path script = script("true\n");

    ExitCode code = run("run", "hosts=web{1..3", "script=" + script);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("invalid host pattern"));
  }

  @Test
  void dryRunPrintsPlanWithoutConnecting() throws IOException {
    Path script = script("echo pong\n");

    ExitCode code = run("run",
        "hosts=web{1..7}", "script=" + script, "jumpbox=bastion", "processes=3", "--dry-run");

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(0, transportRequests.get());
    String out = output();
    assertTrue(out.contains("Fan-out dry run (run)"), out);
    assertTrue(out.contains("Hosts: 7 from 'web{1..7}' [web1, web2, web3, web4, web5, ...]"), out);
    assertTrue(out.contains("Jump host: bastion"), out);
    assertTrue(out.contains("Workers: 3"), out);
    assertTrue(out.contains("-J bastion web1 'bash -s'"), out);
  }

  @Test
  void yamlConfigSuppliesDefaultsBelowCli() throws IOException {
    Path script = script("echo pong\n");
    Path config = tempDir.resolve("fanout.yaml");
    Files.writeString(config, "run:\n  separator: ' | '\n  processes: 2\n");

    ExitCode code = run("run", "hosts=web1", "script=" + script, "config=" + config);

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("web1 | pong\n", output());
  }

  @Test
  void missingConfigFileIsInvalidArgs() throws IOException {
    Path script = script("true\n");

    ExitCode code = run("run", "hosts=web1", "script=" + script, "config=" + tempDir.resolve("none.yaml"));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void malformedConfigFileIsConfigError() throws IOException {
    Path script = script("true\n");
    Path config = Files.writeString(tempDir.resolve("broken.yaml"), "run: [unclosed\n");

    ExitCode code = run("run", "hosts=web1", "script=" + script, "config=" + config);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertEquals(4, code.code());
    assertEquals(0, transport.calls.size());
    assertTrue(loggedError("Invalid configuration file"));
  }

  @Test
  void errorFromTransportIsRuntimeFailureNotSuccess() throws IOException {
    Path script = script("echo pong\n");
    transport.broken.add("web2");

    ExitCode code = run("run", "hosts=web{1..3}", "script=" + script, "processes=1");

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    assertTrue(loggedError("Run aborted"));
  }

  @Test
  void helpPrintsUsageAndSucceeds() {
    ExitCode code = run("run", "--help");

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output().contains("fanout run: execute a local script on many hosts over ssh"));
  }

  private ExitCode run(String mode, String... args) {
    return RunCli.run(mode, args, root -> {
      transportRequests.incrementAndGet();
      return transport;
    });
  }

  private Path script(String body) throws IOException {
    return Files.writeString(tempDir.resolve("script.sh"), body);
  }

  private String output() {
    return stdout.toString(StandardCharsets.UTF_8);
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }

  /** Answers "pong" for every host unless listed as unreachable or broken. */
  private static final class RecordingTransport implements RemoteShellTransport {
    final List<RemoteTarget> calls = new CopyOnWriteArrayList<>();
    final Set<String> unreachable = new CopyOnWriteArraySet<>();
    final Set<String> broken = new CopyOnWriteArraySet<>();

    @Override
    public RemoteSession open(RemoteTarget target, Duration connectTimeout) throws RemoteShellException {
      calls.add(target);
      if (broken.contains(target.host())) {
        throw new LinkageError("ssh support failed to load for " + target.host());
      }
      if (unreachable.contains(target.host())) {
        throw new RemoteShellException(FailureKind.HOST_UNREACHABLE,
            "ssh: Could not resolve hostname " + target.host() + ": Name or service not known");
      }
      return new RemoteSession() {
        @Override
        public CommandOutcome runWithStdin(ScriptBody script) {
          return new CommandOutcome("pong\n", 0);
        }

        @Override
        public void close() {}
      };
    }
  }
}
