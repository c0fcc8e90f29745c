package ca.gc.cra.fanout.infrastructure.ssh;

import ca.gc.cra.fanout.application.port.CommandOutcome;
import ca.gc.cra.fanout.application.port.RemoteSession;
import ca.gc.cra.fanout.application.port.RemoteShellException;
import ca.gc.cra.fanout.application.port.RemoteTarget;
import ca.gc.cra.fanout.domain.job.FailureKind;
import ca.gc.cra.fanout.domain.job.ScriptBody;
import ca.gc.cra.fanout.infrastructure.exec.ExecutorFactories;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One ssh client process: script on stdin, combined stdout and stderr captured in memory.
 *
 * <p>The client's own diagnostics go to a per-session log file ({@code ssh -E}); only that file is classified when
 * the client exits 255, never the remote script's output. The file is deleted when the run returns.</p>
 *
 * <p>Stdin and stdout are pumped on their own daemon threads so neither side can block the worker; the worker
 * only waits for process exit, bounded by the command timeout when one is set. Interrupting the worker kills the
 * client and every process it started.</p>
 */
final class OpenSshSession implements RemoteSession {
  private static final Logger log = LoggerFactory.getLogger(OpenSshSession.class);
  static final int MAX_CAPTURE_BYTES = 1 << 20;
  private static final long PUMP_JOIN_MILLIS = 2_000L;

  private final RemoteTarget target;
  private final List<String> command;
  private final ProcessLauncher launcher;
  private final Duration commandTimeout;
  private Process process;
  private Thread stdinPump;
  private Thread outputPump;

  OpenSshSession(RemoteTarget target, List<String> command, ProcessLauncher launcher, Duration commandTimeout) {
    this.target = target;
    this.command = command;
    this.launcher = launcher;
    this.commandTimeout = commandTimeout;
  }

  @Override
  public CommandOutcome runWithStdin(ScriptBody script) throws RemoteShellException, InterruptedException {
    if (process != null) {
      throw new IllegalStateException("session already used");
    }
    Path clientLog;
    try {
      clientLog = Files.createTempFile("fanout-ssh-", ".log");
    } catch (IOException ex) {
      throw new RemoteShellException(FailureKind.HOST_UNREACHABLE,
          "failed to create ssh client log: " + ex.getMessage(), "", ex);
    }
    try {
      return runLogged(script, clientLog);
    } finally {
      delete(clientLog);
    }
  }

  @Override
  public void close() {
    if (process != null && process.isAlive()) {
      log.debug("Killing ssh client for {}", target.describe());
      kill();
    }
  }

  private CommandOutcome runLogged(ScriptBody script, Path clientLog)
      throws RemoteShellException, InterruptedException {
    try {
      process = launcher.start(SshCommandBuilder.withClientLog(command, clientLog));
    } catch (IOException ex) {
      throw new RemoteShellException(FailureKind.HOST_UNREACHABLE,
          "failed to start ssh client '" + command.get(0) + "': " + ex.getMessage(), "", ex);
    }
    BoundedCapture capture = new BoundedCapture(MAX_CAPTURE_BYTES);
    String tag = target.host();
    Process started = process;
    stdinPump = ExecutorFactories.startStreamPump("ssh-stdin-" + tag, () -> feed(script, started.getOutputStream()));
    outputPump = ExecutorFactories.startStreamPump("ssh-output-" + tag, () -> drain(started.getInputStream(), capture));

    boolean exited;
    try {
      if (commandTimeout.isZero()) {
        process.waitFor();
        exited = true;
      } else {
        exited = process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ex) {
      kill();
      throw ex;
    }
    if (!exited) {
      kill();
      joinPumps();
      throw new RemoteShellException(FailureKind.SCRIPT_EXECUTION_ERROR,
          "timed out after " + commandTimeout.toSeconds() + "s", capture.text(), null);
    }
    joinPumps();
    int status = process.exitValue();
    String output = capture.text();
    String diagnostics = readClientLog(clientLog);
    if (status != SshFailureClassifier.SSH_ERROR_STATUS) {
      if (!diagnostics.isEmpty()) {
        log.debug("ssh client for {} logged: {}", target.describe(), diagnostics);
      }
      return new CommandOutcome(output, status);
    }
    SshFailureClassifier.Classification classification = SshFailureClassifier.classify(diagnostics);
    if (classification != null) {
      throw new RemoteShellException(classification.kind(), classification.diagnostic(),
          joinLines(output, classification.remainingOutput()), null);
    }
    return new CommandOutcome(joinLines(output, diagnostics), status);
  }

  // Descendants first: with -J the client forks a second ssh for the hop that shares the output pipe.
  private void kill() {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private String readClientLog(Path clientLog) {
    try {
      return new String(Files.readAllBytes(clientLog), StandardCharsets.UTF_8).strip();
    } catch (IOException ex) {
      log.warn("Cannot read ssh client log for {}: {}", target.describe(), ex.getMessage());
      return "";
    }
  }

  private void delete(Path clientLog) {
    try {
      Files.deleteIfExists(clientLog);
    } catch (IOException ex) {
      log.warn("Cannot delete ssh client log {}: {}", clientLog, ex.getMessage());
    }
  }

  private static String joinLines(String first, String second) {
    if (second == null || second.isBlank()) {
      return first;
    }
    if (first.isEmpty()) {
      return second;
    }
    return first.endsWith("\n") ? first + second : first + "\n" + second;
  }

  private void joinPumps() throws InterruptedException {
    stdinPump.join(PUMP_JOIN_MILLIS);
    outputPump.join(PUMP_JOIN_MILLIS);
  }

  private void feed(ScriptBody script, OutputStream stdin) {
    try (OutputStream out = stdin) {
      script.writeTo(out);
    } catch (IOException ex) {
      // The client closes stdin when it exits early, e.g. on a refused connection.
      log.debug("ssh client for {} stopped reading the script: {}", target.describe(), ex.getMessage());
    }
  }

  private void drain(InputStream stdout, BoundedCapture capture) {
    byte[] buffer = new byte[8192];
    try (InputStream in = stdout) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        capture.write(buffer, read);
      }
    } catch (IOException ex) {
      log.debug("Output stream of ssh client for {} closed: {}", target.describe(), ex.getMessage());
    }
  }

  private static final class BoundedCapture {
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final int limit;
    private long dropped;

    BoundedCapture(int limit) {
      this.limit = limit;
    }

    synchronized void write(byte[] data, int length) {
      int room = limit - bytes.size();
      int kept = Math.max(0, Math.min(room, length));
      bytes.write(data, 0, kept);
      dropped += length - kept;
    }

    synchronized String text() {
      String captured = bytes.toString(StandardCharsets.UTF_8);
      return dropped == 0 ? captured : captured + " ... (" + dropped + " bytes of output dropped)";
    }
  }
}
