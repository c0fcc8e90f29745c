package ca.gc.cra.fanout.application.dispatch;

import ca.gc.cra.fanout.application.port.CommandOutcome;
import ca.gc.cra.fanout.application.port.RemoteSession;
import ca.gc.cra.fanout.application.port.RemoteShellException;
import ca.gc.cra.fanout.application.port.RemoteShellTransport;
import ca.gc.cra.fanout.application.port.RemoteTarget;
import ca.gc.cra.fanout.domain.job.FailureKind;
import ca.gc.cra.fanout.domain.job.ScriptBody;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable in-memory transport. By default every host echoes the script body back; individual hosts can be
 * made to time out, fail, throw, or hang until interrupted.
 */
final class FakeTransport implements RemoteShellTransport {
  private final List<RemoteTarget> opened = new CopyOnWriteArrayList<>();
  private final Map<String, Behaviour> behaviours = new ConcurrentHashMap<>();
  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger maxActive = new AtomicInteger();
  private final AtomicInteger closed = new AtomicInteger();
  private volatile long delayMillis;
  private volatile CountDownLatch sessionsStarted = new CountDownLatch(0);

  FakeTransport withDelay(long millis) {
    this.delayMillis = millis;
    return this;
  }

  FakeTransport respond(String host, String output, int exitStatus) {
    behaviours.put(host, new Behaviour(Mode.RESPOND, output, exitStatus, null, null));
    return this;
  }

  FakeTransport failOnOpen(String host, FailureKind kind, String message) {
    behaviours.put(host, new Behaviour(Mode.FAIL_OPEN, "", 0, kind, message));
    return this;
  }

  FakeTransport failOnRun(String host, FailureKind kind, String message, String output) {
    behaviours.put(host, new Behaviour(Mode.FAIL_RUN, output, 0, kind, message));
    return this;
  }

  /** Connection attempt that waits out the caller's connect timeout, then reports a timeout. */
  FakeTransport timeOut(String host) {
    behaviours.put(host, new Behaviour(Mode.TIME_OUT, "", 0, FailureKind.CONNECTION_TIMEOUT, null));
    return this;
  }

  FakeTransport crashOnOpen(String host) {
    behaviours.put(host, new Behaviour(Mode.CRASH, "", 0, null, null));
    return this;
  }

  /** Opening a session to {@code host} throws an {@link Error}, as a broken ssh library would. */
  FakeTransport errorOnOpen(String host) {
    behaviours.put(host, new Behaviour(Mode.ERROR, "", 0, null, null));
    return this;
  }

  /** Every session blocks until interrupted; {@code started} counts down as sessions begin. */
  FakeTransport hangAll(CountDownLatch started) {
    this.sessionsStarted = started;
    behaviours.put("*", new Behaviour(Mode.HANG, "", 0, null, null));
    return this;
  }

  List<RemoteTarget> opened() {
    return opened;
  }

  int calls() {
    return opened.size();
  }

  int maxConcurrent() {
    return maxActive.get();
  }

  int closedSessions() {
    return closed.get();
  }

  @Override
  public RemoteSession open(RemoteTarget target, Duration connectTimeout)
      throws RemoteShellException, InterruptedException {
    opened.add(target);
    Behaviour behaviour = behaviours.getOrDefault(target.host(),
        behaviours.getOrDefault("*", Behaviour.ECHO));
    switch (behaviour.mode) {
      case FAIL_OPEN:
        throw new RemoteShellException(behaviour.kind, behaviour.message);
      case TIME_OUT:
        Thread.sleep(connectTimeout.toMillis());
        throw new RemoteShellException(FailureKind.CONNECTION_TIMEOUT,
            "connect to host " + target.host() + " port 22: Connection timed out");
      case CRASH:
        throw new IllegalStateException("transport exploded");
      case ERROR:
        throw new ExceptionInInitializerError("ssh support failed to initialise");
      default:
        return new FakeSession(behaviour);
    }
  }

  private enum Mode { ECHO, RESPOND, FAIL_OPEN, FAIL_RUN, TIME_OUT, CRASH, ERROR, HANG }

  private static final class Behaviour {
    static final Behaviour ECHO = new Behaviour(Mode.ECHO, "", 0, null, null);

    final Mode mode;
    final String output;
    final int exitStatus;
    final FailureKind kind;
    final String message;

    Behaviour(Mode mode, String output, int exitStatus, FailureKind kind, String message) {
      this.mode = mode;
      this.output = output;
      this.exitStatus = exitStatus;
      this.kind = kind;
      this.message = message;
    }
  }

  private final class FakeSession implements RemoteSession {
    private final Behaviour behaviour;

    private FakeSession(Behaviour behaviour) {
      this.behaviour = behaviour;
    }

    @Override
    public CommandOutcome runWithStdin(ScriptBody script)
        throws RemoteShellException, InterruptedException {
      int now = active.incrementAndGet();
      maxActive.accumulateAndGet(now, Math::max);
      try {
        if (behaviour.mode == Mode.HANG) {
          sessionsStarted.countDown();
          Thread.sleep(Long.MAX_VALUE);
        }
        if (delayMillis > 0) {
          Thread.sleep(delayMillis);
        }
        switch (behaviour.mode) {
          case FAIL_RUN:
            throw new RemoteShellException(behaviour.kind, behaviour.message, behaviour.output, null);
          case RESPOND:
            return new CommandOutcome(behaviour.output, behaviour.exitStatus);
          default:
            return new CommandOutcome(echo(script), 0);
        }
      } finally {
        active.decrementAndGet();
      }
    }

    @Override
    public void close() {
      closed.incrementAndGet();
    }

    private String echo(ScriptBody script) {
      try {
        return new String(script.openStream().readAllBytes(), StandardCharsets.UTF_8);
      } catch (IOException ex) {
        throw new UncheckedIOException(ex);
      }
    }
  }
}
