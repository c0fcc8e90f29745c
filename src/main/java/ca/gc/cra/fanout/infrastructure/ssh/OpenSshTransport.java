package ca.gc.cra.fanout.infrastructure.ssh;

import ca.gc.cra.fanout.application.port.RemoteSession;
import ca.gc.cra.fanout.application.port.RemoteShellTransport;
import ca.gc.cra.fanout.application.port.RemoteTarget;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RemoteShellTransport} that drives the local OpenSSH client, one process per host.
 * <p><strong>Why:</strong> Reuses the operator's ssh configuration, agent, keys, and {@code known_hosts} exactly as
 * an interactive {@code ssh} would, including {@code -J} jump hosts.</p>
 * <p><strong>Thread-safety:</strong> Stateless; sessions are independent processes.</p>
 *
 * @since 0.1.0
 */
public final class OpenSshTransport implements RemoteShellTransport {
  private static final Logger log = LoggerFactory.getLogger(OpenSshTransport.class);

  private final SshSettings settings;
  private final SshCommandBuilder commandBuilder;
  private final ProcessLauncher launcher;

  public OpenSshTransport(SshSettings settings) {
    this(settings, ProcessLauncher.SYSTEM);
  }

  OpenSshTransport(SshSettings settings, ProcessLauncher launcher) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.commandBuilder = new SshCommandBuilder(settings);
    this.launcher = Objects.requireNonNull(launcher, "launcher");
  }

  /**
   * Prepares a session. The ssh client performs connect and command in one process, so the process is started
   * by {@link RemoteSession#runWithStdin} and connection failures surface there.
   */
  @Override
  public RemoteSession open(RemoteTarget target, Duration connectTimeout) {
    List<String> command = commandBuilder.build(target, connectTimeout);
    log.debug("Prepared ssh session to {}: {}", target.describe(), command);
    return new OpenSshSession(target, command, launcher, settings.commandTimeout());
  }

  /**
   * Command line used for {@code target}; shown in dry-run plans.
   *
   * @param target destination
   * @param connectTimeout connection bound
   * @return argument vector
   */
  public List<String> commandFor(RemoteTarget target, Duration connectTimeout) {
    return commandBuilder.build(target, connectTimeout);
  }
}
