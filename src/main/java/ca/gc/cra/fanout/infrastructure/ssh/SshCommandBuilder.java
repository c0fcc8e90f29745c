package ca.gc.cra.fanout.infrastructure.ssh;

import ca.gc.cra.fanout.application.port.RemoteTarget;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the OpenSSH argument vector for one host.
 *
 * <p>The remote side runs {@code bash -s}, which reads the script from standard input, so nothing but the script
 * bytes travels over the channel and no remote file is created.</p>
 *
 * @since 0.1.0
 */
public final class SshCommandBuilder {
  static final String REMOTE_COMMAND = "bash -s";

  private final SshSettings settings;

  public SshCommandBuilder(SshSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Returns the full command line, executable first.
   *
   * @param target destination and optional jump host
   * @param connectTimeout connection bound; rounded up to whole seconds, at least one
   * @return immutable argument list
   */
  public List<String> build(RemoteTarget target, Duration connectTimeout) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    List<String> command = new ArrayList<>(24);
    command.add(settings.sshBinary());
    command.add("-T");
    option(command, "BatchMode", "yes");
    option(command, "ConnectTimeout", Long.toString(toWholeSeconds(connectTimeout)));
    option(command, "StrictHostKeyChecking", settings.strictHostKeyChecking());
    option(command, "PasswordAuthentication", "no");
    target.jumpbox().ifPresent(hop -> {
      command.add("-J");
      command.add(hop);
    });
    settings.user().ifPresent(user -> {
      command.add("-l");
      command.add(user);
    });
    settings.port().ifPresent(port -> {
      command.add("-p");
      command.add(Integer.toString(port));
    });
    settings.identityFile().ifPresent(key -> {
      command.add("-i");
      command.add(key.toString());
    });
    command.add(target.host());
    command.add(REMOTE_COMMAND);
    return List.copyOf(command);
  }

  /**
   * Adds {@code -E clientLog} so the client writes its own diagnostics to a file instead of standard error, which
   * then carries only what the remote side prints.
   *
   * @param command argument vector from {@link #build}
   * @param clientLog file receiving the client's log lines
   * @return new argument list
   */
  static List<String> withClientLog(List<String> command, Path clientLog) {
    List<String> logged = new ArrayList<>(command.size() + 2);
    logged.add(command.get(0));
    logged.add("-E");
    logged.add(clientLog.toString());
    logged.addAll(command.subList(1, command.size()));
    return List.copyOf(logged);
  }

  private static void option(List<String> command, String name, String value) {
    command.add("-o");
    command.add(name + "=" + value);
  }

  private static long toWholeSeconds(Duration timeout) {
    long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
    return Math.max(1, seconds);
  }
}
