package ca.gc.cra.fanout.infrastructure.ssh;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Client-side options applied to every ssh invocation of a run.
 *
 * @param sshBinary ssh executable name or path
 * @param user login passed with {@code -l}; empty to use the ssh default
 * @param port port passed with {@code -p}; empty to use the ssh default
 * @param identityFile key passed with {@code -i}; empty to use the agent and default keys
 * @param strictHostKeyChecking value for {@code StrictHostKeyChecking}
 * @param commandTimeout bound on a whole remote command; {@link Duration#ZERO} for none
 * @since 0.1.0
 */
public record SshSettings(
    String sshBinary,
    Optional<String> user,
    OptionalInt port,
    Optional<Path> identityFile,
    String strictHostKeyChecking,
    Duration commandTimeout) {

  public SshSettings {
    Objects.requireNonNull(sshBinary, "sshBinary");
    if (sshBinary.isBlank()) {
      throw new IllegalArgumentException("sshBinary must not be blank");
    }
    user = Objects.requireNonNullElse(user, Optional.<String>empty());
    port = Objects.requireNonNullElse(port, OptionalInt.empty());
    identityFile = Objects.requireNonNullElse(identityFile, Optional.<Path>empty());
    strictHostKeyChecking = normalizeHostKeyChecking(strictHostKeyChecking);
    commandTimeout = Objects.requireNonNullElse(commandTimeout, Duration.ZERO);
    if (commandTimeout.isNegative()) {
      throw new IllegalArgumentException("commandTimeout must not be negative");
    }
  }

  /**
   * Settings matching a plain {@code ssh} invocation with strict host key checking and no command timeout.
   *
   * @return default settings
   */
  public static SshSettings defaults() {
    return new SshSettings("ssh", Optional.empty(), OptionalInt.empty(), Optional.empty(), "yes", Duration.ZERO);
  }

  public boolean hasCommandTimeout() {
    return !commandTimeout.isZero();
  }

  /**
   * Normalizes a {@code StrictHostKeyChecking} value.
   *
   * @param raw {@code yes}, {@code no}, or {@code accept-new}; {@code null} means {@code yes}
   * @return lowercase value
   * @throws IllegalArgumentException for any other value
   */
  static String normalizeHostKeyChecking(String raw) {
    if (raw == null) {
      return "yes";
    }
    String value = raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "yes", "no", "accept-new" -> value;
      default -> throw new IllegalArgumentException(
          "strictHostKeyChecking must be yes, no, or accept-new (was '" + raw + "')");
    };
  }
}
