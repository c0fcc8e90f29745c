package ca.gc.cra.fanout.config;

import ca.gc.cra.fanout.domain.host.HostPattern;
import ca.gc.cra.fanout.domain.job.InvalidConcurrencyException;
import ca.gc.cra.fanout.domain.job.WorkerPoolConfig;
import ca.gc.cra.fanout.infrastructure.report.LineReportWriter;
import ca.gc.cra.fanout.infrastructure.report.ReportFormat;
import ca.gc.cra.fanout.infrastructure.ssh.SshSettings;
import ca.gc.cra.fanout.validation.Net;
import ca.gc.cra.fanout.validation.Numbers;
import ca.gc.cra.fanout.validation.Paths;
import ca.gc.cra.fanout.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Validated settings for one {@code run} or {@code single} invocation.
 * <p><strong>Why:</strong> Every argument is checked here, before the script is read or any ssh client is spawned,
 * so a bad invocation has no side effects.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expand the host pattern (or accept the single literal host) and vet every destination.</li>
 *   <li>Validate the worker budget, timeouts, and jump host.</li>
 *   <li>Collect ssh client options and the report format.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param mode subcommand that produced the settings
 * @param hostSource host pattern or literal host as given
 * @param hosts expanded destinations in pattern order
 * @param script local script path; existence is checked when the script is read
 * @param jumpbox optional {@code ssh -J} hop list
 * @param pool worker budget and time bounds
 * @param format report encoding
 * @param separator text-format separator
 * @param ssh ssh client options
 * @since 0.1.0
 */
public record FanoutConfig(
    String mode,
    String hostSource,
    List<String> hosts,
    Path script,
    Optional<String> jumpbox,
    WorkerPoolConfig pool,
    ReportFormat format,
    String separator,
    SshSettings ssh) {

  private static final int MAX_CONNECT_TIMEOUT_SECONDS = 3_600;
  private static final int MAX_COMMAND_TIMEOUT_SECONDS = 7 * 24 * 3_600;
  private static final int MAX_HOSTS_CEILING = 10_000_000;

  public FanoutConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(hostSource, "hostSource");
    hosts = List.copyOf(hosts);
    Objects.requireNonNull(script, "script");
    jumpbox = Objects.requireNonNullElse(jumpbox, Optional.<String>empty());
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(format, "format");
    separator = Objects.requireNonNullElse(separator, LineReportWriter.DEFAULT_SEPARATOR);
    Objects.requireNonNull(ssh, "ssh");
  }

  /**
   * Builds the configuration from merged key/value settings.
   *
   * @param mode {@code run} or {@code single}
   * @param options effective settings from {@link ConfigMerger}
   * @return validated configuration
   * @throws InvalidConcurrencyException if {@code processes} is not a positive integer
   * @throws ca.gc.cra.fanout.domain.host.InvalidHostPatternException if the host pattern is malformed
   * @throws IllegalArgumentException when any other value is missing or invalid
   */
  public static FanoutConfig fromMap(String mode, Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String normalizedMode = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!normalizedMode.equals("run") && !normalizedMode.equals("single")) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    boolean single = normalizedMode.equals("single");

    int concurrency = single ? 1 : InvalidConcurrencyException.parse(
        options.getOrDefault("processes", Integer.toString(WorkerPoolConfig.DEFAULT_CONCURRENCY)));
    int connectTimeout = Numbers.parseInt("connectTimeout",
        options.getOrDefault("connectTimeout", Integer.toString(WorkerPoolConfig.DEFAULT_CONNECT_TIMEOUT_SECONDS)),
        1, MAX_CONNECT_TIMEOUT_SECONDS);
    int commandTimeout = Numbers.parseInt("commandTimeout",
        options.getOrDefault("commandTimeout", "0"), 0, MAX_COMMAND_TIMEOUT_SECONDS);
    WorkerPoolConfig pool = new WorkerPoolConfig(concurrency, connectTimeout, commandTimeout);

    String hostSource = single
        ? Strings.requireNonBlank("host", required(options, "host"))
        : Strings.requireNonBlank("hosts", required(options, "hosts"));
    List<String> hosts = resolveHosts(normalizedMode, options);

    Path script = parsePath("script", required(options, "script"));
    Optional<String> jumpbox = optional(options, "jumpbox").map(Net::requireJumpHost);
    ReportFormat format = ReportFormat.parse(options.getOrDefault("format", "text"));
    String separator = options.getOrDefault("separator", LineReportWriter.DEFAULT_SEPARATOR);
    if (separator.isEmpty() || separator.indexOf('\n') >= 0 || separator.indexOf('\r') >= 0) {
      throw new IllegalArgumentException("separator must be non-empty and must not contain line breaks");
    }

    SshSettings ssh = new SshSettings(
        Strings.requireNonBlank("sshBinary", options.getOrDefault("sshBinary", "ssh")),
        optional(options, "sshUser").map(user -> Strings.requireLoginName("sshUser", user)),
        optional(options, "sshPort")
            .map(port -> OptionalInt.of(Numbers.parseInt("sshPort", port, 1, 65_535)))
            .orElse(OptionalInt.empty()),
        optional(options, "identityFile").map(file -> Paths.requireReadableFile("identityFile", file)),
        options.getOrDefault("strictHostKeyChecking", "yes"),
        Duration.ofSeconds(commandTimeout));

    return new FanoutConfig(normalizedMode, hostSource, hosts, script, jumpbox, pool, format, separator, ssh);
  }

  /**
   * Resolves the destination list for a subcommand: the brace-expanded {@code hosts} pattern, or the literal
   * {@code host} for {@code single}.
   *
   * @param mode {@code run}, {@code single}, or {@code expand}
   * @param options effective settings
   * @return destinations in order; duplicates are kept
   * @throws IllegalArgumentException if the pattern, the cap, or any destination is invalid
   */
  public static List<String> resolveHosts(String mode, Map<String, String> options) {
    if ("single".equalsIgnoreCase(mode)) {
      return List.of(Net.requireDestination("host", required(options, "host")));
    }
    int maxHosts = Numbers.parseInt("maxHosts",
        options.getOrDefault("maxHosts", Integer.toString(HostPattern.DEFAULT_MAX_HOSTS)), 1, MAX_HOSTS_CEILING);
    List<String> hosts = HostPattern.parse(required(options, "hosts")).expand(maxHosts);
    for (String host : hosts) {
      Net.requireDestination("host", host);
    }
    return hosts;
  }

  public int concurrency() {
    return pool.concurrency();
  }

  private static String required(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static Path parsePath(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(sanitized);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + sanitized, ex);
    }
  }
}
