package ca.gc.cra.fanout.config;

import ca.gc.cra.fanout.domain.host.HostPattern;
import ca.gc.cra.fanout.domain.job.WorkerPoolConfig;
import ca.gc.cra.fanout.infrastructure.report.LineReportWriter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each subcommand.
 *
 * <p>The defaults are the single source of truth for optional keys; {@link FanoutConfig#fromMap} only falls back to
 * its own constants when a caller bypasses the merger.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode {@code run}, {@code single}, or {@code expand}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "single" -> buildSingleDefaults();
      case "expand" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("maxHosts", Integer.toString(HostPattern.DEFAULT_MAX_HOSTS));
    map.put("metricsExporter", "none");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("processes", Integer.toString(WorkerPoolConfig.DEFAULT_CONCURRENCY));
    map.put("connectTimeout", Integer.toString(WorkerPoolConfig.DEFAULT_CONNECT_TIMEOUT_SECONDS));
    map.put("commandTimeout", "0");
    map.put("format", "text");
    map.put("separator", LineReportWriter.DEFAULT_SEPARATOR);
    map.put("sshBinary", "ssh");
    map.put("strictHostKeyChecking", "yes");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildSingleDefaults() {
    Map<String, String> map = buildRunDefaults();
    map.remove("processes");
    return map;
  }
}
