package ca.gc.cra.fanout.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-key rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active subcommand
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    if ("single".equals(normalizedMode) && merged.remove("processes") != null && warn != null) {
      warn.accept("single always uses one worker; ignoring processes");
    }
    validate(normalizedMode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    boolean hasHosts = !trim(effective.get("hosts")).isEmpty();
    boolean hasHost = !trim(effective.get("host")).isEmpty();
    switch (mode) {
      case "single" -> {
        if (hasHosts) {
          throw new IllegalArgumentException("single takes host=HOST, not hosts=PATTERN");
        }
      }
      case "run", "expand" -> {
        if (hasHost) {
          throw new IllegalArgumentException(mode + " takes hosts=PATTERN, not host=HOST");
        }
      }
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    if ("ndjson".equalsIgnoreCase(trim(effective.get("format")))
        && effective.containsKey("separator")
        && !effective.get("separator").equals(DefaultsForMode.asFlatMap("run").get("separator"))) {
      throw new IllegalArgumentException("separator applies to format=text only");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
