package ca.gc.cra.fanout.api;

import ca.gc.cra.fanout.config.ConfigMerger;
import ca.gc.cra.fanout.config.DefaultsForMode;
import ca.gc.cra.fanout.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Loads the optional YAML file named by {@code config=} and merges it with CLI arguments and defaults.
   *
   * @param mode subcommand
   * @param cliArgs parsed CLI arguments; the {@code config} key is consumed
   * @param log logger receiving override warnings
   * @return effective settings
   * @throws ca.gc.cra.fanout.config.InvalidConfigException if the file is malformed
   * @throws IllegalArgumentException if the file is missing or the merged settings are inconsistent
   * @throws IOException if the file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliArgs, Logger log)
      throws IOException {
    String configPath = extractConfigPath(cliArgs);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} settings from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cliArgs, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && !value.isBlank() && Boolean.parseBoolean(value.trim());
  }
}
