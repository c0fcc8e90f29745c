package ca.gc.cra.fanout.api;

import ca.gc.cra.fanout.config.FanoutConfig;
import ca.gc.cra.fanout.config.InvalidConfigException;
import ca.gc.cra.fanout.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code expand}: prints the hosts a pattern expands to, one per line, without connecting.
 */
public final class ExpandCli {
  private static final Logger log = LoggerFactory.getLogger(ExpandCli.class);
  private static final String SUMMARY_USAGE = "usage: fanout expand hosts=PATTERN [maxHosts=N] [--count]";
  private static final String HELP_TEXT = """
      fanout expand: preview a host pattern

      Usage:
        fanout expand hosts='db{1..3}.{east,west}' [maxHosts=N] [--count]

      Options:
        hosts=PATTERN   Brace pattern to expand
        maxHosts=N      Refuse patterns expanding to more hosts (default 100000)
        --count         Print only the number of hosts
        --help          Show this message
      """;

  private ExpandCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    List<String> hosts;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("expand", kv, log);
      hosts = FanoutConfig.resolveHosts("expand", effective);
    } catch (InvalidConfigException ex) {
      log.error("Invalid configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid expand arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (input.hasFlag("--count")) {
      CliPrinter.println(Integer.toString(hosts.size()));
    } else {
      CliPrinter.printLines(hosts.toArray(String[]::new));
    }
    return ExitCode.SUCCESS;
  }
}
