package ca.gc.cra.fanout.api;

import ca.gc.cra.fanout.application.dispatch.FanoutDispatcher;
import ca.gc.cra.fanout.application.port.RemoteShellTransport;
import ca.gc.cra.fanout.application.port.RemoteTarget;
import ca.gc.cra.fanout.config.CompositionRoot;
import ca.gc.cra.fanout.config.FanoutConfig;
import ca.gc.cra.fanout.config.InvalidConfigException;
import ca.gc.cra.fanout.domain.job.DispatchSummary;
import ca.gc.cra.fanout.domain.job.ScriptBody;
import ca.gc.cra.fanout.domain.job.ScriptUnreadableException;
import ca.gc.cra.fanout.infrastructure.ssh.OpenSshTransport;
import ca.gc.cra.fanout.logging.LoggingConfigurator;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code run} and {@code single} subcommands: runs one local script on many hosts.
 *
 * <p>Everything that can be checked locally (arguments, host pattern, worker budget, jump host, script file) is
 * checked before the first ssh client starts; a failed check writes no report line. A SIGINT cancels the run:
 * hosts not yet started are skipped and in-flight clients are killed.</p>
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);
  private static final int PLAN_PREVIEW_HOSTS = 5;
  private static final String RUN_USAGE =
      "usage: fanout run hosts=PATTERN script=PATH [processes=N] [jumpbox=HOST] [connectTimeout=SECONDS] "
          + "[commandTimeout=SECONDS] [format=text|ndjson] [separator=TEXT] [sshUser=USER] [sshPort=PORT] "
          + "[identityFile=PATH] [strictHostKeyChecking=yes|no|accept-new] [maxHosts=N] [config=PATH] "
          + "[metricsExporter=otlp|none] [--dry-run] [--verbose|--quiet]";
  private static final String SINGLE_USAGE =
      "usage: fanout single host=HOST script=PATH [jumpbox=HOST] [connectTimeout=SECONDS] "
          + "[commandTimeout=SECONDS] [format=text|ndjson] [config=PATH] [--dry-run] [--verbose|--quiet]";
  private static final String HELP_TEXT = """
      fanout run: execute a local script on many hosts over ssh

      Usage:
        fanout run hosts='web{01..20}.example.com' script=./check.sh [options]
        fanout single host=web01.example.com script=./check.sh [options]

      Required:
        hosts=PATTERN              Brace pattern: {a,b,c} alternatives, {1..10} or {01..10..2} ranges (run)
        host=HOST                  One literal destination, not expanded (single)
        script=PATH                Local script streamed to 'bash -s' on every host

      Optional:
        processes=N                Concurrent ssh sessions (default 4; run only)
        jumpbox=[USER@]HOST[:PORT] Route every connection through this jump host (ssh -J)
        connectTimeout=SECONDS     ssh ConnectTimeout (default 30)
        commandTimeout=SECONDS     Kill a host's session after this long; 0 disables (default 0)
        format=text|ndjson         Report format (default text)
        separator=TEXT             Text separator between host and output (default ", ")
        sshBinary=PATH             ssh client to run (default ssh)
        sshUser=USER               Remote login (ssh -l)
        sshPort=PORT               Remote port (ssh -p)
        identityFile=PATH          Private key (ssh -i)
        strictHostKeyChecking=yes|no|accept-new  (default yes)
        maxHosts=N                 Refuse patterns expanding to more hosts (default 100000)
        config=PATH                YAML file with common/run/single sections
        metricsExporter=otlp|none  Metrics export (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate and print the plan without connecting
        --verbose | --quiet        DEBUG logging | warnings only
        --help                     Show this message

      Report: one line per host on stdout, in completion order; logs go to stderr.
      Exit: 0 all hosts succeeded, 1 some hosts failed, 2 invalid arguments, 3 unreadable script,
            5 internal failure, 130 cancelled.
      """;

  private RunCli() {}

  /**
   * Executes the subcommand against real ssh.
   *
   * @param mode {@code run} or {@code single}
   * @param args arguments after the subcommand
   * @return exit code capturing the outcome
   */
  static ExitCode run(String mode, String[] args) {
    return run(mode, args, CompositionRoot::transport);
  }

  static ExitCode run(String mode, String[] args, Function<CompositionRoot, RemoteShellTransport> transports) {
    String usage = "single".equals(mode) ? SINGLE_USAGE : RUN_USAGE;
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} CLI", mode);
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }

    FanoutConfig config;
    boolean dryRun;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = new LinkedHashMap<>(ConfigCliUtils.effectiveConfig(mode, kv, log));
      dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
      TelemetryConfigurator.configureMetrics(effective);
      config = FanoutConfig.fromMap(mode, effective);
    } catch (InvalidConfigException ex) {
      log.error("Invalid configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    ScriptBody script;
    try {
      script = ScriptBody.read(config.script());
    } catch (ScriptUnreadableException ex) {
      log.error("Cannot use script: {}", ex.getMessage());
      if (ex.reason() == ScriptUnreadableException.Reason.UNREADABLE) {
        return ExitCode.IO_ERROR;
      }
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      if (dryRun) {
        printDryRunPlan(config, script, root.transport());
        return ExitCode.SUCCESS;
      }
      return dispatch(root, transports.apply(root), script);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {} CLI", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode dispatch(CompositionRoot root, RemoteShellTransport transport, ScriptBody script) {
    FanoutConfig config = root.config();
    FanoutDispatcher dispatcher = root.dispatcher(transport, CliPrinter.stdout());
    Thread hook = new Thread(() -> {
      log.warn("Shutdown requested; cancelling remaining hosts");
      dispatcher.cancel();
      try {
        if (!dispatcher.awaitCompletion(SHUTDOWN_GRACE)) {
          log.warn("Dispatcher did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "fanout-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    DispatchSummary summary;
    try {
      summary = dispatcher.dispatch(config.hosts(), script, config.jumpbox(), config.pool());
    } catch (IllegalStateException ex) {
      log.error("Run aborted: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeHook(hook);
    }

    if (summary.cancelled() || Thread.currentThread().isInterrupted()) {
      log.warn("Run cancelled; {} of {} hosts reported", summary.succeeded() + summary.failed(),
          summary.dispatched());
      return ExitCode.INTERRUPTED;
    }
    if (summary.notAttempted() > 0) {
      log.error("Run incomplete: {} of {} hosts never reported", summary.notAttempted(), summary.dispatched());
      return ExitCode.RUNTIME_FAILURE;
    }
    if (summary.failed() > 0) {
      log.warn("{} of {} hosts failed: {}", summary.failed(), summary.dispatched(), summary.failuresByKind());
      return ExitCode.HOST_FAILURES;
    }
    return ExitCode.SUCCESS;
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }

  private static void printDryRunPlan(FanoutConfig config, ScriptBody script, OpenSshTransport transport) {
    List<String> hosts = config.hosts();
    String preview = hosts.stream().limit(PLAN_PREVIEW_HOSTS).collect(Collectors.joining(", "));
    if (hosts.size() > PLAN_PREVIEW_HOSTS) {
      preview += ", ...";
    }
    String command = hosts.isEmpty() ? "(no hosts)" : transport
        .commandFor(new RemoteTarget(hosts.get(0), config.jumpbox()), config.pool().connectTimeout())
        .stream()
        .map(arg -> arg.contains(" ") ? "'" + arg + "'" : arg)
        .collect(Collectors.joining(" "));
    CliPrinter.printLines(
        "Fan-out dry run (" + config.mode() + ")",
        "  Hosts: " + hosts.size() + " from '" + config.hostSource() + "' [" + preview + "]",
        "  Script: " + script,
        "  Jump host: " + config.jumpbox().orElse("none"),
        "  Workers: " + Math.min(config.concurrency(), Math.max(1, hosts.size())),
        "  Connect timeout: " + config.pool().connectTimeoutSeconds() + "s",
        "  Command timeout: "
            + (config.pool().commandTimeoutSeconds() == 0 ? "none" : config.pool().commandTimeoutSeconds() + "s"),
        "  Report: " + config.format().name().toLowerCase(Locale.ROOT),
        "  Command: " + command);
  }
}
