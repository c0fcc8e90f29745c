package ca.gc.cra.fanout.api;

/**
 * <strong>What:</strong> Canonical exit codes returned by the fan-out CLI.
 * <p><strong>Why:</strong> Lets automation tell "some hosts failed" apart from "the run never started".</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every host succeeded, or the command had nothing to run. */
  SUCCESS(0),
  /** The run completed but at least one host reported a failure. */
  HOST_FAILURES(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading local inputs. */
  IO_ERROR(3),
  /** A configuration file exists but is not valid YAML or has the wrong shape. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Run was cancelled (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
