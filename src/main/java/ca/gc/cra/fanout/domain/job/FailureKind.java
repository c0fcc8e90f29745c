package ca.gc.cra.fanout.domain.job;

/**
 * Per-host failure classes. Each is recovered at the job level and reported as one line; none aborts sibling jobs.
 *
 * @since 0.1.0
 */
public enum FailureKind {
  /** No connection was established within the connect timeout. */
  CONNECTION_TIMEOUT("ConnectionTimeout", "timeout"),
  /** The remote host rejected the offered credentials or host key. */
  AUTHENTICATION_FAILURE("AuthenticationFailure", "auth"),
  /** Network-level failure before the transport handshake (DNS, refused, no route). */
  HOST_UNREACHABLE("HostUnreachable", "unreachable"),
  /** The session was established but the remote command exited non-zero or crashed. */
  SCRIPT_EXECUTION_ERROR("ScriptExecutionError", "script");

  private final String label;
  private final String metricSuffix;

  FailureKind(String label, String metricSuffix) {
    this.label = label;
    this.metricSuffix = metricSuffix;
  }

  /**
   * Returns the operator-facing label written to report lines (e.g., {@code ConnectionTimeout}).
   *
   * @return report label
   */
  public String label() {
    return label;
  }

  /**
   * Returns the suffix used in {@code fanout.host.failure.*} metric names.
   *
   * @return metric suffix
   */
  public String metricSuffix() {
    return metricSuffix;
  }
}
