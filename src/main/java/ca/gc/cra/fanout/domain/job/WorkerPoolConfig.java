package ca.gc.cra.fanout.domain.job;

import java.time.Duration;

/**
 * Worker budget and per-host time bounds for one run.
 *
 * @param concurrency maximum number of simultaneous remote sessions; at least 1
 * @param connectTimeoutSeconds bound on establishing each connection; at least 1
 * @param commandTimeoutSeconds bound on the whole remote execution; {@code 0} leaves it unbounded
 * @since 0.1.0
 */
public record WorkerPoolConfig(int concurrency, int connectTimeoutSeconds, int commandTimeoutSeconds) {
  /** Worker count used when the operator does not pick one. */
  public static final int DEFAULT_CONCURRENCY = 4;
  /** Connect timeout used when the operator does not pick one. */
  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 30;

  public WorkerPoolConfig {
    if (concurrency < 1) {
      throw new InvalidConcurrencyException(concurrency);
    }
    if (connectTimeoutSeconds < 1) {
      throw new IllegalArgumentException(
          "connectTimeout must be a positive number of seconds (was " + connectTimeoutSeconds + ")");
    }
    if (commandTimeoutSeconds < 0) {
      throw new IllegalArgumentException(
          "commandTimeout must not be negative (was " + commandTimeoutSeconds + ")");
    }
  }

  /**
   * Builds a config without a command timeout.
   *
   * @param concurrency worker count
   * @param connectTimeoutSeconds connect timeout in seconds
   * @return validated config
   */
  public static WorkerPoolConfig of(int concurrency, int connectTimeoutSeconds) {
    return new WorkerPoolConfig(concurrency, connectTimeoutSeconds, 0);
  }

  public Duration connectTimeout() {
    return Duration.ofSeconds(connectTimeoutSeconds);
  }

  /**
   * Returns the command timeout, or {@link Duration#ZERO} when unbounded.
   *
   * @return command timeout
   */
  public Duration commandTimeout() {
    return Duration.ofSeconds(commandTimeoutSeconds);
  }
}
