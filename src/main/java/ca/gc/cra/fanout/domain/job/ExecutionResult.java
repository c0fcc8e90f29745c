package ca.gc.cra.fanout.domain.job;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Outcome of running the script on one host.
 * <p><strong>Why:</strong> Gives the reporter a single, immutable value per dispatched host, success or failure, so
 * the run can account for every host it attempted.</p>
 * <p><strong>Role:</strong> Domain value produced by the remote executor and consumed by the result reporter.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to hand between worker threads.</p>
 * <p><strong>Invariant:</strong> {@link #output()} and {@link #detail()} never contain a line break; the canonical
 * constructor flattens them.</p>
 *
 * @param host host name the job targeted; never blank
 * @param status terminal status
 * @param failureKind failure class when {@code status} is {@link ExecutionStatus#FAILURE}; {@code null} on success
 * @param output captured combined stdout/stderr, flattened to one line; never {@code null}
 * @param detail flattened diagnostic for failures; empty on success
 * @param elapsedMillis wall-clock time spent on the host, in milliseconds
 * @since 0.1.0
 */
public record ExecutionResult(
    String host,
    ExecutionStatus status,
    FailureKind failureKind,
    String output,
    String detail,
    long elapsedMillis) {

  public ExecutionResult {
    Objects.requireNonNull(host, "host");
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    Objects.requireNonNull(status, "status");
    if (status == ExecutionStatus.FAILURE) {
      Objects.requireNonNull(failureKind, "failureKind");
    } else if (failureKind != null) {
      throw new IllegalArgumentException("successful results carry no failure kind");
    }
    output = flatten(output);
    detail = flatten(detail);
    if (elapsedMillis < 0) {
      elapsedMillis = 0;
    }
  }

  /**
   * Creates a successful result.
   *
   * @param host target host
   * @param rawOutput captured output, possibly multi-line
   * @param elapsedMillis elapsed time in milliseconds
   * @return success result
   */
  public static ExecutionResult success(String host, String rawOutput, long elapsedMillis) {
    return new ExecutionResult(host, ExecutionStatus.SUCCESS, null, rawOutput, "", elapsedMillis);
  }

  /**
   * Creates a failed result.
   *
   * @param host target host
   * @param kind failure class
   * @param rawOutput whatever output was captured before the failure; may be {@code null}
   * @param detail diagnostic text; may be {@code null}
   * @param elapsedMillis elapsed time in milliseconds
   * @return failure result
   */
  public static ExecutionResult failure(
      String host, FailureKind kind, String rawOutput, String detail, long elapsedMillis) {
    return new ExecutionResult(host, ExecutionStatus.FAILURE, kind, rawOutput, detail, elapsedMillis);
  }

  /**
   * Indicates whether the script completed with exit status zero.
   *
   * @return {@code true} on success
   */
  public boolean succeeded() {
    return status == ExecutionStatus.SUCCESS;
  }

  /**
   * Returns the failure class when present.
   *
   * @return failure kind, empty on success
   */
  public Optional<FailureKind> failure() {
    return Optional.ofNullable(failureKind);
  }

  /**
   * Collapses every line break ({@code \r\n}, {@code \n}, {@code \r}, NEL, LS, PS) into a single space. The
   * space produced by a final line break is dropped; any other whitespace, trailing or not, is kept.
   *
   * @param raw text to flatten; {@code null} yields an empty string
   * @return single-line text
   */
  public static String flatten(String raw) {
    if (raw == null || raw.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(raw.length());
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      switch (c) {
        case '\r' -> {
          if (i + 1 < raw.length() && raw.charAt(i + 1) == '\n') {
            i++;
          }
          sb.append(' ');
        }
        case '\n', '\u0085', '\u2028', '\u2029' -> sb.append(' ');
        default -> sb.append(c);
      }
    }
    char last = raw.charAt(raw.length() - 1);
    if (last == '\n' || last == '\r' || last == '\u0085' || last == '\u2028' || last == '\u2029') {
      sb.setLength(sb.length() - 1);
    }
    return sb.toString();
  }
}
