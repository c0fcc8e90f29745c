package ca.gc.cra.fanout.application.port;

import ca.gc.cra.fanout.domain.job.FailureKind;
import java.util.Objects;

/**
 * Checked exception raised by {@link RemoteShellTransport} adapters when a session cannot be opened or the remote
 * command cannot be driven to completion.
 *
 * @since 0.1.0
 */
public final class RemoteShellException extends Exception {
  private static final long serialVersionUID = 1L;

  private final FailureKind kind;
  private final String capturedOutput;

  /**
   * Creates an exception with a failure class and diagnostic.
   *
   * @param kind failure class used for the host's report line
   * @param message diagnostic shown after the failure label
   */
  public RemoteShellException(FailureKind kind, String message) {
    this(kind, message, "", null);
  }

  /**
   * Creates an exception carrying whatever output was captured before the failure.
   *
   * @param kind failure class
   * @param message diagnostic
   * @param capturedOutput partial output; may be {@code null}
   * @param cause underlying failure; may be {@code null}
   */
  public RemoteShellException(FailureKind kind, String message, String capturedOutput, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.capturedOutput = capturedOutput == null ? "" : capturedOutput;
  }

  public FailureKind kind() {
    return kind;
  }

  public String capturedOutput() {
    return capturedOutput;
  }
}
