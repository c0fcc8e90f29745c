package ca.gc.cra.fanout.domain.job;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when the local script cannot be loaded. The run is aborted before any job is created.
 *
 * @since 0.1.0
 */
public final class ScriptUnreadableException extends IOException {
  private static final long serialVersionUID = 1L;

  /** Why the script could not be loaded. */
  public enum Reason {
    /** No path was supplied, or nothing exists at the path. */
    MISSING,
    /** The path exists but is not a regular file. */
    NOT_A_FILE,
    /** The file exists but could not be read. */
    UNREADABLE
  }

  private final transient Path path;
  private final Reason reason;

  /**
   * Creates an exception for {@code path}.
   *
   * @param path script path; may be {@code null} when none was supplied
   * @param reason failure class
   * @param message human-readable diagnostic
   * @param cause underlying I/O failure; may be {@code null}
   */
  public ScriptUnreadableException(Path path, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
    this.reason = reason;
  }

  /**
   * Returns the offending path.
   *
   * @return script path, possibly {@code null}
   */
  public Path path() {
    return path;
  }

  /**
   * Returns the failure class.
   *
   * @return reason
   */
  public Reason reason() {
    return reason;
  }
}
