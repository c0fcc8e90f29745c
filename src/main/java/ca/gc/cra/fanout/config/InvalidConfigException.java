package ca.gc.cra.fanout.config;

/**
 * Raised when a YAML configuration file exists but cannot be parsed or has the wrong shape.
 *
 * @since 0.1.0
 */
public final class InvalidConfigException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception.
   *
   * @param message description naming the file and the problem
   * @param cause underlying parse or structure failure
   */
  public InvalidConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
