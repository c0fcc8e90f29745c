package ca.gc.cra.fanout.domain.job;

/**
 * Raised when the requested worker count is not a positive integer. Always thrown before any session is opened.
 *
 * @since 0.1.0
 */
public final class InvalidConcurrencyException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception for a numeric but non-positive worker count.
   *
   * @param requested requested worker count
   */
  public InvalidConcurrencyException(long requested) {
    super("processes must be a positive integer (was " + requested + ")");
  }

  /**
   * Creates an exception for a worker count that is not a number.
   *
   * @param raw raw text supplied by the operator
   * @param cause parse failure
   */
  public InvalidConcurrencyException(String raw, Throwable cause) {
    super("processes must be a positive integer (was '" + raw + "')", cause);
  }

  /**
   * Parses a worker count from operator input.
   *
   * @param raw text to parse; surrounding whitespace is ignored
   * @return positive worker count
   * @throws InvalidConcurrencyException if the text is missing, non-numeric, or not positive
   */
  public static int parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidConcurrencyException(String.valueOf(raw), null);
    }
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidConcurrencyException(raw, ex);
    }
    if (value < 1) {
      throw new InvalidConcurrencyException(value);
    }
    return value;
  }
}
