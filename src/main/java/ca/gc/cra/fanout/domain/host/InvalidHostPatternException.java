package ca.gc.cra.fanout.domain.host;

/**
 * Thrown when a host pattern cannot be expanded into a finite list of host names.
 *
 * <p>Raised before any job is created, so callers can reject the run without touching the network.</p>
 *
 * @since 0.1.0
 */
public final class InvalidHostPatternException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String pattern;

  /**
   * Creates an exception describing why {@code pattern} was rejected.
   *
   * @param pattern offending pattern as supplied by the operator; may be {@code null}
   * @param reason human-readable reason
   */
  public InvalidHostPatternException(String pattern, String reason) {
    super("invalid host pattern '" + pattern + "': " + reason);
    this.pattern = pattern;
  }

  /**
   * Returns the rejected pattern.
   *
   * @return pattern text, possibly {@code null}
   */
  public String pattern() {
    return pattern;
  }
}
