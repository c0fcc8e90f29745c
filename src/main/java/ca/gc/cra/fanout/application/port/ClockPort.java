package ca.gc.cra.fanout.application.port;

/**
 * Port supplying wall-clock time for elapsed-time accounting.
 *
 * <p>Implementations must be thread-safe; every worker reads the clock around each host.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.fanout.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since the epoch
   */
  long nowMillis();

  /** Default clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
