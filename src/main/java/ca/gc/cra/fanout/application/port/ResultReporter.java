package ca.gc.cra.fanout.application.port;

import ca.gc.cra.fanout.domain.job.ExecutionResult;

/**
 * <strong>What:</strong> Sink receiving exactly one result per dispatched host.
 * <p><strong>Role:</strong> Driven port implemented by the report writers.</p>
 * <p><strong>Thread-safety:</strong> Called concurrently by every worker; implementations must serialize each
 * write so two results never interleave within a line.</p>
 * <p><strong>Ordering:</strong> Results arrive in completion order, not dispatch order. Implementations must not
 * buffer to reorder them.</p>
 *
 * @since 0.1.0
 */
public interface ResultReporter {
  /**
   * Emits {@code result} immediately.
   *
   * @param result completed job outcome
   */
  void report(ExecutionResult result);
}
